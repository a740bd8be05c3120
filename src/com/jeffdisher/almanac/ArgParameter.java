package com.jeffdisher.almanac;


/**
 * The description of a single command-line parameter.
 */
public class ArgParameter
{
	public final String name;
	public final ParameterType type;
	private final String _description;

	/**
	 * @param name The parameter name (typically something like "--param").
	 * @param type The type into which the parameter value should be parsed.
	 * @param description The human-readable description of what the parameter does.
	 */
	public ArgParameter(String name, ParameterType type, String description)
	{
		this.name = name;
		this.type = type;
		_description = description;
	}

	public String shortDescription()
	{
		return this.name + " <" + this.type.shortDescription + ">";
	}

	public String longDescription()
	{
		return shortDescription() + " : " + _description;
	}
}
