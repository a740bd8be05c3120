package com.jeffdisher.almanac.types;


/**
 * Superclass of all Almanac's internal exceptions.
 */
public class AlmanacException extends Exception
{
	private static final long serialVersionUID = 1L;

	private final ErrorKind _kind;

	public AlmanacException(ErrorKind kind, String message)
	{
		super(message);
		_kind = kind;
	}

	public AlmanacException(ErrorKind kind, String message, Exception exception)
	{
		super(message, exception);
		_kind = kind;
	}

	/**
	 * @return The category of this failure.
	 */
	public ErrorKind getKind()
	{
		return _kind;
	}
}
