package com.jeffdisher.almanac.types;


/**
 * Thrown when an operation needs configuration which hasn't been provided (the encryption key, in practice).
 */
public class MisconfiguredException extends AlmanacException
{
	private static final long serialVersionUID = 1L;

	public MisconfiguredException(String message)
	{
		super(ErrorKind.CONFIGURATION, message);
	}
}
