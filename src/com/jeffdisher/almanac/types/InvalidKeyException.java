package com.jeffdisher.almanac.types;


/**
 * Thrown when an encryption key is provided in the wrong shape (anything other than 32 raw bytes or 64 hex
 * characters).
 */
public class InvalidKeyException extends AlmanacException
{
	private static final long serialVersionUID = 1L;

	public InvalidKeyException(String message)
	{
		super(ErrorKind.CONFIGURATION, message);
	}
}
