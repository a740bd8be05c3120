package com.jeffdisher.almanac.types;


/**
 * Thrown when a chunk fails authentication on decode.  This means the chunk was modified, was encrypted under a
 * different key, or was encrypted with a different header.  No plaintext is ever returned alongside this.
 */
public class IntegrityException extends AlmanacException
{
	private static final long serialVersionUID = 1L;

	public IntegrityException(String message)
	{
		super(ErrorKind.INTEGRITY, message);
	}

	public IntegrityException(String message, Exception cause)
	{
		super(ErrorKind.INTEGRITY, message, cause);
	}
}
