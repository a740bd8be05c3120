package com.jeffdisher.almanac.types;


/**
 * Thrown when the dataset registry can't be used:  either the remote fetch failed (which callers normally recover
 * from using the local cache) or neither the registry nor the cache could produce a dataset list.
 */
public class RegistryUnavailableException extends AlmanacException
{
	private static final long serialVersionUID = 1L;

	public RegistryUnavailableException(String message)
	{
		super(ErrorKind.UNAVAILABLE, message);
	}

	public RegistryUnavailableException(String message, Exception cause)
	{
		super(ErrorKind.UNAVAILABLE, message, cause);
	}
}
