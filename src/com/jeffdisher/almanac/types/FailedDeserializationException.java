package com.jeffdisher.almanac.types;


/**
 * This exception is used in the case where a piece of meta-data couldn't be decoded since it appeared to be malformed.
 * This typically means that the wrong kind of data was referenced.
 */
public class FailedDeserializationException extends AlmanacException
{
	private static final long serialVersionUID = 1L;

	public FailedDeserializationException(Class<?> expectedType, String detail)
	{
		super(ErrorKind.PROTOCOL, "Data could not be deserialized as " + expectedType.getName() + ": " + detail);
	}

	public FailedDeserializationException(Class<?> expectedType, Exception cause)
	{
		super(ErrorKind.PROTOCOL, "Data could not be deserialized as " + expectedType.getName(), cause);
	}
}
