package com.jeffdisher.almanac.types;

import java.time.Instant;


/**
 * Thrown when an "as of" request predates the oldest snapshot still reachable in a dataset's version chain.
 */
public class NoMetadataFoundException extends AlmanacException
{
	private static final long serialVersionUID = 1L;

	public final Instant asOf;

	public NoMetadataFoundException(Instant asOf)
	{
		super(ErrorKind.NOT_FOUND, "No metadata found as of: " + asOf);
		this.asOf = asOf;
	}
}
