package com.jeffdisher.almanac.types;


/**
 * Thrown when a version chain walk revisits a snapshot or runs past the configured hop limit.  Either case means the
 * chain can't be trusted, since a valid chain is acyclic and ends at a root.
 */
public class CorruptChainException extends AlmanacException
{
	private static final long serialVersionUID = 1L;

	public final IpfsFile head;

	public CorruptChainException(IpfsFile head, String message)
	{
		super(ErrorKind.PROTOCOL, "Corrupt version chain from " + head + ": " + message);
		this.head = head;
	}
}
