package com.jeffdisher.almanac.types;


/**
 * This exception is used when something goes wrong talking to the IPFS daemon.
 * Note that the daemon will often search the network until it times out when asked for a CID it can't find, so a
 * missing snapshot usually shows up as this exception, not as a distinct "not found".
 */
public class IpfsConnectionException extends AlmanacException
{
	private static final long serialVersionUID = 1L;

	public IpfsConnectionException(String action, Object context, Exception underlyingException)
	{
		super(ErrorKind.UNAVAILABLE, "IPFS connection failure during \"" + action + "\" on " + context, underlyingException);
	}
}
