package com.jeffdisher.almanac.types;

import java.util.regex.Pattern;


/**
 * A mutable pointer:  an IPNS name which the IPFS node resolves to whichever CID was most recently published under it.
 * NOTE:  Names have multiple encodings (base-36 "k51..." from "ipfs key gen", base-58 "12D3Koo..."/"Qm..." peer IDs,
 * or even a CID when the registry points straight at content) so we only check that the string is a plausible
 * multibase token and keep it verbatim.  An "/ipns/" path prefix is accepted and dropped.
 */
public class IpfsKey
{
	private static final Pattern NAME = Pattern.compile("[0-9A-Za-z]{16,}");
	private static final String IPNS_PATH_PREFIX = "/ipns/";

	/**
	 * @param keyAsString The encoded IPNS name, optionally as an "/ipns/" path.
	 * @return The IpfsKey or null if the encoding was invalid.
	 */
	public static IpfsKey fromPublicKey(String keyAsString)
	{
		String name = ((null != keyAsString) && keyAsString.startsWith(IPNS_PATH_PREFIX))
				? keyAsString.substring(IPNS_PATH_PREFIX.length())
				: keyAsString
		;
		IpfsKey key = null;
		if ((null != name) && NAME.matcher(name).matches())
		{
			key = new IpfsKey(name);
		}
		return key;
	}


	private final String _key;

	private IpfsKey(String key)
	{
		_key = key;
	}

	public String toPublicKey()
	{
		return _key;
	}

	@Override
	public boolean equals(Object obj)
	{
		boolean isEqual = false;
		if (obj instanceof IpfsKey)
		{
			isEqual = _key.equals(((IpfsKey)obj)._key);
		}
		return isEqual;
	}

	@Override
	public int hashCode()
	{
		return _key.hashCode();
	}

	@Override
	public String toString()
	{
		return "IpfsKey(" + _key + ")";
	}
}
