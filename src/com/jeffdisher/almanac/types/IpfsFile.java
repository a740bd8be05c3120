package com.jeffdisher.almanac.types;

import java.util.regex.Pattern;


/**
 * A wrapper over the string encoding of an IPFS CID, used for immutable content identifiers (snapshot documents and
 * the payloads they reference).
 * We accept CIDv0 ("Qm" base-58) and the common multibase encodings of CIDv1 (base-32 "b", base-36 "k", base-58
 * "z", base-16 "f").  The encoding is kept exactly as given since the IPFS RPC API accepts all of them.
 */
public class IpfsFile
{
	private static final Pattern CID_V0 = Pattern.compile("Qm[1-9A-HJ-NP-Za-km-z]{44}");
	private static final Pattern CID_V1 = Pattern.compile("(b[a-z2-7]{16,})|(k[0-9a-z]{16,})|(z[1-9A-HJ-NP-Za-km-z]{16,})|(f[0-9a-f]{16,})");

	/**
	 * @param cid The encoded CID.
	 * @return The IpfsFile or null if the encoding was invalid.
	 */
	public static IpfsFile fromIpfsCid(String cid)
	{
		IpfsFile file = null;
		if ((null != cid) && (CID_V0.matcher(cid).matches() || CID_V1.matcher(cid).matches()))
		{
			file = new IpfsFile(cid);
		}
		return file;
	}


	private final String _cid;

	private IpfsFile(String cid)
	{
		_cid = cid;
	}

	/**
	 * @return The CID, in the encoding it was created from.
	 */
	public String toSafeString()
	{
		return _cid;
	}

	@Override
	public boolean equals(Object obj)
	{
		boolean isEqual = false;
		if (obj instanceof IpfsFile)
		{
			isEqual = _cid.equals(((IpfsFile)obj)._cid);
		}
		return isEqual;
	}

	@Override
	public int hashCode()
	{
		return _cid.hashCode();
	}

	@Override
	public String toString()
	{
		return "IpfsFile(" + _cid + ")";
	}
}
