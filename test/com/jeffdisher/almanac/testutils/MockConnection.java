package com.jeffdisher.almanac.testutils;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import com.jeffdisher.almanac.logic.IConnection;
import com.jeffdisher.almanac.types.IpfsConnectionException;
import com.jeffdisher.almanac.types.IpfsFile;
import com.jeffdisher.almanac.types.IpfsKey;


/**
 * An in-memory stand-in for the IPFS node:  documents are stored under whatever CID the test chooses (which allows
 * building cyclic chains) and pointers are "published" directly.
 */
public class MockConnection implements IConnection
{
	/**
	 * @param index Any non-negative number.
	 * @return A distinct, well-formed (base-16 CIDv1) file for each index.
	 */
	public static IpfsFile fileForIndex(int index)
	{
		return IpfsFile.fromIpfsCid(String.format("f01551220%064x", index));
	}

	/**
	 * @param index Any non-negative number.
	 * @return A distinct, well-formed (base-36) pointer for each index.
	 */
	public static IpfsKey keyForIndex(int index)
	{
		return IpfsKey.fromPublicKey(String.format("k51qzi5uqu5d%040d", index));
	}


	private final Map<IpfsFile, byte[]> _documents = new HashMap<>();
	private final Map<IpfsKey, IpfsFile> _pointers = new HashMap<>();
	private int _loadCount;

	public void storeDocument(IpfsFile cid, byte[] document)
	{
		_documents.put(cid, document);
	}

	public void publish(IpfsKey pointer, IpfsFile cid)
	{
		_pointers.put(pointer, cid);
	}

	/**
	 * @return The number of document loads attempted (including ones which failed).
	 */
	public int getLoadCount()
	{
		return _loadCount;
	}

	@Override
	public byte[] loadSnapshotDocument(IpfsFile cid) throws IpfsConnectionException
	{
		_loadCount += 1;
		byte[] document = _documents.get(cid);
		if (null == document)
		{
			throw new IpfsConnectionException("dag/get", cid, new IOException("Not stored"));
		}
		return document;
	}

	@Override
	public IpfsFile resolvePointer(IpfsKey pointer) throws IpfsConnectionException
	{
		IpfsFile cid = _pointers.get(pointer);
		if (null == cid)
		{
			throw new IpfsConnectionException("name/resolve", pointer, new IOException("Not published"));
		}
		return cid;
	}
}
