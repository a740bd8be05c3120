package com.jeffdisher.almanac.logic;

import com.jeffdisher.almanac.types.IpfsConnectionException;
import com.jeffdisher.almanac.types.IpfsFile;
import com.jeffdisher.almanac.types.IpfsKey;


/**
 * The abstract interface sitting on top of the IPFS connection, allowing for local testing.
 * Everything here is read-only:  we never publish or store data.
 */
public interface IConnection
{
	/**
	 * Loads one snapshot document, as a JSON DAG node, from the node.
	 * 
	 * @param cid The CID of the document.
	 * @return The raw JSON bytes of the document.
	 * @throws IpfsConnectionException If an error was encountered when attempting the load (this includes the node
	 * giving up on finding the CID).
	 */
	byte[] loadSnapshotDocument(IpfsFile cid) throws IpfsConnectionException;

	/**
	 * Returns the file currently published under the given pointer.
	 * 
	 * @param pointer The IPNS name to resolve.
	 * @return The published file (never null).
	 * @throws IpfsConnectionException If the name couldn't be resolved or resolved to something which isn't a CID.
	 */
	IpfsFile resolvePointer(IpfsKey pointer) throws IpfsConnectionException;
}
