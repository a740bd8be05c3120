package com.jeffdisher.almanac.logic;

import java.time.Instant;
import java.util.Set;

import com.jeffdisher.almanac.types.CorruptChainException;
import com.jeffdisher.almanac.types.DatasetNotFoundException;
import com.jeffdisher.almanac.types.FailedDeserializationException;
import com.jeffdisher.almanac.types.IpfsConnectionException;
import com.jeffdisher.almanac.types.IpfsFile;
import com.jeffdisher.almanac.types.IpfsKey;
import com.jeffdisher.almanac.types.NoMetadataFoundException;
import com.jeffdisher.almanac.types.RegistryUnavailableException;
import com.jeffdisher.almanac.types.VersionSnapshot;
import com.jeffdisher.almanac.utils.Assert;


/**
 * The high-level read path:  dataset key to pointer (NameResolver), pointer to head CID (IPNS), head to the snapshot
 * current at the requested time (VersionChainWalker).
 */
public class DatasetClient
{
	private final NameResolver _names;
	private final IConnection _connection;
	private final VersionChainWalker _walker;

	public DatasetClient(NameResolver names, IConnection connection, VersionChainWalker walker)
	{
		_names = names;
		_connection = connection;
		_walker = walker;
	}

	public Set<String> listDatasets() throws RegistryUnavailableException
	{
		return _names.listAll();
	}

	/**
	 * Finds the snapshot of the named dataset which was current at asOf.
	 *
	 * @param datasetKey The dataset name.
	 * @param asOf The cutoff time, inclusive, or null for the latest snapshot.
	 * @return The snapshot.
	 * @throws DatasetNotFoundException The dataset key is unknown.
	 * @throws NoMetadataFoundException The dataset has no snapshot as old as asOf.
	 * @throws CorruptChainException The version chain is cyclic or too long.
	 * @throws IpfsConnectionException The pointer or a snapshot couldn't be fetched.
	 * @throws FailedDeserializationException A snapshot was malformed.
	 */
	public VersionSnapshot resolveDataset(String datasetKey, Instant asOf) throws DatasetNotFoundException, NoMetadataFoundException, CorruptChainException, IpfsConnectionException, FailedDeserializationException
	{
		IpfsKey pointer = _names.resolve(datasetKey);
		IpfsFile head = _connection.resolvePointer(pointer);
		return _walker.resolveAsOf(head, asOf);
	}

	/**
	 * @param datasetKey The dataset name.
	 * @return The latest snapshot of the dataset (its "document" is the full STAC metadata).
	 */
	public VersionSnapshot getMetadataByKey(String datasetKey) throws DatasetNotFoundException, IpfsConnectionException, FailedDeserializationException
	{
		IpfsKey pointer = _names.resolve(datasetKey);
		IpfsFile head = _connection.resolvePointer(pointer);
		try
		{
			return _walker.resolveAsOf(head, null);
		}
		catch (NoMetadataFoundException | CorruptChainException e)
		{
			// The head is returned directly when there is no cutoff so the walk can't fail this way.
			throw Assert.unexpected(e);
		}
	}
}
