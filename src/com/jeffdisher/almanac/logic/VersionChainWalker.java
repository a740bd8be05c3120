package com.jeffdisher.almanac.logic;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import com.jeffdisher.almanac.types.CorruptChainException;
import com.jeffdisher.almanac.types.FailedDeserializationException;
import com.jeffdisher.almanac.types.IpfsConnectionException;
import com.jeffdisher.almanac.types.IpfsFile;
import com.jeffdisher.almanac.types.NoMetadataFoundException;
import com.jeffdisher.almanac.types.VersionSnapshot;
import com.jeffdisher.almanac.utils.Assert;


/**
 * Walks a dataset's version chain backward from its head to find the snapshot which was current at a given time.
 * This is a linear scan:  each hop needs the previous document to be fetched before we know where the next one is, so
 * there is nothing to index or parallelize.
 */
public class VersionChainWalker
{
	/**
	 * Real chains get one new snapshot per publish so even a decade of hourly updates is well under this.
	 */
	public static final int DEFAULT_MAX_HOPS = 10_000;

	private final IConnection _connection;
	private final ILogger _logger;
	private final int _maxHops;

	public VersionChainWalker(IConnection connection, ILogger logger, int maxHops)
	{
		Assert.assertTrue(null != connection);
		Assert.assertTrue(null != logger);
		Assert.assertTrue(maxHops >= 0);
		_connection = connection;
		_logger = logger;
		_maxHops = maxHops;
	}

	/**
	 * Finds the most recent snapshot created at or before asOf.
	 *
	 * @param head The CID of the newest snapshot in the chain.
	 * @param asOf The cutoff time, inclusive.  If null, the head snapshot is returned.
	 * @return The matching snapshot (never null).
	 * @throws NoMetadataFoundException Every snapshot in the chain was created after asOf.
	 * @throws CorruptChainException The chain revisited a snapshot or was longer than the hop limit.
	 * @throws IpfsConnectionException A snapshot couldn't be fetched (the walk is abandoned).
	 * @throws FailedDeserializationException A snapshot document was malformed.
	 */
	public VersionSnapshot resolveAsOf(IpfsFile head, Instant asOf) throws NoMetadataFoundException, CorruptChainException, IpfsConnectionException, FailedDeserializationException
	{
		Assert.assertTrue(null != head);
		ILogger log = _logger.logStart("Walking version chain from " + head.toSafeString() + " as of " + ((null != asOf) ? asOf : "now"));
		VersionSnapshot current = _load(head);
		if (null != asOf)
		{
			Set<IpfsFile> visited = new HashSet<>();
			visited.add(head);
			int hops = 0;
			while (current.createdAt().isAfter(asOf))
			{
				IpfsFile previous = current.previous();
				if (null == previous)
				{
					log.logFinish("Reached root after " + hops + " hops");
					throw new NoMetadataFoundException(asOf);
				}
				hops += 1;
				if (hops > _maxHops)
				{
					log.logFinish("Abandoned walk");
					throw new CorruptChainException(head, "exceeded " + _maxHops + " hops");
				}
				if (!visited.add(previous))
				{
					log.logFinish("Abandoned walk");
					throw new CorruptChainException(head, "cycle at " + previous.toSafeString());
				}
				log.logVerbose("Following previous link to " + previous.toSafeString());
				current = _load(previous);
			}
			log.logFinish("Found " + current.contentId().toSafeString() + " (created " + current.createdAt() + ") after " + hops + " hops");
		}
		else
		{
			log.logFinish("Using head (created " + current.createdAt() + ")");
		}
		return current;
	}


	private VersionSnapshot _load(IpfsFile cid) throws IpfsConnectionException, FailedDeserializationException
	{
		byte[] raw = _connection.loadSnapshotDocument(cid);
		return SnapshotDocument.parse(cid, raw);
	}
}
