package com.jeffdisher.almanac.logic;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.almanac.testutils.MemoryConfigFileSystem;
import com.jeffdisher.almanac.testutils.MockConnection;
import com.jeffdisher.almanac.testutils.MockRegistry;
import com.jeffdisher.almanac.testutils.SilentLogger;
import com.jeffdisher.almanac.testutils.SnapshotBuilder;
import com.jeffdisher.almanac.types.DatasetNotFoundException;
import com.jeffdisher.almanac.types.IpfsConnectionException;
import com.jeffdisher.almanac.types.IpfsFile;
import com.jeffdisher.almanac.types.IpfsKey;
import com.jeffdisher.almanac.types.NoMetadataFoundException;
import com.jeffdisher.almanac.types.VersionSnapshot;


public class TestDatasetClient
{
	private static final IpfsKey POINTER = MockConnection.keyForIndex(1);
	private static final IpfsKey UNPUBLISHED = MockConnection.keyForIndex(2);
	private static final IpfsFile OLD = MockConnection.fileForIndex(1);
	private static final IpfsFile NEW = MockConnection.fileForIndex(2);
	private static final IpfsFile PAYLOAD = MockConnection.fileForIndex(3);

	@Test
	public void endToEnd() throws Throwable
	{
		DatasetClient client = _client(new MockRegistry(new RegistryMapping(Map.of("era5_wind", POINTER, "stale", UNPUBLISHED))));
		Assert.assertEquals(Set.of("era5_wind", "stale"), client.listDatasets());
		
		VersionSnapshot latest = client.resolveDataset("era5_wind", null);
		Assert.assertEquals(NEW, latest.contentId());
		VersionSnapshot older = client.resolveDataset("era5_wind", Instant.parse("2022-06-15T00:00:00Z"));
		Assert.assertEquals(OLD, older.contentId());
		Assert.assertEquals(PAYLOAD, older.payloadRef());
		
		VersionSnapshot metadata = client.getMetadataByKey("era5_wind");
		Assert.assertEquals(NEW, metadata.contentId());
		Assert.assertEquals("2022-07-01T00:00:00Z", metadata.document().get("properties").asObject().getString("updated", null));
	}

	@Test(expected = DatasetNotFoundException.class)
	public void unknownDataset() throws Throwable
	{
		DatasetClient client = _client(new MockRegistry(new RegistryMapping(Map.of("era5_wind", POINTER))));
		client.resolveDataset("cpc_precip", null);
	}

	@Test(expected = NoMetadataFoundException.class)
	public void tooEarly() throws Throwable
	{
		DatasetClient client = _client(new MockRegistry(new RegistryMapping(Map.of("era5_wind", POINTER))));
		client.resolveDataset("era5_wind", Instant.parse("2020-01-01T00:00:00Z"));
	}

	@Test(expected = IpfsConnectionException.class)
	public void pointerNotResolvable() throws Throwable
	{
		DatasetClient client = _client(new MockRegistry(new RegistryMapping(Map.of("stale", UNPUBLISHED))));
		client.getMetadataByKey("stale");
	}


	private static DatasetClient _client(MockRegistry registry)
	{
		MockConnection connection = new MockConnection();
		connection.storeDocument(OLD, SnapshotBuilder.snapshot("2022-06-01T00:00:00Z", null, PAYLOAD));
		connection.storeDocument(NEW, SnapshotBuilder.snapshot("2022-07-01T00:00:00Z", OLD, PAYLOAD));
		connection.publish(POINTER, NEW);
		SilentLogger logger = new SilentLogger();
		NameResolver names = new NameResolver(logger, registry, new MemoryConfigFileSystem());
		VersionChainWalker walker = new VersionChainWalker(connection, logger, VersionChainWalker.DEFAULT_MAX_HOPS);
		return new DatasetClient(names, connection, walker);
	}
}
