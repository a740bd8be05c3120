package com.jeffdisher.almanac.logic;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

import com.jeffdisher.almanac.types.DatasetNotFoundException;
import com.jeffdisher.almanac.types.FailedDeserializationException;
import com.jeffdisher.almanac.types.IpfsKey;
import com.jeffdisher.almanac.types.RegistryUnavailableException;
import com.jeffdisher.almanac.utils.Assert;


/**
 * Maps dataset keys to their mutable pointers.
 * The remote registry is always consulted first and a successful fetch refreshes the local cache (only if the content
 * changed).  If the registry can't be used for any reason, we silently fall back to the local cache, which is then the
 * only source:  failures to use the cache at that point are surfaced.
 * Note that this is not synchronized against other processes updating the same cache file.
 */
public class NameResolver
{
	public static final String CACHE_FILE_NAME = "cids.json";

	private final ILogger _logger;
	private final IRegistry _registry;
	private final IConfigFileSystem _fileSystem;

	public NameResolver(ILogger logger, IRegistry registry, IConfigFileSystem fileSystem)
	{
		Assert.assertTrue(null != logger);
		Assert.assertTrue(null != registry);
		Assert.assertTrue(null != fileSystem);
		_logger = logger;
		_registry = registry;
		_fileSystem = fileSystem;
	}

	/**
	 * Resolves the given dataset key to its current pointer.
	 *
	 * @param datasetKey The dataset name.
	 * @return The pointer (never null).
	 * @throws DatasetNotFoundException The key isn't in the registry, or the registry is unavailable and the key
	 * couldn't be found in the local cache (including the cache being missing or corrupt).
	 */
	public IpfsKey resolve(String datasetKey) throws DatasetNotFoundException
	{
		ILogger log = _logger.logStart("Resolving dataset \"" + datasetKey + "\"...");
		RegistryMapping mapping = _fetchAndRefreshCache(log);
		if (null == mapping)
		{
			try
			{
				mapping = _readCache();
			}
			catch (IOException | FailedDeserializationException e)
			{
				log.logFinish("Local cache unusable");
				throw new DatasetNotFoundException(datasetKey, e);
			}
		}
		IpfsKey pointer = (null != mapping)
				? mapping.lookup(datasetKey)
				: null
		;
		if (null == pointer)
		{
			String raw = (null != mapping)
					? mapping.getRawValue(datasetKey)
					: null
			;
			log.logFinish((null != raw)
					? ("Listed value is not a usable pointer: \"" + raw + "\"")
					: "Not found"
			);
			throw new DatasetNotFoundException(datasetKey);
		}
		log.logFinish("Resolved to " + pointer.toPublicKey());
		return pointer;
	}

	/**
	 * Lists every dataset key known to the registry or, if the registry is unavailable, the local cache.
	 *
	 * @return The set of dataset keys (never null).
	 * @throws RegistryUnavailableException Neither the registry nor the local cache could be used.
	 */
	public Set<String> listAll() throws RegistryUnavailableException
	{
		ILogger log = _logger.logStart("Listing datasets...");
		RegistryMapping mapping = _fetchAndRefreshCache(log);
		if (null == mapping)
		{
			try
			{
				mapping = _readCache();
			}
			catch (IOException | FailedDeserializationException e)
			{
				log.logFinish("Local cache unusable");
				throw new RegistryUnavailableException("Failed to retrieve dataset list from registry or local cache", e);
			}
			if (null == mapping)
			{
				log.logFinish("No local cache");
				throw new RegistryUnavailableException("Failed to retrieve dataset list from registry or local cache");
			}
		}
		log.logFinish("Found " + mapping.keys().size() + " datasets");
		return mapping.keys();
	}


	// Returns null if the registry couldn't be used.
	private RegistryMapping _fetchAndRefreshCache(ILogger log)
	{
		RegistryMapping fresh;
		try
		{
			fresh = _registry.fetchMapping();
		}
		catch (RegistryUnavailableException e)
		{
			log.logVerbose("Registry unavailable, using local cache in " + _fileSystem.getDirectoryForReporting() + ": " + e.getLocalizedMessage());
			return null;
		}

		// A missing or broken cache is the same as an empty one, here.
		RegistryMapping cached;
		try
		{
			cached = _readCache();
		}
		catch (IOException | FailedDeserializationException e)
		{
			log.logVerbose("Replacing unreadable local cache: " + e.getLocalizedMessage());
			cached = null;
		}
		if (null == cached)
		{
			cached = RegistryMapping.EMPTY;
		}

		if (!fresh.equals(cached))
		{
			try (IConfigFileSystem.AtomicOutputStream output = _fileSystem.writeAtomicFile(CACHE_FILE_NAME))
			{
				output.getStream().write(fresh.toJson());
				output.commit();
				log.logVerbose("Updated local cache with " + fresh.keys().size() + " datasets");
			}
			catch (IOException e)
			{
				// We still have the fresh data so this only matters for the next offline run.
				log.logError("Failed to update local registry cache in " + _fileSystem.getDirectoryForReporting() + ": " + e.getLocalizedMessage());
			}
		}
		return fresh;
	}

	// Returns null if there is no cache file.
	private RegistryMapping _readCache() throws IOException, FailedDeserializationException
	{
		RegistryMapping cached = null;
		try (InputStream stream = _fileSystem.readAtomicFile(CACHE_FILE_NAME))
		{
			if (null != stream)
			{
				cached = RegistryMapping.fromJson(stream.readAllBytes());
			}
		}
		return cached;
	}
}
