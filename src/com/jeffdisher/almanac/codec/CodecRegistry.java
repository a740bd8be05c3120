package com.jeffdisher.almanac.codec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.almanac.types.UsageException;
import com.jeffdisher.almanac.utils.Assert;


/**
 * Maps codec identifiers to factories so a storage layer can build the codecs named in a chunk's pipeline
 * configuration.  Configuration objects always have an "id" plus whatever non-secret fields that codec reads.
 */
public class CodecRegistry
{
	public static final String CONFIG_ID = "id";

	/**
	 * @return A registry with the built-in codecs ("xchacha20poly1305" and "zlib").
	 */
	public static CodecRegistry withBuiltIns()
	{
		CodecRegistry registry = new CodecRegistry();
		registry.register(EncryptionCodec.CODEC_ID, (JsonObject config, KeyContext keys) -> EncryptionCodec.fromConfig(config, keys));
		registry.register(ZlibCodec.CODEC_ID, (JsonObject config, KeyContext keys) -> ZlibCodec.fromConfig(config));
		return registry;
	}


	private final Map<String, ICodecFactory> _factories;

	public CodecRegistry()
	{
		_factories = new HashMap<>();
	}

	/**
	 * @param codecId The identifier (must not already be registered).
	 * @param factory The factory for codecs of this type.
	 */
	public void register(String codecId, ICodecFactory factory)
	{
		ICodecFactory previous = _factories.put(codecId, factory);
		Assert.assertTrue(null == previous);
	}

	/**
	 * Builds a single codec from its configuration.
	 * 
	 * @param config The configuration object (must have an "id").
	 * @param keys The key context for codecs which need one.
	 * @return The codec.
	 * @throws UsageException The id is missing or unknown, or the codec rejected the configuration.
	 */
	public IChunkCodec createCodec(JsonObject config, KeyContext keys) throws UsageException
	{
		JsonValue id = config.get(CONFIG_ID);
		if ((null == id) || !id.isString())
		{
			throw new UsageException("Codec configuration has no \"id\": " + config);
		}
		ICodecFactory factory = _factories.get(id.asString());
		if (null == factory)
		{
			throw new UsageException("Unknown codec: \"" + id.asString() + "\"");
		}
		return factory.create(config, keys);
	}

	/**
	 * Builds a pipeline from an ordered array of codec configurations (first is applied first on encode).
	 * 
	 * @param configs The configuration array.
	 * @param keys The key context for codecs which need one.
	 * @return The pipeline.
	 * @throws UsageException An element isn't an object or couldn't be built.
	 */
	public CodecPipeline createPipeline(JsonArray configs, KeyContext keys) throws UsageException
	{
		List<IChunkCodec> codecs = new ArrayList<>();
		for (JsonValue config : configs)
		{
			if (!config.isObject())
			{
				throw new UsageException("Codec configuration is not an object: " + config);
			}
			codecs.add(createCodec(config.asObject(), keys));
		}
		return new CodecPipeline(codecs);
	}


	/**
	 * Builds one codec instance from its configuration.
	 */
	public interface ICodecFactory
	{
		IChunkCodec create(JsonObject config, KeyContext keys) throws UsageException;
	}
}
