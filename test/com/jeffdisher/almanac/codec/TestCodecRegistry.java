package com.jeffdisher.almanac.codec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonObject;
import com.jeffdisher.almanac.types.IntegrityException;
import com.jeffdisher.almanac.types.UsageException;


public class TestCodecRegistry
{
	@Test
	public void compressThenEncrypt() throws Throwable
	{
		KeyContext keys = new KeyContext();
		keys.setKey(new byte[32]);
		JsonArray config = new JsonArray()
				.add(new JsonObject().add("id", "zlib").add("level", 9))
				.add(new JsonObject().add("id", "xchacha20poly1305"))
		;
		CodecPipeline pipeline = CodecRegistry.withBuiltIns().createPipeline(config, keys);
		Assert.assertEquals(2, pipeline.getCodecs().size());
		Assert.assertEquals("zlib", pipeline.getCodecs().get(0).getCodecId());
		
		byte[] chunk = new byte[4096];
		Arrays.fill(chunk, (byte)'a');
		byte[] encoded = pipeline.encode(chunk);
		// Compression ran first, or the frame would be larger than the input.
		Assert.assertTrue(encoded.length < chunk.length);
		Assert.assertArrayEquals(chunk, pipeline.decode(encoded));
		
		// The written configuration rebuilds an equivalent pipeline.
		CodecPipeline rebuilt = CodecRegistry.withBuiltIns().createPipeline(pipeline.getConfig(), keys);
		Assert.assertArrayEquals(chunk, rebuilt.decode(encoded));
	}

	@Test(expected = IntegrityException.class)
	public void pipelineRejectsTampering() throws Throwable
	{
		KeyContext keys = new KeyContext();
		keys.setKey(new byte[32]);
		JsonArray config = new JsonArray()
				.add(new JsonObject().add("id", "zlib"))
				.add(new JsonObject().add("id", "xchacha20poly1305").add("header", "h"))
		;
		CodecPipeline pipeline = CodecRegistry.withBuiltIns().createPipeline(config, keys);
		byte[] encoded = pipeline.encode("data".getBytes(StandardCharsets.UTF_8));
		encoded[encoded.length - 1] ^= 1;
		pipeline.decode(encoded);
	}

	@Test
	public void badConfigurations() throws Throwable
	{
		CodecRegistry registry = CodecRegistry.withBuiltIns();
		KeyContext keys = new KeyContext();
		JsonObject[] bad = {
				new JsonObject(),
				new JsonObject().add("id", 5),
				new JsonObject().add("id", "blosc"),
				new JsonObject().add("id", "zlib").add("level", 10),
				new JsonObject().add("id", "zlib").add("level", "fast"),
				new JsonObject().add("id", "xchacha20poly1305").add("header", 1),
		};
		for (JsonObject config : bad)
		{
			try
			{
				registry.createCodec(config, keys);
				Assert.fail(config.toString());
			}
			catch (UsageException e)
			{
				// Expected.
			}
		}
		try
		{
			registry.createPipeline(new JsonArray().add("zlib"), keys);
			Assert.fail();
		}
		catch (UsageException e)
		{
			// Expected.
		}
	}

	@Test
	public void customCodec() throws Throwable
	{
		CodecRegistry registry = new CodecRegistry();
		registry.register("zlib-fast", (JsonObject config, KeyContext keys) -> new ZlibCodec(1));
		IChunkCodec codec = registry.createCodec(new JsonObject().add("id", "zlib-fast"), new KeyContext());
		Assert.assertEquals(ZlibCodec.CODEC_ID, codec.getCodecId());
	}

	@Test(expected = AssertionError.class)
	public void duplicateRegistration() throws Throwable
	{
		CodecRegistry registry = CodecRegistry.withBuiltIns();
		registry.register(ZlibCodec.CODEC_ID, (JsonObject config, KeyContext keys) -> new ZlibCodec(1));
	}
}
