package com.jeffdisher.almanac.codec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.almanac.types.IntegrityException;


public class TestZlibCodec
{
	@Test
	public void largeChunk() throws Throwable
	{
		// Bigger than the internal buffer, in both directions.
		byte[] chunk = new byte[100_000];
		for (int i = 0; i < chunk.length; ++i)
		{
			chunk[i] = (byte)(i % 17);
		}
		ZlibCodec codec = new ZlibCodec(ZlibCodec.DEFAULT_LEVEL);
		byte[] encoded = codec.encode(chunk);
		Assert.assertTrue(encoded.length < chunk.length);
		Assert.assertArrayEquals(chunk, codec.decode(encoded));
	}

	@Test(expected = IntegrityException.class)
	public void notCompressed() throws Throwable
	{
		new ZlibCodec(ZlibCodec.DEFAULT_LEVEL).decode("plain text, not zlib".getBytes(StandardCharsets.UTF_8));
	}

	@Test(expected = IntegrityException.class)
	public void truncated() throws Throwable
	{
		ZlibCodec codec = new ZlibCodec(6);
		byte[] encoded = codec.encode("some data which compresses to more than a few bytes".getBytes(StandardCharsets.UTF_8));
		codec.decode(Arrays.copyOf(encoded, encoded.length / 2));
	}
}
