package com.jeffdisher.almanac.codec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.almanac.types.ErrorKind;
import com.jeffdisher.almanac.types.IntegrityException;
import com.jeffdisher.almanac.types.MisconfiguredException;


public class TestEncryptionCodec
{
	private static final String HEX_KEY = "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";
	private static final byte[] CHUNK = "Temperature at 2m, 0.25 degree grid, one hour of data".getBytes(StandardCharsets.UTF_8);

	@Test
	public void roundTrip() throws Throwable
	{
		EncryptionCodec codec = new EncryptionCodec(_keys(), EncryptionCodec.DEFAULT_HEADER);
		byte[] frame = codec.encode(CHUNK);
		Assert.assertEquals(CHUNK.length + EncryptionCodec.FRAME_OVERHEAD_BYTES, frame.length);
		Assert.assertEquals(40, EncryptionCodec.FRAME_OVERHEAD_BYTES);
		Assert.assertArrayEquals(CHUNK, codec.decode(frame));
	}

	@Test
	public void emptyChunk() throws Throwable
	{
		EncryptionCodec codec = new EncryptionCodec(_keys(), EncryptionCodec.DEFAULT_HEADER);
		byte[] frame = codec.encode(new byte[0]);
		Assert.assertEquals(EncryptionCodec.FRAME_OVERHEAD_BYTES, frame.length);
		Assert.assertEquals(0, codec.decode(frame).length);
	}

	@Test
	public void frameLayout() throws Throwable
	{
		// The frame must be nonce | tag | ciphertext, which we can check by rebuilding the cipher's own layout.
		KeyContext keys = _keys();
		EncryptionCodec codec = new EncryptionCodec(keys, "layout");
		byte[] frame = codec.encode(CHUNK);
		byte[] nonce = Arrays.copyOfRange(frame, 0, 24);
		byte[] tag = Arrays.copyOfRange(frame, 24, 40);
		byte[] ciphertext = Arrays.copyOfRange(frame, 40, frame.length);
		byte[] sealed = XChaCha20Poly1305.seal(keys.requireKey(), nonce, "layout".getBytes(StandardCharsets.UTF_8), CHUNK);
		Assert.assertArrayEquals(ciphertext, Arrays.copyOfRange(sealed, 0, ciphertext.length));
		Assert.assertArrayEquals(tag, Arrays.copyOfRange(sealed, ciphertext.length, sealed.length));
	}

	@Test
	public void noncesAreFresh() throws Throwable
	{
		EncryptionCodec codec = new EncryptionCodec(_keys(), EncryptionCodec.DEFAULT_HEADER);
		byte[] one = codec.encode(CHUNK);
		byte[] two = codec.encode(CHUNK);
		Assert.assertFalse(Arrays.equals(Arrays.copyOfRange(one, 0, 24), Arrays.copyOfRange(two, 0, 24)));
		Assert.assertFalse(Arrays.equals(one, two));
	}

	@Test
	public void everyBitFlipDetected() throws Throwable
	{
		EncryptionCodec codec = new EncryptionCodec(_keys(), EncryptionCodec.DEFAULT_HEADER);
		byte[] frame = codec.encode(CHUNK);
		for (int i = 0; i < frame.length; ++i)
		{
			for (int bit = 0; bit < 8; ++bit)
			{
				byte[] corrupt = frame.clone();
				corrupt[i] ^= (byte)(1 << bit);
				try
				{
					codec.decode(corrupt);
					Assert.fail("byte " + i + " bit " + bit);
				}
				catch (IntegrityException e)
				{
					Assert.assertEquals(ErrorKind.INTEGRITY, e.getKind());
				}
			}
		}
	}

	@Test
	public void truncatedFrames() throws Throwable
	{
		EncryptionCodec codec = new EncryptionCodec(_keys(), EncryptionCodec.DEFAULT_HEADER);
		byte[] frame = codec.encode(CHUNK);
		int[] lengths = { 0, 1, 24, 39, 40, frame.length - 1 };
		for (int length : lengths)
		{
			try
			{
				codec.decode(Arrays.copyOf(frame, length));
				Assert.fail("length " + length);
			}
			catch (IntegrityException e)
			{
				// Expected.
			}
		}
	}

	@Test(expected = IntegrityException.class)
	public void headerMismatch() throws Throwable
	{
		KeyContext keys = _keys();
		byte[] frame = new EncryptionCodec(keys, "dataset-one").encode(CHUNK);
		new EncryptionCodec(keys, "dataset-two").decode(frame);
	}

	@Test(expected = IntegrityException.class)
	public void keyMismatch() throws Throwable
	{
		byte[] frame = new EncryptionCodec(_keys(), EncryptionCodec.DEFAULT_HEADER).encode(CHUNK);
		KeyContext other = new KeyContext();
		other.setKey(new byte[32]);
		new EncryptionCodec(other, EncryptionCodec.DEFAULT_HEADER).decode(frame);
	}

	@Test
	public void keyRequired() throws Throwable
	{
		KeyContext keys = new KeyContext();
		// Construction is allowed before the key is known.
		EncryptionCodec codec = new EncryptionCodec(keys, EncryptionCodec.DEFAULT_HEADER);
		try
		{
			codec.encode(CHUNK);
			Assert.fail();
		}
		catch (MisconfiguredException e)
		{
			// Expected.
		}
		try
		{
			codec.decode(new byte[64]);
			Assert.fail();
		}
		catch (MisconfiguredException e)
		{
			// Expected.
		}
		keys.setKeyHex(HEX_KEY);
		Assert.assertArrayEquals(CHUNK, codec.decode(codec.encode(CHUNK)));
	}

	@Test
	public void decodeIntoBuffer() throws Throwable
	{
		EncryptionCodec codec = new EncryptionCodec(_keys(), EncryptionCodec.DEFAULT_HEADER);
		byte[] frame = codec.encode(CHUNK);
		byte[] out = new byte[CHUNK.length + 10];
		Arrays.fill(out, (byte)0x55);
		Assert.assertSame(out, codec.decode(frame, out));
		Assert.assertArrayEquals(CHUNK, Arrays.copyOf(out, CHUNK.length));
		Assert.assertEquals(0x55, out[CHUNK.length]);
	}

	@Test
	public void failedDecodeLeavesBufferUntouched() throws Throwable
	{
		EncryptionCodec codec = new EncryptionCodec(_keys(), EncryptionCodec.DEFAULT_HEADER);
		byte[] frame = codec.encode(CHUNK);
		frame[frame.length - 1] ^= 1;
		byte[] out = new byte[CHUNK.length];
		Arrays.fill(out, (byte)0x55);
		try
		{
			codec.decode(frame, out);
			Assert.fail();
		}
		catch (IntegrityException e)
		{
			// Expected.
		}
		for (byte b : out)
		{
			Assert.assertEquals(0x55, b);
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void bufferTooSmall() throws Throwable
	{
		EncryptionCodec codec = new EncryptionCodec(_keys(), EncryptionCodec.DEFAULT_HEADER);
		codec.decode(codec.encode(CHUNK), new byte[CHUNK.length - 1]);
	}

	@Test
	public void configNeverCarriesKey() throws Throwable
	{
		KeyContext keys = _keys();
		JsonObject config = new JsonObject()
				.add("id", EncryptionCodec.CODEC_ID)
				.add("header", "custom")
				.add("key", "ffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff")
		;
		EncryptionCodec codec = EncryptionCodec.fromConfig(config, keys);
		Assert.assertEquals("custom", codec.getHeader());
		// The "key" field was ignored:  frames from the context key still decode.
		byte[] frame = new EncryptionCodec(keys, "custom").encode(CHUNK);
		Assert.assertArrayEquals(CHUNK, codec.decode(frame));
		
		JsonObject written = codec.getConfig();
		Assert.assertEquals(EncryptionCodec.CODEC_ID, written.getString("id", null));
		Assert.assertEquals("custom", written.getString("header", null));
		Assert.assertNull(written.get("key"));
	}

	@Test
	public void defaultHeaderFromConfig() throws Throwable
	{
		EncryptionCodec codec = EncryptionCodec.fromConfig(new JsonObject().add("id", EncryptionCodec.CODEC_ID), _keys());
		Assert.assertEquals("dClimate-Zarr", codec.getHeader());
	}


	private static KeyContext _keys() throws Throwable
	{
		KeyContext keys = new KeyContext();
		keys.setKeyHex(HEX_KEY);
		return keys;
	}
}
