package com.jeffdisher.almanac.codec;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;

import javax.crypto.AEADBadTagException;

import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.almanac.types.IntegrityException;
import com.jeffdisher.almanac.types.MisconfiguredException;
import com.jeffdisher.almanac.types.UsageException;
import com.jeffdisher.almanac.utils.Assert;


/**
 * Authenticated encryption of storage chunks with XChaCha20-Poly1305.
 * Each chunk is framed as:  24-byte nonce | 16-byte tag | ciphertext.
 * The header string is authenticated (not encrypted) with every chunk so that datasets sharing a key but using
 * different headers can't have their chunks swapped.
 * Nonces are random, not derived from the content or a counter:  at 192 bits, collisions are not a practical concern
 * even over the lifetime of a large dataset, and nothing needs to be persisted between runs.
 */
public class EncryptionCodec implements IChunkCodec
{
	public static final String CODEC_ID = "xchacha20poly1305";
	public static final String DEFAULT_HEADER = "dClimate-Zarr";
	public static final String CONFIG_HEADER = "header";
	public static final int FRAME_OVERHEAD_BYTES = XChaCha20Poly1305.NONCE_SIZE_BYTES + XChaCha20Poly1305.TAG_SIZE_BYTES;

	private static final SecureRandom RANDOM = new SecureRandom();

	/**
	 * Builds the codec from stored configuration.  Only the header is read:  any other field (including anything that
	 * looks like a key) is ignored since the key must always come from the KeyContext.
	 * 
	 * @param config The codec configuration object.
	 * @param keys The key context to encrypt with.
	 * @return The codec.
	 * @throws UsageException The header was given but isn't a string.
	 */
	public static EncryptionCodec fromConfig(JsonObject config, KeyContext keys) throws UsageException
	{
		JsonValue header = config.get(CONFIG_HEADER);
		if ((null != header) && !header.isString())
		{
			throw new UsageException("Encryption codec header must be a string: " + header);
		}
		return new EncryptionCodec(keys, (null != header) ? header.asString() : DEFAULT_HEADER);
	}


	private final KeyContext _keys;
	private final String _header;
	private final byte[] _encodedHeader;

	public EncryptionCodec(KeyContext keys, String header)
	{
		Assert.assertTrue(null != keys);
		Assert.assertTrue(null != header);
		_keys = keys;
		_header = header;
		_encodedHeader = header.getBytes(StandardCharsets.UTF_8);
	}

	public String getHeader()
	{
		return _header;
	}

	@Override
	public String getCodecId()
	{
		return CODEC_ID;
	}

	@Override
	public byte[] encode(byte[] chunk) throws MisconfiguredException
	{
		byte[] key = _keys.requireKey();
		byte[] nonce = new byte[XChaCha20Poly1305.NONCE_SIZE_BYTES];
		RANDOM.nextBytes(nonce);
		byte[] sealed = XChaCha20Poly1305.seal(key, nonce, _encodedHeader, chunk);
		int cipherLength = sealed.length - XChaCha20Poly1305.TAG_SIZE_BYTES;
		
		// Reorder from the cipher's ciphertext|tag into our nonce|tag|ciphertext frame.
		byte[] frame = new byte[FRAME_OVERHEAD_BYTES + cipherLength];
		System.arraycopy(nonce, 0, frame, 0, nonce.length);
		System.arraycopy(sealed, cipherLength, frame, XChaCha20Poly1305.NONCE_SIZE_BYTES, XChaCha20Poly1305.TAG_SIZE_BYTES);
		System.arraycopy(sealed, 0, frame, FRAME_OVERHEAD_BYTES, cipherLength);
		return frame;
	}

	@Override
	public byte[] decode(byte[] frame) throws MisconfiguredException, IntegrityException
	{
		byte[] key = _keys.requireKey();
		if (frame.length < FRAME_OVERHEAD_BYTES)
		{
			throw new IntegrityException("Encrypted chunk is too short (" + frame.length + " bytes)");
		}
		byte[] nonce = Arrays.copyOfRange(frame, 0, XChaCha20Poly1305.NONCE_SIZE_BYTES);
		int cipherLength = frame.length - FRAME_OVERHEAD_BYTES;
		byte[] sealed = new byte[cipherLength + XChaCha20Poly1305.TAG_SIZE_BYTES];
		System.arraycopy(frame, FRAME_OVERHEAD_BYTES, sealed, 0, cipherLength);
		System.arraycopy(frame, XChaCha20Poly1305.NONCE_SIZE_BYTES, sealed, cipherLength, XChaCha20Poly1305.TAG_SIZE_BYTES);
		try
		{
			return XChaCha20Poly1305.open(key, nonce, _encodedHeader, sealed);
		}
		catch (AEADBadTagException e)
		{
			throw new IntegrityException("Encrypted chunk failed authentication (modified data, wrong key, or wrong header)", e);
		}
	}

	/**
	 * Decodes into a caller-provided buffer.  The buffer is only written once the chunk has fully authenticated.
	 * 
	 * @param frame The encrypted frame.
	 * @param out The buffer to receive the plaintext (must be at least as large as the plaintext).
	 * @return The out buffer.
	 * @throws MisconfiguredException No key has been set.
	 * @throws IntegrityException The chunk didn't authenticate (out is untouched).
	 */
	public byte[] decode(byte[] frame, byte[] out) throws MisconfiguredException, IntegrityException
	{
		byte[] plaintext = decode(frame);
		if (out.length < plaintext.length)
		{
			throw new IllegalArgumentException("Output buffer of " + out.length + " bytes can't hold " + plaintext.length + " bytes");
		}
		System.arraycopy(plaintext, 0, out, 0, plaintext.length);
		return out;
	}

	@Override
	public JsonObject getConfig()
	{
		return new JsonObject()
				.add("id", CODEC_ID)
				.add(CONFIG_HEADER, _header)
		;
	}
}
