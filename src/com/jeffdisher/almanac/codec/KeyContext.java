package com.jeffdisher.almanac.codec;

import java.util.Arrays;
import java.util.HexFormat;

import com.jeffdisher.almanac.types.InvalidKeyException;
import com.jeffdisher.almanac.types.MisconfiguredException;


/**
 * Holds the 256-bit chunk encryption key.  Codecs are given a KeyContext when they are built so the key never needs
 * to appear in (persisted) codec configuration.
 * A process normally sets the key once, before any codec is used, and keeps it for its lifetime.  Replacing the key
 * is allowed but NOT synchronized against in-flight encode/decode calls:  callers must stop all codec use first.
 */
public class KeyContext
{
	public static final int KEY_SIZE_BYTES = 32;

	private static final KeyContext SHARED = new KeyContext();

	/**
	 * @return The process-wide context, for callers which don't pass an explicit one through.
	 */
	public static KeyContext shared()
	{
		return SHARED;
	}


	// Replaced, never mutated, so readers always see a complete key.
	private volatile byte[] _key;

	/**
	 * Sets the key from raw bytes.  The array is copied.
	 * 
	 * @param key Exactly 32 bytes.
	 * @throws InvalidKeyException The key was null or the wrong length.
	 */
	public void setKey(byte[] key) throws InvalidKeyException
	{
		if ((null == key) || (KEY_SIZE_BYTES != key.length))
		{
			throw new InvalidKeyException("Encryption key must be " + KEY_SIZE_BYTES + " bytes");
		}
		_key = Arrays.copyOf(key, key.length);
	}

	/**
	 * Sets the key from its hex encoding.
	 * 
	 * @param hexKey Exactly 64 hexadecimal characters (either case).
	 * @throws InvalidKeyException The string was null, the wrong length, or not hexadecimal.
	 */
	public void setKeyHex(String hexKey) throws InvalidKeyException
	{
		if ((null == hexKey) || ((2 * KEY_SIZE_BYTES) != hexKey.length()))
		{
			throw new InvalidKeyException("Encryption key must be " + (2 * KEY_SIZE_BYTES) + " hex characters");
		}
		byte[] raw;
		try
		{
			raw = HexFormat.of().parseHex(hexKey);
		}
		catch (IllegalArgumentException e)
		{
			throw new InvalidKeyException("Encryption key is not valid hex");
		}
		setKey(raw);
	}

	/**
	 * @return True if a key has been set.
	 */
	public boolean isConfigured()
	{
		return (null != _key);
	}

	/**
	 * @return The key (callers must not modify it).
	 * @throws MisconfiguredException No key has been set.
	 */
	byte[] requireKey() throws MisconfiguredException
	{
		byte[] key = _key;
		if (null == key)
		{
			throw new MisconfiguredException("Encryption key must be set before using the encryption codec");
		}
		return key;
	}
}
