package com.jeffdisher.almanac.codec;

import java.security.GeneralSecurityException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import com.jeffdisher.almanac.utils.Assert;


/**
 * XChaCha20-Poly1305 (draft-irtf-cfrg-xchacha) on top of the JDK's ChaCha20-Poly1305 cipher.
 * The extended 24-byte nonce is handled the standard way:  HChaCha20 of the key and the first 16 nonce bytes gives a
 * subkey, which is then used with the IETF construction and a 12-byte nonce of 4 zero bytes followed by the last 8
 * nonce bytes.
 * The JDK cipher lays out its output as ciphertext followed by the tag.
 */
public class XChaCha20Poly1305
{
	public static final int NONCE_SIZE_BYTES = 24;
	public static final int TAG_SIZE_BYTES = 16;

	private static final String CIPHER_NAME = "ChaCha20-Poly1305";
	private static final String KEY_ALGORITHM = "ChaCha20";
	private static final int HCHACHA_NONCE_BYTES = 16;
	private static final int[] SIGMA = new int[] { 0x61707865, 0x3320646e, 0x79622d32, 0x6b206574 };

	/**
	 * Encrypts and authenticates.
	 * 
	 * @param key The 32-byte key.
	 * @param nonce The 24-byte nonce (must never repeat under the same key).
	 * @param associatedData Data authenticated but not encrypted.
	 * @param plaintext The data to encrypt.
	 * @return The ciphertext followed by the 16-byte tag.
	 */
	public static byte[] seal(byte[] key, byte[] nonce, byte[] associatedData, byte[] plaintext)
	{
		try
		{
			Cipher cipher = _initCipher(Cipher.ENCRYPT_MODE, key, nonce, associatedData);
			return cipher.doFinal(plaintext);
		}
		catch (GeneralSecurityException e)
		{
			// ChaCha20-Poly1305 is mandatory since JDK 11 and we control the parameter shapes.
			throw Assert.unexpected(e);
		}
	}

	/**
	 * Verifies and decrypts.  Nothing is returned unless the tag verifies.
	 * 
	 * @param key The 32-byte key.
	 * @param nonce The 24-byte nonce used to seal.
	 * @param associatedData The associated data used to seal.
	 * @param sealed The ciphertext followed by the 16-byte tag.
	 * @return The plaintext.
	 * @throws AEADBadTagException The tag didn't verify (wrong key, nonce, associated data, or modified data).
	 */
	public static byte[] open(byte[] key, byte[] nonce, byte[] associatedData, byte[] sealed) throws AEADBadTagException
	{
		try
		{
			Cipher cipher = _initCipher(Cipher.DECRYPT_MODE, key, nonce, associatedData);
			return cipher.doFinal(sealed);
		}
		catch (AEADBadTagException e)
		{
			throw e;
		}
		catch (GeneralSecurityException e)
		{
			throw Assert.unexpected(e);
		}
	}

	/**
	 * The HChaCha20 subkey derivation:  the ChaCha20 block function without the final feed-forward, keeping only the
	 * first and last rows of the state.
	 * 
	 * @param key The 32-byte key.
	 * @param nonce At least 16 bytes, of which the first 16 are used.
	 * @return The 32-byte subkey.
	 */
	public static byte[] hChaCha20(byte[] key, byte[] nonce)
	{
		Assert.assertTrue(32 == key.length);
		Assert.assertTrue(nonce.length >= HCHACHA_NONCE_BYTES);
		int[] state = new int[16];
		System.arraycopy(SIGMA, 0, state, 0, 4);
		for (int i = 0; i < 8; ++i)
		{
			state[4 + i] = _readLittleEndian(key, 4 * i);
		}
		for (int i = 0; i < 4; ++i)
		{
			state[12 + i] = _readLittleEndian(nonce, 4 * i);
		}
		for (int round = 0; round < 10; ++round)
		{
			// Columns.
			_quarterRound(state, 0, 4, 8, 12);
			_quarterRound(state, 1, 5, 9, 13);
			_quarterRound(state, 2, 6, 10, 14);
			_quarterRound(state, 3, 7, 11, 15);
			// Diagonals.
			_quarterRound(state, 0, 5, 10, 15);
			_quarterRound(state, 1, 6, 11, 12);
			_quarterRound(state, 2, 7, 8, 13);
			_quarterRound(state, 3, 4, 9, 14);
		}
		byte[] subkey = new byte[32];
		for (int i = 0; i < 4; ++i)
		{
			_writeLittleEndian(subkey, 4 * i, state[i]);
			_writeLittleEndian(subkey, 16 + (4 * i), state[12 + i]);
		}
		return subkey;
	}


	private static Cipher _initCipher(int mode, byte[] key, byte[] nonce, byte[] associatedData) throws GeneralSecurityException
	{
		Assert.assertTrue(NONCE_SIZE_BYTES == nonce.length);
		byte[] subkey = hChaCha20(key, nonce);
		byte[] ietfNonce = new byte[12];
		System.arraycopy(nonce, HCHACHA_NONCE_BYTES, ietfNonce, 4, 8);
		Cipher cipher = Cipher.getInstance(CIPHER_NAME);
		cipher.init(mode, new SecretKeySpec(subkey, KEY_ALGORITHM), new IvParameterSpec(ietfNonce));
		cipher.updateAAD(associatedData);
		return cipher;
	}

	private static void _quarterRound(int[] x, int a, int b, int c, int d)
	{
		x[a] += x[b]; x[d] = Integer.rotateLeft(x[d] ^ x[a], 16);
		x[c] += x[d]; x[b] = Integer.rotateLeft(x[b] ^ x[c], 12);
		x[a] += x[b]; x[d] = Integer.rotateLeft(x[d] ^ x[a], 8);
		x[c] += x[d]; x[b] = Integer.rotateLeft(x[b] ^ x[c], 7);
	}

	private static int _readLittleEndian(byte[] data, int offset)
	{
		return (data[offset] & 0xff)
				| ((data[offset + 1] & 0xff) << 8)
				| ((data[offset + 2] & 0xff) << 16)
				| ((data[offset + 3] & 0xff) << 24)
		;
	}

	private static void _writeLittleEndian(byte[] data, int offset, int value)
	{
		data[offset] = (byte)value;
		data[offset + 1] = (byte)(value >>> 8);
		data[offset + 2] = (byte)(value >>> 16);
		data[offset + 3] = (byte)(value >>> 24);
	}
}
