package com.jeffdisher.almanac.codec;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import javax.crypto.AEADBadTagException;

import org.junit.Assert;
import org.junit.Test;


/**
 * Known-answer tests from draft-irtf-cfrg-xchacha-03 (sections 2.2.1 and A.3.1).
 */
public class TestXChaCha20Poly1305
{
	private static final HexFormat HEX = HexFormat.of();

	@Test
	public void hChaCha20Vector() throws Throwable
	{
		byte[] key = HEX.parseHex("000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f");
		byte[] nonce = HEX.parseHex("000000090000004a0000000031415927");
		byte[] subkey = XChaCha20Poly1305.hChaCha20(key, nonce);
		Assert.assertEquals("82413b4227b27bfed30e42508a877d73a0f9e4d58a74a853c12ec41326d3ecdc", HEX.formatHex(subkey));
	}

	@Test
	public void aeadVector() throws Throwable
	{
		byte[] plaintext = "Ladies and Gentlemen of the class of '99: If I could offer you only one tip for the future, sunscreen would be it.".getBytes(StandardCharsets.US_ASCII);
		byte[] aad = HEX.parseHex("50515253c0c1c2c3c4c5c6c7");
		byte[] key = HEX.parseHex("808182838485868788898a8b8c8d8e8f909192939495969798999a9b9c9d9e9f");
		byte[] nonce = HEX.parseHex("404142434445464748494a4b4c4d4e4f5051525354555657");
		String expectedCiphertext = "bd6d179d3e83d43b9576579493c0e939572a1700252bfaccbed2902c21396cbb"
				+ "731c7f1b0b4aa6440bf3a82f4eda7e39ae64c6708c54c216cb96b72e1213b452"
				+ "2f8c9ba40db5d945b11b69b982c1bb9e3f3fac2bc369488f76b2383565d3fff9"
				+ "21f9664c97637da9768812f615c68b13b52e"
		;
		String expectedTag = "c0875924c1c7987947deafd8780acf49";
		
		byte[] sealed = XChaCha20Poly1305.seal(key, nonce, aad, plaintext);
		Assert.assertEquals(expectedCiphertext + expectedTag, HEX.formatHex(sealed));
		Assert.assertArrayEquals(plaintext, XChaCha20Poly1305.open(key, nonce, aad, sealed));
	}

	@Test(expected = AEADBadTagException.class)
	public void wrongAssociatedData() throws Throwable
	{
		byte[] key = new byte[32];
		byte[] nonce = new byte[24];
		byte[] sealed = XChaCha20Poly1305.seal(key, nonce, "one".getBytes(StandardCharsets.UTF_8), new byte[] { 1, 2, 3 });
		XChaCha20Poly1305.open(key, nonce, "two".getBytes(StandardCharsets.UTF_8), sealed);
	}

	@Test
	public void emptyPlaintext() throws Throwable
	{
		byte[] key = new byte[32];
		byte[] nonce = new byte[24];
		byte[] sealed = XChaCha20Poly1305.seal(key, nonce, new byte[0], new byte[0]);
		Assert.assertEquals(XChaCha20Poly1305.TAG_SIZE_BYTES, sealed.length);
		Assert.assertEquals(0, XChaCha20Poly1305.open(key, nonce, new byte[0], sealed).length);
	}
}
