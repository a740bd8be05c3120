package com.jeffdisher.almanac.codec;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.almanac.types.IntegrityException;
import com.jeffdisher.almanac.types.MisconfiguredException;


/**
 * A transform applied to each storage chunk:  encode on write, decode on read.
 * Implementations must be safe to call concurrently.
 */
public interface IChunkCodec
{
	/**
	 * @return The stable identifier this codec is registered under (what a pipeline configuration refers to).
	 */
	String getCodecId();

	/**
	 * @param chunk The raw chunk bytes.
	 * @return The encoded bytes.
	 * @throws MisconfiguredException The codec needs configuration which isn't available.
	 */
	byte[] encode(byte[] chunk) throws MisconfiguredException;

	/**
	 * @param encoded Bytes previously returned by encode().
	 * @return The original chunk bytes.
	 * @throws MisconfiguredException The codec needs configuration which isn't available.
	 * @throws IntegrityException The encoded data is corrupt or didn't authenticate.
	 */
	byte[] decode(byte[] encoded) throws MisconfiguredException, IntegrityException;

	/**
	 * @return The configuration which rebuilds this codec through CodecRegistry (never contains secrets).
	 */
	JsonObject getConfig();
}
