package com.jeffdisher.almanac.codec;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.almanac.types.IntegrityException;
import com.jeffdisher.almanac.types.UsageException;


/**
 * DEFLATE (zlib-wrapped) compression of chunks, as used by most Zarr stores.  Usually placed before the encryption
 * codec in a pipeline since ciphertext doesn't compress.
 */
public class ZlibCodec implements IChunkCodec
{
	public static final String CODEC_ID = "zlib";
	public static final String CONFIG_LEVEL = "level";
	public static final int DEFAULT_LEVEL = 1;

	public static ZlibCodec fromConfig(JsonObject config) throws UsageException
	{
		JsonValue raw = config.get(CONFIG_LEVEL);
		if ((null != raw) && !raw.isNumber())
		{
			throw new UsageException("zlib level must be a number: " + raw);
		}
		int level = (null != raw) ? raw.asInt() : DEFAULT_LEVEL;
		if ((level < 0) || (level > 9))
		{
			throw new UsageException("zlib level must be in [0, 9]: " + level);
		}
		return new ZlibCodec(level);
	}


	private final int _level;

	public ZlibCodec(int level)
	{
		_level = level;
	}

	@Override
	public String getCodecId()
	{
		return CODEC_ID;
	}

	@Override
	public byte[] encode(byte[] chunk)
	{
		Deflater deflater = new Deflater(_level);
		try
		{
			deflater.setInput(chunk);
			deflater.finish();
			ByteArrayOutputStream output = new ByteArrayOutputStream();
			byte[] buffer = new byte[4096];
			while (!deflater.finished())
			{
				int count = deflater.deflate(buffer);
				output.write(buffer, 0, count);
			}
			return output.toByteArray();
		}
		finally
		{
			deflater.end();
		}
	}

	@Override
	public byte[] decode(byte[] encoded) throws IntegrityException
	{
		Inflater inflater = new Inflater();
		try
		{
			inflater.setInput(encoded);
			ByteArrayOutputStream output = new ByteArrayOutputStream();
			byte[] buffer = new byte[4096];
			while (!inflater.finished())
			{
				int count = inflater.inflate(buffer);
				if ((0 == count) && (inflater.needsInput() || inflater.needsDictionary()))
				{
					throw new IntegrityException("Compressed chunk is truncated");
				}
				output.write(buffer, 0, count);
			}
			return output.toByteArray();
		}
		catch (DataFormatException e)
		{
			throw new IntegrityException("Compressed chunk is corrupt", e);
		}
		finally
		{
			inflater.end();
		}
	}

	@Override
	public JsonObject getConfig()
	{
		return new JsonObject()
				.add("id", CODEC_ID)
				.add(CONFIG_LEVEL, _level)
		;
	}
}
