package com.jeffdisher.almanac.codec;

import java.util.List;

import com.eclipsesource.json.JsonArray;
import com.jeffdisher.almanac.types.IntegrityException;
import com.jeffdisher.almanac.types.MisconfiguredException;


/**
 * An ordered chain of codecs:  encode runs them first to last, decode runs them last to first.
 */
public class CodecPipeline
{
	private final List<IChunkCodec> _codecs;

	public CodecPipeline(List<IChunkCodec> codecs)
	{
		_codecs = List.copyOf(codecs);
	}

	public byte[] encode(byte[] chunk) throws MisconfiguredException
	{
		byte[] data = chunk;
		for (IChunkCodec codec : _codecs)
		{
			data = codec.encode(data);
		}
		return data;
	}

	public byte[] decode(byte[] encoded) throws MisconfiguredException, IntegrityException
	{
		byte[] data = encoded;
		for (int i = _codecs.size() - 1; i >= 0; --i)
		{
			data = _codecs.get(i).decode(data);
		}
		return data;
	}

	public List<IChunkCodec> getCodecs()
	{
		return _codecs;
	}

	/**
	 * @return The configuration array which rebuilds this pipeline through CodecRegistry.
	 */
	public JsonArray getConfig()
	{
		JsonArray array = new JsonArray();
		for (IChunkCodec codec : _codecs)
		{
			array.add(codec.getConfig());
		}
		return array;
	}
}
