package com.jeffdisher.almanac;

import java.io.File;
import java.time.Instant;

import com.jeffdisher.almanac.logic.SnapshotDocument;
import com.jeffdisher.almanac.types.UsageException;


public enum ParameterType
{
	STRING("string"
			, (String arg) -> arg
	),
	FILE("file_path"
			, (String arg) -> {
				File file = new File(arg);
				if (!file.exists())
				{
					throw new UsageException("File does not exist: \"" + arg + "\"");
				}
				if (!file.isFile())
				{
					throw new UsageException("File exists but is not a regular file: \"" + arg + "\"");
				}
				return file;
			}
	),
	OUTPUT_FILE("file_path"
			, (String arg) -> {
				File file = new File(arg);
				if (file.isDirectory())
				{
					throw new UsageException("Output path is a directory: \"" + arg + "\"");
				}
				return file;
			}
	),
	TIMESTAMP("yyyy-MM-ddTHH:mm:ssZ"
			, (String arg) -> {
				Instant instant = SnapshotDocument.parseTimestamp(arg);
				if (null == instant)
				{
					throw new UsageException("Not a UTC timestamp of the form 2022-07-26T19:17:55Z: \"" + arg + "\"");
				}
				return instant;
			}
	),
	;

	public final String shortDescription;
	private final Parser<?> _parser;

	private ParameterType(String shortDescription, Parser<?> parser)
	{
		this.shortDescription = shortDescription;
		_parser = parser;
	}

	public <T> T parse(Class<T> clazz, String arg) throws UsageException
	{
		return clazz.cast(_parser.parse(arg));
	}


	private interface Parser<R>
	{
		R parse(String arg) throws UsageException;
	}
}
