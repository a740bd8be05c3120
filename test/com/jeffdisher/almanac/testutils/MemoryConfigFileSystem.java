package com.jeffdisher.almanac.testutils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashMap;
import java.util.Map;

import com.jeffdisher.almanac.logic.IConfigFileSystem;


public class MemoryConfigFileSystem implements IConfigFileSystem
{
	private final Map<String, byte[]> _data = new HashMap<>();
	private boolean _failWrites;
	private int _commitCount;

	public void putFile(String fileName, byte[] contents)
	{
		_data.put(fileName, contents);
	}

	public byte[] getFile(String fileName)
	{
		return _data.get(fileName);
	}

	/**
	 * @param failWrites If true, all subsequent attempts to open a file for writing will throw IOException.
	 */
	public void setFailWrites(boolean failWrites)
	{
		_failWrites = failWrites;
	}

	/**
	 * @return The number of writes which were committed.
	 */
	public int getCommitCount()
	{
		return _commitCount;
	}

	@Override
	public InputStream readAtomicFile(String fileName)
	{
		byte[] bytes = _data.get(fileName);
		return (null != bytes)
				? new ByteArrayInputStream(bytes)
				: null
		;
	}

	@Override
	public AtomicOutputStream writeAtomicFile(String fileName) throws IOException
	{
		if (_failWrites)
		{
			throw new IOException("Synthetic write failure");
		}
		ByteArrayOutputStream stream = new ByteArrayOutputStream();
		return new AtomicOutputStream()
		{
			private boolean _didCommit;
			@Override
			public OutputStream getStream()
			{
				return stream;
			}
			@Override
			public void commit()
			{
				_didCommit = true;
			}
			@Override
			public void close()
			{
				if (_didCommit)
				{
					_data.put(fileName, stream.toByteArray());
					_commitCount += 1;
				}
			}
		};
	}

	@Override
	public String getDirectoryForReporting()
	{
		return "SYNTHETIC";
	}
}
