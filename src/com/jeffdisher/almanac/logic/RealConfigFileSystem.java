package com.jeffdisher.almanac.logic;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;


/**
 * The on-disk storage directory.  The directory is created lazily, on first write, since a missing cache is just a
 * cold start.
 */
public class RealConfigFileSystem implements IConfigFileSystem
{
	public static final String TEMP_FILE_SUFFIX = ".temp";

	private final File _directory;

	public RealConfigFileSystem(File directory)
	{
		_directory = directory;
	}

	@Override
	public InputStream readAtomicFile(String fileName) throws IOException
	{
		// Since the atomic rename may not work on Windows systems, our manual approach requires potential clean-up on the read side.
		File finalFile = new File(_directory, fileName);
		File tempFile = new File(_directory, fileName + TEMP_FILE_SUFFIX);
		
		// Broken write clean-up logic:
		// -if only FINAL, change nothing and open it (means the write was clean)
		// -if only TEMP, rename it to final and open it (means the write finished but the rename was interrupted)
		// -if both, delete TEMP and open FINAL (means we don't know the state of the write so we discard it)
		// -if neither exist, return null
		if (finalFile.exists())
		{
			if (tempFile.exists() && !tempFile.delete())
			{
				throw new IOException("Failed to discard incomplete write: " + tempFile);
			}
		}
		else if (tempFile.exists())
		{
			if (!tempFile.renameTo(finalFile))
			{
				throw new IOException("Failed to recover completed write: " + tempFile);
			}
		}
		
		return finalFile.exists()
				? new FileInputStream(finalFile)
				: null
		;
	}

	@Override
	public IConfigFileSystem.AtomicOutputStream writeAtomicFile(String fileName) throws IOException
	{
		if (!_directory.isDirectory() && !_directory.mkdirs())
		{
			throw new IOException("Failed to create directory: " + _directory);
		}
		
		// We need to manually do this atomic write, since Windows historically had issues with this.
		File finalFile = new File(_directory, fileName);
		File tempFile = new File(_directory, fileName + TEMP_FILE_SUFFIX);
		
		// The steps:
		// 1) write to TEMP
		// 2) delete FINAL (it may not exist if this is the first write - the first write is NOT atomic since we could see this as a broken file)
		// 3) rename TEMP to FINAL
		// (a stale TEMP from another, abandoned, writer is simply overwritten)
		FileOutputStream output = new FileOutputStream(tempFile);
		
		return new IConfigFileSystem.AtomicOutputStream()
		{
			private boolean _didCommit = false;
			@Override
			public void close() throws IOException
			{
				output.close();
				if (_didCommit)
				{
					// Do the dance to delete the old and rename the new.
					if (finalFile.exists() && !finalFile.delete())
					{
						throw new IOException("Failed to replace: " + finalFile);
					}
					if (!tempFile.renameTo(finalFile))
					{
						throw new IOException("Failed to rename into place: " + finalFile);
					}
				}
				else
				{
					// There was a problem so just delete the new.
					if (!tempFile.delete())
					{
						throw new IOException("Failed to abandon write: " + tempFile);
					}
				}
			}
			@Override
			public OutputStream getStream()
			{
				return output;
			}
			@Override
			public void commit()
			{
				_didCommit = true;
			}
		};
	}

	@Override
	public String getDirectoryForReporting()
	{
		return _directory.getAbsolutePath();
	}
}
