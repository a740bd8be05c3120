package com.jeffdisher.almanac.logic;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;


/**
 * An abstract interface over the local storage directory (where the registry cache lives).
 * The entire reason why this exists is to allow test coverage on the cache logic without requiring a real disk.
 */
public interface IConfigFileSystem
{
	/**
	 * Opens a file for reading, if it exists.  The caller takes ownership of the stream.
	 * This assumes that the file was written using our portable atomic pattern, so it will not open an incomplete file.
	 * 
	 * @param fileName The name of the file.
	 * @return The input stream for the file, null if the file didn't exist.
	 * @throws IOException The file exists but couldn't be opened.
	 */
	InputStream readAtomicFile(String fileName) throws IOException;

	/**
	 * Opens a file for writing using our portable atomic pattern.  The caller takes ownership of the stream.
	 * The caller MUST call commit() on the returned object before close if it wants the write to become durable.
	 * 
	 * @param fileName The name of the file.
	 * @return The atomic output abstraction to use in writing the file.
	 * @throws IOException The storage directory couldn't be created or the file couldn't be opened.
	 */
	AtomicOutputStream writeAtomicFile(String fileName) throws IOException;

	/**
	 * @return A description of where the files live, for log messages.
	 */
	String getDirectoryForReporting();


	/**
	 * We do file IO using the typical atomic write trick:  Write to a temp file and then rename it to replace the
	 * original file.  This interface allows a way to only do the final rename if the output was explicitly told to
	 * commit before being closed (then, it will perform the rename when closing).
	 * NOTE:  This does NOT lock against other processes writing the same file.  Concurrent writers are last-writer-wins.
	 */
	public interface AtomicOutputStream extends Closeable
	{
		OutputStream getStream();
		void commit();
	}
}
