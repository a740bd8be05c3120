package com.jeffdisher.almanac.commands;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import com.jeffdisher.almanac.types.UsageException;


/**
 * Whole-file reads and writes for the chunk commands (chunks are small enough to hold in memory).
 */
class ChunkFiles
{
	static byte[] read(File file) throws UsageException
	{
		try
		{
			return Files.readAllBytes(file.toPath());
		}
		catch (IOException e)
		{
			throw new UsageException("Failed to read " + file + ": " + e.getLocalizedMessage());
		}
	}

	static void write(File file, byte[] data) throws UsageException
	{
		try
		{
			Files.write(file.toPath(), data);
		}
		catch (IOException e)
		{
			throw new UsageException("Failed to write " + file + ": " + e.getLocalizedMessage());
		}
	}
}
