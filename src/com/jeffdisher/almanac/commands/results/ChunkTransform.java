package com.jeffdisher.almanac.commands.results;

import java.io.File;
import java.io.PrintStream;

import com.jeffdisher.almanac.commands.ICommand;


public class ChunkTransform implements ICommand.Result
{
	private final String _action;
	private final File _output;
	private final long _inputBytes;
	private final long _outputBytes;

	public ChunkTransform(String action, File output, long inputBytes, long outputBytes)
	{
		_action = action;
		_output = output;
		_inputBytes = inputBytes;
		_outputBytes = outputBytes;
	}

	@Override
	public void writeHumanReadable(PrintStream output)
	{
		output.println(_action + " " + _inputBytes + " bytes into " + _outputBytes + " bytes: " + _output);
	}
}
