package com.jeffdisher.almanac.logic;

import java.io.PrintStream;


/**
 * The console logger.  Nested operations are numbered so interleaved output from one command can be followed:
 * ">N>" opens operation N, "=N=" is a step within it, "*N*" is a verbose step, and "<N<" closes it.
 */
public class StandardLogger implements ILogger
{
	public static StandardLogger topLogger(PrintStream stream, PrintStream errorStream, boolean verbose)
	{
		return new StandardLogger(null, stream, errorStream, "", verbose);
	}


	// We keep the parent so we can write-back error state after a sub-logger finishes.
	private final StandardLogger _parent;
	private final PrintStream _stream;
	private final PrintStream _errorStream;
	private final String _prefix;
	private final boolean _verbose;
	private int _nextOperationCounter;
	private boolean _errorOccurred;

	private StandardLogger(StandardLogger parent
			, PrintStream stream
			, PrintStream errorStream
			, String prefix
			, boolean verbose
	)
	{
		_parent = parent;
		_stream = stream;
		_errorStream = errorStream;
		_prefix = prefix;
		_verbose = verbose;
		_nextOperationCounter = 0;
	}

	@Override
	public ILogger logStart(String openingMessage)
	{
		_nextOperationCounter += 1;
		String prefix = _prefix.isEmpty()
				? ("" + _nextOperationCounter)
				: (_prefix + "." + _nextOperationCounter)
		;
		_stream.println(">" + prefix + "> " + openingMessage);
		return new StandardLogger(this, _stream, _errorStream, prefix, _verbose);
	}

	@Override
	public void logOperation(String message)
	{
		_stream.println("=" + _prefix + "= " + message);
	}

	@Override
	public void logFinish(String finishMessage)
	{
		// Saturate to error in the parent.
		if (_errorOccurred && (null != _parent))
		{
			_parent._errorOccurred = true;
		}
		_stream.println("<" + _prefix + "< " + finishMessage);
	}

	@Override
	public void logVerbose(String message)
	{
		if (_verbose)
		{
			_stream.println("*" + _prefix + "* " + message);
		}
	}

	@Override
	public void logError(String message)
	{
		_errorStream.println(message);
		_errorOccurred = true;
	}

	@Override
	public boolean didErrorOccur()
	{
		return _errorOccurred;
	}
}
