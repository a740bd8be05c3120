package com.jeffdisher.almanac.commands.results;

import java.io.PrintStream;

import com.eclipsesource.json.WriterConfig;
import com.jeffdisher.almanac.commands.ICommand;
import com.jeffdisher.almanac.types.VersionSnapshot;


public class SnapshotDescription implements ICommand.Result
{
	private final String _datasetKey;
	private final VersionSnapshot _snapshot;
	private final boolean _includeDocument;

	public SnapshotDescription(String datasetKey, VersionSnapshot snapshot, boolean includeDocument)
	{
		_datasetKey = datasetKey;
		_snapshot = snapshot;
		_includeDocument = includeDocument;
	}

	public VersionSnapshot getSnapshot()
	{
		return _snapshot;
	}

	@Override
	public void writeHumanReadable(PrintStream output)
	{
		output.println("Dataset: " + _datasetKey);
		output.println("\tSnapshot: " + _snapshot.contentId().toSafeString());
		output.println("\tCreated: " + _snapshot.createdAt());
		output.println("\tPrevious: " + ((null != _snapshot.previous()) ? _snapshot.previous().toSafeString() : "(root)"));
		output.println("\tPayload: " + ((null != _snapshot.payloadRef()) ? _snapshot.payloadRef().toSafeString() : "(none)"));
		if (_includeDocument)
		{
			output.println(_snapshot.document().toString(WriterConfig.PRETTY_PRINT));
		}
	}
}
