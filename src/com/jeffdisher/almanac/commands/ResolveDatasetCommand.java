package com.jeffdisher.almanac.commands;

import java.time.Instant;

import com.jeffdisher.almanac.commands.results.SnapshotDescription;
import com.jeffdisher.almanac.types.AlmanacException;
import com.jeffdisher.almanac.types.VersionSnapshot;


/**
 * Finds the snapshot of a dataset which was current at the given time (or the latest, if asOf is null).
 */
public record ResolveDatasetCommand(String datasetKey, Instant asOf) implements ICommand<SnapshotDescription>
{
	@Override
	public SnapshotDescription runInContext(Context context) throws AlmanacException
	{
		VersionSnapshot snapshot = context.datasets.resolveDataset(this.datasetKey, this.asOf);
		return new SnapshotDescription(this.datasetKey, snapshot, false);
	}
}
