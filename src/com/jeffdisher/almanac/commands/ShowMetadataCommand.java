package com.jeffdisher.almanac.commands;

import com.jeffdisher.almanac.commands.results.SnapshotDescription;
import com.jeffdisher.almanac.types.AlmanacException;
import com.jeffdisher.almanac.types.VersionSnapshot;


public record ShowMetadataCommand(String datasetKey) implements ICommand<SnapshotDescription>
{
	@Override
	public SnapshotDescription runInContext(Context context) throws AlmanacException
	{
		VersionSnapshot snapshot = context.datasets.getMetadataByKey(this.datasetKey);
		return new SnapshotDescription(this.datasetKey, snapshot, true);
	}
}
