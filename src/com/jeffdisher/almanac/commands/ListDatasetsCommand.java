package com.jeffdisher.almanac.commands;

import java.util.Set;

import com.jeffdisher.almanac.commands.results.DatasetList;
import com.jeffdisher.almanac.types.RegistryUnavailableException;


public record ListDatasetsCommand() implements ICommand<DatasetList>
{
	@Override
	public DatasetList runInContext(Context context) throws RegistryUnavailableException
	{
		Set<String> keys = context.datasets.listDatasets();
		return new DatasetList(keys);
	}
}
