package com.jeffdisher.almanac.commands.results;

import java.io.PrintStream;
import java.util.Set;
import java.util.TreeSet;

import com.jeffdisher.almanac.commands.ICommand;


public class DatasetList implements ICommand.Result
{
	private final Set<String> _keys;

	public DatasetList(Set<String> keys)
	{
		_keys = keys;
	}

	public Set<String> getKeys()
	{
		return _keys;
	}

	@Override
	public void writeHumanReadable(PrintStream output)
	{
		output.println("Datasets (" + _keys.size() + "):");
		for (String key : new TreeSet<>(_keys))
		{
			output.println("\t" + key);
		}
	}
}
