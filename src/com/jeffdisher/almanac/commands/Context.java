package com.jeffdisher.almanac.commands;

import com.jeffdisher.almanac.codec.KeyContext;
import com.jeffdisher.almanac.logic.DatasetClient;
import com.jeffdisher.almanac.logic.ILogger;


/**
 * A container of resources which can be used by a command.
 */
public class Context
{
	public final DatasetClient datasets;
	public final KeyContext keys;
	public final ILogger logger;

	public Context(DatasetClient datasets
			, KeyContext keys
			, ILogger logger
	)
	{
		this.datasets = datasets;
		this.keys = keys;
		this.logger = logger;
	}
}
