package com.jeffdisher.almanac.testutils;

import com.jeffdisher.almanac.logic.IRegistry;
import com.jeffdisher.almanac.logic.RegistryMapping;
import com.jeffdisher.almanac.types.RegistryUnavailableException;


/**
 * A registry which returns whatever mapping it was last given, or fails if it was given null.
 */
public class MockRegistry implements IRegistry
{
	private RegistryMapping _mapping;
	private int _fetchCount;

	public MockRegistry(RegistryMapping mapping)
	{
		_mapping = mapping;
	}

	public void setMapping(RegistryMapping mapping)
	{
		_mapping = mapping;
	}

	public int getFetchCount()
	{
		return _fetchCount;
	}

	@Override
	public RegistryMapping fetchMapping() throws RegistryUnavailableException
	{
		_fetchCount += 1;
		if (null == _mapping)
		{
			throw new RegistryUnavailableException("Synthetic registry outage");
		}
		return _mapping;
	}

	@Override
	public String getLocationForReporting()
	{
		return "mock://registry";
	}
}
