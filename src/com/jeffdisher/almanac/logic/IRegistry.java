package com.jeffdisher.almanac.logic;

import com.jeffdisher.almanac.types.RegistryUnavailableException;


/**
 * The remote source of truth for which datasets exist and which mutable pointer each one is published under.
 */
public interface IRegistry
{
	/**
	 * Fetches the complete dataset key to pointer mapping in one call (there is no pagination).
	 * 
	 * @return The mapping (never null).
	 * @throws RegistryUnavailableException The registry couldn't be reached, returned an error status, or returned a
	 * payload which isn't a valid mapping.
	 */
	RegistryMapping fetchMapping() throws RegistryUnavailableException;

	/**
	 * @return A description of the registry location, for log messages.
	 */
	String getLocationForReporting();
}
