package com.jeffdisher.almanac;


/**
 * Just contains the environment variables the system checks.
 */
public class EnvVars
{
	/**
	 * If set, this directory path will be used for Almanac's local storage (the registry cache).  Defaults to
	 * "~/.almanac" if not set.
	 */
	public static final String ENV_VAR_ALMANAC_STORAGE = "ALMANAC_STORAGE";

	/**
	 * The IPFS RPC API host, as a URL without the "/api/v0" suffix (for example, "http://127.0.0.1:5001").  If not
	 * set, the local node's default API address is assumed.
	 */
	public static final String ENV_VAR_ALMANAC_IPFS_HOST = "ALMANAC_IPFS_HOST";

	/**
	 * Overrides the URL of the dataset registry document.
	 */
	public static final String ENV_VAR_ALMANAC_REGISTRY_URL = "ALMANAC_REGISTRY_URL";

	/**
	 * The chunk encryption key, as 64 hex characters.  Only needed by the chunk commands.
	 */
	public static final String ENV_VAR_ALMANAC_ENCRYPTION_KEY = "ALMANAC_ENCRYPTION_KEY";

	/**
	 * Enables verbose console logging.  If not set, verbose logs will not be written to the console.
	 */
	public static final String ENV_VAR_ALMANAC_VERBOSE = "ALMANAC_VERBOSE";
}
