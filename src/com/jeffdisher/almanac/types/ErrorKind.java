package com.jeffdisher.almanac.types;


/**
 * The broad category of an AlmanacException.  Callers which need to decide what to tell the user (or whether
 * something can be retried) branch on this instead of on the concrete exception class.
 */
public enum ErrorKind
{
	/**
	 * The named dataset, or a version old enough for the request, doesn't exist.
	 */
	NOT_FOUND,
	/**
	 * Encrypted data failed authentication (tampered data, wrong key, or wrong header).  Never retried.
	 */
	INTEGRITY,
	/**
	 * The process is missing required configuration or was given an invalid value (typically the encryption key).
	 */
	CONFIGURATION,
	/**
	 * A remote service couldn't be reached or answered with an error.
	 */
	UNAVAILABLE,
	/**
	 * Data was fetched but doesn't match the expected format.
	 */
	PROTOCOL,
	/**
	 * The caller asked for something invalid.
	 */
	USAGE,
}
