package com.jeffdisher.almanac.types;


/**
 * Thrown when a dataset key is known to neither the remote registry nor the local cache.
 */
public class DatasetNotFoundException extends AlmanacException
{
	private static final long serialVersionUID = 1L;

	public DatasetNotFoundException(String datasetKey)
	{
		super(ErrorKind.NOT_FOUND, "Invalid dataset name: \"" + datasetKey + "\"");
	}

	public DatasetNotFoundException(String datasetKey, Exception cause)
	{
		super(ErrorKind.NOT_FOUND, "Invalid dataset name: \"" + datasetKey + "\"", cause);
	}
}
