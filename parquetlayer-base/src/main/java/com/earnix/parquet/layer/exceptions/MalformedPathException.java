package com.earnix.parquet.layer.exceptions;

/**
 * The text is not a valid layer path
 */
public class MalformedPathException extends IllegalArgumentException
{
	private final String pathText;

	public MalformedPathException(String pathText, String reason)
	{
		super("Malformed path '" + pathText + "': " + reason);
		this.pathText = pathText;
	}

	public String getPathText()
	{
		return pathText;
	}
}
