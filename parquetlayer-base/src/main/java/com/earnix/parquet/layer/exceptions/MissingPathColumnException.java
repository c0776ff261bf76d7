package com.earnix.parquet.layer.exceptions;

/**
 * The parquet schema has no column named {@code path}
 */
public class MissingPathColumnException extends ParquetLayerOpenException
{
	public MissingPathColumnException(String source, String pathColumnName)
	{
		super("No column named '" + pathColumnName + "' in " + source);
	}
}
