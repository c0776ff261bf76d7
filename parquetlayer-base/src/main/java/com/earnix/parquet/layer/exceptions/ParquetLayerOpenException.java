package com.earnix.parquet.layer.exceptions;

import java.io.IOException;

/**
 * Thrown when a parquet source cannot be opened as a layer. No partially opened layer is left behind.
 */
public class ParquetLayerOpenException extends IOException
{
	public ParquetLayerOpenException(String message)
	{
		super(message);
	}

	public ParquetLayerOpenException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
