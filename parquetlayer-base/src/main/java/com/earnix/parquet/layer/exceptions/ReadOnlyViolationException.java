package com.earnix.parquet.layer.exceptions;

/**
 * Thrown by every mutating entry point of a read only layer
 */
public class ReadOnlyViolationException extends UnsupportedOperationException
{
	public ReadOnlyViolationException(String operation)
	{
		super("Parquet layers are read only, " + operation + " is not supported");
	}
}
