package com.earnix.parquet.layer.exceptions;

import org.apache.parquet.schema.PrimitiveType;

/**
 * A column has a physical type with no attribute type counterpart
 */
public class UnsupportedColumnTypeException extends Exception
{
	private final PrimitiveType.PrimitiveTypeName physicalType;

	public UnsupportedColumnTypeException(PrimitiveType.PrimitiveTypeName physicalType)
	{
		super("Unsupported parquet physical type " + physicalType);
		this.physicalType = physicalType;
	}

	public PrimitiveType.PrimitiveTypeName getPhysicalType()
	{
		return physicalType;
	}
}
