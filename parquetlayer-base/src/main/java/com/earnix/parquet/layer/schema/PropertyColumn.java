package com.earnix.parquet.layer.schema;

import org.apache.parquet.column.ColumnDescriptor;

/**
 * A column exposed as an attribute on every indexed node
 */
public class PropertyColumn
{
	private final String name;
	private final ColumnDescriptor descriptor;
	private final AttributeType type;

	public PropertyColumn(String name, ColumnDescriptor descriptor, AttributeType type)
	{
		this.name = name;
		this.descriptor = descriptor;
		this.type = type;
	}

	public String getName()
	{
		return name;
	}

	public ColumnDescriptor getDescriptor()
	{
		return descriptor;
	}

	public AttributeType getType()
	{
		return type;
	}

	@Override
	public String toString()
	{
		return name + ":" + type;
	}
}
