package com.earnix.parquet.layer.cache;

import java.util.Objects;

/**
 * Identifies the values of one attribute in one row group
 */
public final class BlockKey
{
	private final String attributeName;
	private final int rowGroup;

	public BlockKey(String attributeName, int rowGroup)
	{
		this.attributeName = Objects.requireNonNull(attributeName, "attributeName");
		this.rowGroup = rowGroup;
	}

	public String getAttributeName()
	{
		return attributeName;
	}

	public int getRowGroup()
	{
		return rowGroup;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof BlockKey))
			return false;
		BlockKey blockKey = (BlockKey) o;
		return rowGroup == blockKey.rowGroup && attributeName.equals(blockKey.attributeName);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(attributeName, rowGroup);
	}

	@Override
	public String toString()
	{
		return attributeName + "@" + rowGroup;
	}
}
