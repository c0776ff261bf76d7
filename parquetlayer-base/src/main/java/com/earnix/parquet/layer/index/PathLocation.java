package com.earnix.parquet.layer.index;

/**
 * Physical location of the source row of a node: the row group and the row offset inside that row group
 */
public final class PathLocation
{
	private final int rowGroup;
	private final int rowOffset;

	public PathLocation(int rowGroup, int rowOffset)
	{
		if (rowGroup < 0 || rowOffset < 0)
			throw new IllegalArgumentException("Invalid location rowGroup: " + rowGroup + " rowOffset: " + rowOffset);
		this.rowGroup = rowGroup;
		this.rowOffset = rowOffset;
	}

	public int getRowGroup()
	{
		return rowGroup;
	}

	public int getRowOffset()
	{
		return rowOffset;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof PathLocation))
			return false;
		PathLocation that = (PathLocation) o;
		return rowGroup == that.rowGroup && rowOffset == that.rowOffset;
	}

	@Override
	public int hashCode()
	{
		return 31 * rowGroup + rowOffset;
	}

	@Override
	public String toString()
	{
		return "PathLocation{rowGroup=" + rowGroup + ", rowOffset=" + rowOffset + '}';
	}
}
