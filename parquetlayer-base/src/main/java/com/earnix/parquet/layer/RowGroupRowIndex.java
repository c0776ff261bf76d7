package com.earnix.parquet.layer;

import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.RowGroup;

import java.util.Iterator;

/**
 * Row counts and absolute start rows of every row group (block) of a parquet file, computed once from the footer
 * metadata.
 */
public class RowGroupRowIndex
{
	private final long[] rowStart;

	/**
	 * Compute row starts and lengths from the file metadata
	 *
	 * @param fileMetaData the footer metadata
	 */
	public RowGroupRowIndex(FileMetaData fileMetaData)
	{
		rowStart = new long[fileMetaData.getRow_groupsSize() + 1];
		Iterator<RowGroup> it = fileMetaData.getRow_groupsIterator();

		rowStart[0] = 0;
		for (int i = 0; it != null && it.hasNext(); i++)
		{
			RowGroup rowGroup = it.next();
			if (rowGroup.getNum_rows() < 0)
				throw new IllegalArgumentException("Invalid parquet footer - row group " + i + " has negative rows");
			rowStart[i + 1] = rowStart[i] + rowGroup.getNum_rows();
		}

		// sanity check total num rows
		if (rowStart[rowStart.length - 1] != fileMetaData.getNum_rows())
		{
			throw new IllegalArgumentException(
					"Invalid parquet footer - row groups and total num rows is not consistent");
		}
	}

	/**
	 * Get the number of rows in this row group
	 *
	 * @param rowGroup the row group offset
	 * @return the number of rows in this row group
	 */
	public long getNumRows(int rowGroup)
	{
		assertRowGroupValid(rowGroup);
		return rowStart[rowGroup + 1] - rowStart[rowGroup];
	}

	/**
	 * Row groups are materialized into java arrays, so their row count must fit into an int.
	 *
	 * @param rowGroup the row group offset
	 * @return the number of rows in this row group
	 * @throws ArithmeticException if the row group is too large to be held in an array
	 */
	public int getNumRowsAsInt(int rowGroup)
	{
		return Math.toIntExact(getNumRows(rowGroup));
	}

	/**
	 * @return the number of row groups
	 */
	public int getNumRowGroups()
	{
		return rowStart.length - 1;
	}

	/**
	 * @return the number of rows in all the row groups
	 */
	public long getTotalNumRows()
	{
		return rowStart[rowStart.length - 1];
	}

	/**
	 * @param rowGroup the row group offset
	 * @return whether the offset refers to an existing row group
	 */
	public boolean isValidRowGroup(int rowGroup)
	{
		return rowGroup >= 0 && rowGroup < getNumRowGroups();
	}

	private void assertRowGroupValid(int rowGroup)
	{
		if (!isValidRowGroup(rowGroup))
			throw new IllegalArgumentException(
					"Row group out of range: " + rowGroup + " numRowGroups: " + getNumRowGroups());
	}
}
