package com.earnix.parquet.layer.reader;

import com.earnix.parquet.layer.RowGroupRowIndex;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.schema.MessageType;

import java.util.List;

public interface BaseColumnarReader
{
	/**
	 * @return the number of row groups in this parquet file
	 */
	int getNumRowGroups();

	/**
	 * @param rowGroup the row group offset
	 * @return the number of rows in the specified row group
	 */
	long getNumRowsInRowGroup(int rowGroup);

	/**
	 * @return the total number of rows in all of the row groups
	 */
	long getTotalNumRows();

	/**
	 * @return row counts and start rows of all the row groups
	 */
	RowGroupRowIndex getRowGroupRowIndex();

	/**
	 * @return the schema of this parquet file.
	 */
	MessageType getMessageType();

	/**
	 * @return a list of the column descriptors present in this parquet file, in schema order
	 */
	List<ColumnDescriptor> getColumnDescriptors();

	/**
	 * Get the column descriptor at the specified offset
	 *
	 * @param colOffset the column offset (id)
	 * @return the ColumnDescriptor of this Column
	 */
	ColumnDescriptor getDescriptor(int colOffset);

	/**
	 * @return number of columns in this parquet file
	 */
	default int getNumColumns()
	{
		return getColumnDescriptors().size();
	}
}
