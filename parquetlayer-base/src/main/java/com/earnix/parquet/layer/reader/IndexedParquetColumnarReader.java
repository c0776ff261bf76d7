package com.earnix.parquet.layer.reader;

import com.earnix.parquet.layer.reader.chunk.internal.InMemChunk;
import org.apache.parquet.column.ColumnDescriptor;

import java.io.IOException;

/**
 * A parquet columnar reader that indexes columns and row groups to allow reading a single column chunk of a single row
 * group into an {@link InMemChunk}.
 * <p> All lookups are done by maps that are constructed when this reader is built to ensure O(1) performance
 * regardless of how many columns and row groups are present.</p>
 * <p>Note that this does NOT need to be closed. This is because the offset indices are created on construction,
 * and the source is opened and closed every time an individual chunk is read</p>
 */
public interface IndexedParquetColumnarReader extends BaseColumnarReader
{
	/**
	 * Read a specific column chunk in a row group into memory
	 *
	 * @param rowGroup   the row group offset
	 * @param descriptor the column to read into memory
	 * @return the in memory chunk.
	 * @throws IOException on failure to read in the file
	 */
	InMemChunk readInMem(int rowGroup, ColumnDescriptor descriptor) throws IOException;

	/**
	 * Get a column descriptor by its path
	 *
	 * @param path the path of the column descriptor
	 * @return the column descriptor, or null if there is no such column
	 */
	ColumnDescriptor getDescriptorByPath(String... path);

	/**
	 * Get a top level column by its name
	 *
	 * @param name the column name
	 * @return the column descriptor, or null if there is no such column
	 */
	default ColumnDescriptor getDescriptorByName(String name)
	{
		return getDescriptorByPath(name);
	}

	/**
	 * @return a human readable description of the source this reader reads from
	 */
	String describeSource();
}
