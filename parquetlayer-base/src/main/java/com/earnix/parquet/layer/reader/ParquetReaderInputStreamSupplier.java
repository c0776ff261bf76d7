package com.earnix.parquet.layer.reader;

import org.apache.parquet.format.FileMetaData;

import java.io.IOException;
import java.io.InputStream;

/**
 * Access to the raw bytes of a parquet source, agnostic to the backing storage (file system, memory, etc.)
 */
public interface ParquetReaderInputStreamSupplier
{
	/**
	 * Read the metadata of the parquet file.
	 *
	 * @return the metadata of the parquet file
	 * @throws IOException on IO Failure
	 */
	FileMetaData readMetaData() throws IOException;

	/**
	 * Create a new {@link InputStream} for the start offset to read the specified number of bytes
	 *
	 * @param startOffset    the start offset of the input stream
	 * @param numBytesToRead the number of bytes to read
	 * @return the created {@link InputStream}. The caller MUST close the returned stream
	 * @throws IOException on failure accessing the parquet bytes
	 */
	InputStream createInputStream(long startOffset, long numBytesToRead) throws IOException;

	/**
	 * @return a human readable name of the source, used in log and error messages
	 */
	default String describe()
	{
		return getClass().getSimpleName();
	}
}
