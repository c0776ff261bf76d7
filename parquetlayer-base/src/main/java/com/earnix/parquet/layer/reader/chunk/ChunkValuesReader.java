package com.earnix.parquet.layer.reader.chunk;

import org.apache.parquet.io.api.Binary;

/**
 * A cursor over the values of a column chunk. The reader starts positioned on the first value; the getter matching
 * the physical type of the column returns the current value as long as {@link #isNull()} is false.
 */
public interface ChunkValuesReader
{
	/**
	 * @return Iterate to the next value, false if the current value was the last one
	 */
	boolean next();

	/**
	 * Skip the specified number of rows
	 *
	 * @param rowsToSkip number of rows to skip
	 */
	void skip(int rowsToSkip);

	/**
	 * @return whether the current value is null
	 */
	boolean isNull();

	int getInteger();

	boolean getBoolean();

	long getLong();

	Binary getBinary();

	float getFloat();

	double getDouble();

	/**
	 * @return whether the page of the current value is dictionary encoded
	 */
	boolean isDictionaryIdSupported();

	/**
	 * @return the total number of values (including nulls) in the chunk
	 */
	long getTotalValues();
}
