package com.earnix.parquet.layer.cache;

import com.earnix.parquet.layer.reader.IndexedParquetColumnarReader;
import com.earnix.parquet.layer.reader.chunk.ChunkValuesReader;
import com.earnix.parquet.layer.reader.chunk.internal.ChunkValuesReaderFactory;
import com.earnix.parquet.layer.reader.chunk.internal.InMemChunk;
import com.earnix.parquet.layer.schema.PropertyColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.BitSet;

/**
 * Reads exactly one column chunk of exactly one row group and materializes it into a typed {@link BlockValues}
 */
public class BlockLoader
{
	private static final Logger LOG = LoggerFactory.getLogger(BlockLoader.class);

	private final IndexedParquetColumnarReader reader;

	public BlockLoader(IndexedParquetColumnarReader reader)
	{
		this.reader = reader;
	}

	/**
	 * @param column   the attribute column
	 * @param rowGroup the row group
	 * @return the values of the column in the row group
	 * @throws IOException on failure to read or decode the chunk
	 */
	public BlockValues load(PropertyColumn column, int rowGroup) throws IOException
	{
		int numRows = reader.getRowGroupRowIndex().getNumRowsAsInt(rowGroup);
		BitSet nulls = new BitSet(numRows);
		if (numRows == 0)
			return materialize(column, null, 0, nulls);

		InMemChunk chunk = reader.readInMem(rowGroup, column.getDescriptor());
		if (chunk.getTotalValues() != numRows)
		{
			throw new IOException(
					"Column " + column.getName() + " of row group " + rowGroup + " has " + chunk.getTotalValues()
							+ " values, expected " + numRows);
		}
		BlockValues values = materialize(column, ChunkValuesReaderFactory.createChunkReader(chunk), numRows, nulls);
		LOG.debug("Loaded block {}@{} of {}: {} rows, {} nulls, {} pages, ~{} chunk bytes", column.getName(),
				rowGroup, reader.describeSource(), numRows, values.getNullCount(), chunk.getNumDataPages(),
				chunk.estimatedMemoryFootprint());
		return values;
	}

	private static BlockValues materialize(PropertyColumn column, ChunkValuesReader values, int numRows, BitSet nulls)
			throws IOException
	{
		return switch (column.getType())
		{
			case FLOAT -> readFloats(values, numRows, nulls);
			case DOUBLE -> readDoubles(values, numRows, nulls);
			case INT -> readInts(values, numRows, nulls);
			case INT64 -> readLongs(values, numRows, nulls);
			case BOOL -> readBooleans(values, numRows, nulls);
			case STRING -> readStrings(values, numRows, nulls);
		};
	}

	private static BlockValues readFloats(ChunkValuesReader values, int numRows, BitSet nulls) throws IOException
	{
		float[] arr = new float[numRows];
		for (int row = 0; row < numRows; row++)
		{
			if (advance(values, row, nulls))
				arr[row] = values.getFloat();
		}
		return new BlockValues.FloatValues(arr, nulls);
	}

	private static BlockValues readDoubles(ChunkValuesReader values, int numRows, BitSet nulls) throws IOException
	{
		double[] arr = new double[numRows];
		for (int row = 0; row < numRows; row++)
		{
			if (advance(values, row, nulls))
				arr[row] = values.getDouble();
		}
		return new BlockValues.DoubleValues(arr, nulls);
	}

	private static BlockValues readInts(ChunkValuesReader values, int numRows, BitSet nulls) throws IOException
	{
		int[] arr = new int[numRows];
		for (int row = 0; row < numRows; row++)
		{
			if (advance(values, row, nulls))
				arr[row] = values.getInteger();
		}
		return new BlockValues.IntValues(arr, nulls);
	}

	private static BlockValues readLongs(ChunkValuesReader values, int numRows, BitSet nulls) throws IOException
	{
		long[] arr = new long[numRows];
		for (int row = 0; row < numRows; row++)
		{
			if (advance(values, row, nulls))
				arr[row] = values.getLong();
		}
		return new BlockValues.LongValues(arr, nulls);
	}

	private static BlockValues readBooleans(ChunkValuesReader values, int numRows, BitSet nulls) throws IOException
	{
		boolean[] arr = new boolean[numRows];
		for (int row = 0; row < numRows; row++)
		{
			if (advance(values, row, nulls))
				arr[row] = values.getBoolean();
		}
		return new BlockValues.BooleanValues(arr, nulls);
	}

	private static BlockValues readStrings(ChunkValuesReader values, int numRows, BitSet nulls) throws IOException
	{
		String[] arr = new String[numRows];
		for (int row = 0; row < numRows; row++)
		{
			if (advance(values, row, nulls))
				arr[row] = values.getBinary().toStringUsingUTF8();
		}
		return new BlockValues.StringValues(arr, nulls);
	}

	/**
	 * Position the reader on the row and record it in the null mask
	 *
	 * @return whether the row has a value
	 */
	private static boolean advance(ChunkValuesReader values, int row, BitSet nulls) throws IOException
	{
		if (row > 0 && !values.next())
			throw new IOException("Column chunk ended at row " + row);
		if (values.isNull())
		{
			nulls.set(row);
			return false;
		}
		return true;
	}
}
