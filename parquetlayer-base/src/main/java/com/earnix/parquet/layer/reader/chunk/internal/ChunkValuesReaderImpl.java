package com.earnix.parquet.layer.reader.chunk.internal;

import com.earnix.parquet.layer.reader.chunk.ChunkValuesReader;
import org.apache.parquet.io.api.Binary;

import java.util.NoSuchElementException;

/**
 * Note that this class is *NOT* threadsafe
 */
public class ChunkValuesReaderImpl implements ChunkValuesReader
{
	private final ParquetExtendedColumnReader columnReader;
	private final long numValues;
	private long numValuesRead;

	public ChunkValuesReaderImpl(InMemChunk chunk)
	{
		if (chunk.getTotalValues() <= 0)
			throw new IllegalArgumentException("Cannot read values of an empty chunk " + chunk.getDescriptor());
		columnReader = new ParquetExtendedColumnReader(chunk);
		numValues = chunk.getTotalValues();
		numValuesRead = 0;
	}

	@Override
	public boolean isNull()
	{
		return columnReader.getCurrentDefinitionLevel() < columnReader.getDescriptor().getMaxDefinitionLevel();
	}

	@Override
	public boolean next()
	{
		if (numValuesRead + 1 >= numValues)
		{
			numValuesRead = numValues;
			return false;
		}
		numValuesRead++;

		// skip is a misleading name for this method in the parquet-java library
		// What it actually does it check to see if we read a value in the data column yet, and if not, we skip over
		// the next value in the data column. If a value was read, it is a noop.
		// If the value is null, we shouldn't skip the value because no value is stored for null
		if (!isNull())
			columnReader.skip();

		// consume is also misleading. It consumes the Repetition and Definition level.
		// It does NOT consume the data value, which sometimes should NOT be consumed if it is null.
		columnReader.consume();
		return true;
	}

	@Override
	public void skip(int rowsToSkip)
	{
		if (rowsToSkip < 0)
			throw new IllegalArgumentException("rowsToSkip " + rowsToSkip + " must be greater than or equal to 0");

		for (int i = 0; i < rowsToSkip; i++)
		{
			if (!next())
			{
				throw new NoSuchElementException(
						"Failed to skip " + rowsToSkip + " elements, the " + i + " element does not exist");
			}
		}
	}

	@Override
	public int getInteger()
	{
		return columnReader.getInteger();
	}

	@Override
	public boolean getBoolean()
	{
		return columnReader.getBoolean();
	}

	@Override
	public long getLong()
	{
		return columnReader.getLong();
	}

	@Override
	public Binary getBinary()
	{
		return columnReader.getBinary();
	}

	@Override
	public float getFloat()
	{
		return columnReader.getFloat();
	}

	@Override
	public double getDouble()
	{
		return columnReader.getDouble();
	}

	@Override
	public boolean isDictionaryIdSupported()
	{
		return columnReader.currentPageUsesDictionary();
	}

	@Override
	public long getTotalValues()
	{
		return numValues;
	}
}
