package com.earnix.parquet.layer.reader.chunk.internal;

import org.apache.parquet.VersionParser;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.Dictionary;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.column.impl.ColumnReaderImpl;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.io.api.PrimitiveConverter;

/**
 * Decodes the pages of an {@link InMemChunk} using the parquet-column {@link ColumnReaderImpl}. Values are pulled
 * through the getters, so the converter is a no-op.
 * <p>
 * This class shouldn't be directly used. Use {@link ChunkValuesReaderImpl} instead
 * </p>
 */
class ParquetExtendedColumnReader extends ColumnReaderImpl
{
	private static final DummyConverter dummyConverter = new DummyConverter();

	// a dummy parsed version - won't trigger corrupted file logic. Reading corrupted parquet files is a non goal.
	private static final VersionParser.ParsedVersion dummyParsedVersion = new VersionParser.ParsedVersion("earnix",
			"0.1", "????????");
	private final MemPageReader memPageReader;

	ParquetExtendedColumnReader(InMemChunk inMemChunk)
	{
		this(inMemChunk.getDescriptor(), inMemChunk.newPageReader());
	}

	private ParquetExtendedColumnReader(ColumnDescriptor path, MemPageReader pageReader)
	{
		super(path, pageReader, dummyConverter, dummyParsedVersion);
		this.memPageReader = pageReader;
	}

	/**
	 * @return whether the current page being read uses a dictionary encoding. This must not be called after all values
	 * 		are read.
	 */
	boolean currentPageUsesDictionary()
	{
		Encoding encoding = memPageReader.getValuesEncoding();
		return encoding != null && encoding.usesDictionary();
	}

	private static class DummyConverter extends PrimitiveConverter
	{
		@Override
		public void addBinary(Binary value)
		{
		}

		@Override
		public void addBoolean(boolean value)
		{
		}

		@Override
		public void addDouble(double value)
		{
		}

		@Override
		public void addFloat(float value)
		{
		}

		@Override
		public void addInt(int value)
		{
		}

		@Override
		public void addLong(long value)
		{
		}

		@Override
		public boolean hasDictionarySupport()
		{
			return true;
		}

		@Override
		public void setDictionary(Dictionary dictionary)
		{
			//ignore
		}

		@Override
		public void addValueFromDictionary(int dictionaryId)
		{
			// ignore
		}
	}
}
