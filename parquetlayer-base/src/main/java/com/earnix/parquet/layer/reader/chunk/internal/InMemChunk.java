package com.earnix.parquet.layer.reader.chunk.internal;

import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.page.DataPage;
import org.apache.parquet.column.page.DictionaryPage;

import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Contains everything necessary for decoding the values of one column chunk of one row group
 */
public class InMemChunk
{
	private final ColumnDescriptor descriptor;
	private final Supplier<DictionaryPage> dictionaryPage;
	private final List<Supplier<DataPage>> dataPages;
	private final long totalValues;
	private final long totalPageBytes;

	public InMemChunk(InMemChunkPageStore pageStore)
	{
		this.descriptor = pageStore.getDescriptor();
		this.dictionaryPage = pageStore.getDictionaryPage();
		this.dataPages = pageStore.getDataPageList();
		this.totalValues = pageStore.getTotalValues();
		this.totalPageBytes = pageStore.getTotalPageBytes();
	}

	public ColumnDescriptor getDescriptor()
	{
		return descriptor;
	}

	/**
	 * @return whether the chunk starts with a dictionary page
	 */
	public boolean hasDictionary()
	{
		return dictionaryPage.get() != null;
	}

	/**
	 * @return a fresh page reader positioned before the first data page
	 */
	public MemPageReader newPageReader()
	{
		Iterator<Supplier<DataPage>> it = dataPages.iterator();
		Iterator<DataPage> dataPageIterator = new Iterator<>()
		{
			@Override
			public boolean hasNext()
			{
				return it.hasNext();
			}

			@Override
			public DataPage next()
			{
				return it.next().get();
			}
		};
		return new MemPageReader(dictionaryPage.get(), dataPageIterator, totalValues);
	}

	public int getNumDataPages()
	{
		return dataPages.size();
	}

	public long getTotalValues()
	{
		return totalValues;
	}

	/**
	 * A rough estimate of the memory footprint of this column chunk
	 *
	 * @return a rough estimate of the memory footprint of this column chunk
	 */
	public long estimatedMemoryFootprint()
	{
		return 100L + 100L * dataPages.size() + this.totalPageBytes;
	}
}
