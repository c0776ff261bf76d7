package com.earnix.parquet.layer.reader;

import org.apache.parquet.format.FileMetaData;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts the byte range reads issued against a delegate supplier
 */
public class CountingInputStreamSupplier implements ParquetReaderInputStreamSupplier
{
	private final ParquetReaderInputStreamSupplier delegate;
	private final AtomicInteger rangeReads = new AtomicInteger();
	private volatile boolean failReads;

	public CountingInputStreamSupplier(ParquetReaderInputStreamSupplier delegate)
	{
		this.delegate = delegate;
	}

	@Override
	public FileMetaData readMetaData() throws IOException
	{
		return delegate.readMetaData();
	}

	@Override
	public InputStream createInputStream(long startOffset, long numBytesToRead) throws IOException
	{
		rangeReads.incrementAndGet();
		if (failReads)
			throw new IOException("Injected read failure at " + startOffset);
		return delegate.createInputStream(startOffset, numBytesToRead);
	}

	@Override
	public String describe()
	{
		return delegate.describe();
	}

	public int getRangeReads()
	{
		return rangeReads.get();
	}

	public void resetRangeReads()
	{
		rangeReads.set(0);
	}

	public void setFailReads(boolean failReads)
	{
		this.failReads = failReads;
	}
}
