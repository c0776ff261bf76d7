package com.earnix.parquet.layer.reader;

import com.earnix.parquet.layer.utils.ParquetMagicUtils;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.Util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;

/**
 * Serves a parquet file held in a byte array
 */
public class InMemoryInputStreamSupplier implements ParquetReaderInputStreamSupplier
{
	private final String name;
	private final byte[] bytes;

	public InMemoryInputStreamSupplier(String name, byte[] bytes)
	{
		this.name = name;
		this.bytes = bytes;
	}

	@Override
	public FileMetaData readMetaData() throws IOException
	{
		if (bytes.length < ParquetMagicUtils.TRAILER_LENGTH)
			throw new IOException(name + " is too short to be a parquet file");
		ByteBuffer trailer = ByteBuffer.wrap(bytes, bytes.length - ParquetMagicUtils.TRAILER_LENGTH,
				ParquetMagicUtils.TRAILER_LENGTH).slice();
		long footerStart = ParquetMagicUtils.footerStartOffset(trailer, bytes.length);
		int footerLen = Math.toIntExact(bytes.length - ParquetMagicUtils.TRAILER_LENGTH - footerStart);
		return Util.readFileMetaData(new ByteArrayInputStream(bytes, Math.toIntExact(footerStart), footerLen));
	}

	@Override
	public InputStream createInputStream(long startOffset, long numBytesToRead) throws IOException
	{
		if (startOffset < 0 || startOffset + numBytesToRead > bytes.length)
		{
			throw new IOException(
					name + " ends before end offset: " + startOffset + " len: " + numBytesToRead + " size: "
							+ bytes.length);
		}
		return new ByteArrayInputStream(bytes, Math.toIntExact(startOffset), Math.toIntExact(numBytesToRead));
	}

	@Override
	public String describe()
	{
		return name;
	}
}
