package com.earnix.parquet.layer.writer;

import com.earnix.parquet.layer.writer.compressors.Compressor;
import org.apache.parquet.bytes.BytesInput;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.column.page.DataPage;
import org.apache.parquet.column.page.DataPageV2;
import org.apache.parquet.column.page.DictionaryPage;
import org.apache.parquet.column.page.PageWriter;
import org.apache.parquet.column.statistics.SizeStatistics;
import org.apache.parquet.column.statistics.Statistics;
import org.apache.parquet.format.CompressionCodec;
import org.apache.parquet.io.ParquetEncodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.apache.parquet.bytes.BytesInput.copy;

/**
 * Keeps the pages of a single column chunk in memory, compressing the data of each page with the chunk codec. Only
 * v2 data pages are produced.
 */
public class InMemPageWriter implements PageWriter
{
	private static final Logger LOG = LoggerFactory.getLogger(InMemPageWriter.class);

	private final List<DataPage> pages = new ArrayList<>();
	private final Compressor compressor;
	private final CompressionCodec compressionCodec;
	private DictionaryPage dictionaryPage;
	private long memSize = 0;

	public InMemPageWriter(CompressionCodec compressionCodec)
	{
		this.compressionCodec = compressionCodec;
		this.compressor = Compressor.forCodec(compressionCodec);
	}

	@Override
	public void writePage(BytesInput bytesInput, int valueCount, Statistics statistics, Encoding rlEncoding,
			Encoding dlEncoding, Encoding valuesEncoding)
	{
		throw new UnsupportedOperationException("Only v2 data pages are written");
	}

	@Override
	public void writePage(BytesInput bytesInput, int valueCount, int rowCount, Statistics<?> statistics,
			Encoding rlEncoding, Encoding dlEncoding, Encoding valuesEncoding)
	{
		writePage(bytesInput, valueCount, statistics, rlEncoding, dlEncoding, valuesEncoding);
	}

	@Override
	public void writePage(BytesInput bytesInput, int valueCount, int rowCount, Statistics<?> statistics,
			SizeStatistics sizeStatistics, Encoding rlEncoding, Encoding dlEncoding, Encoding valuesEncoding)
	{
		writePage(bytesInput, valueCount, statistics, rlEncoding, dlEncoding, valuesEncoding);
	}

	@Override
	public void writePageV2(int rowCount, int nullCount, int valueCount, BytesInput repetitionLevels,
			BytesInput definitionLevels, Encoding dataEncoding, BytesInput data, Statistics<?> statistics)
			throws IOException
	{
		if (valueCount == 0)
		{
			throw new ParquetEncodingException("illegal page of 0 values");
		}
		long size = repetitionLevels.size() + definitionLevels.size() + data.size();
		memSize += size;

		DataPage page = null;
		if (compressor != null)
		{
			byte[] toCompress = data.toByteArray();
			byte[] compressed = new byte[compressor.maxCompressedLength(toCompress.length)];
			int compressedLen = compressor.compress(toCompress, compressed);

			// pages that do not shrink are stored uncompressed
			if (compressedLen < toCompress.length)
			{
				int uncompressedLen = Math.toIntExact(
						repetitionLevels.size() + definitionLevels.size() + toCompress.length);
				page = DataPageV2.compressed(rowCount, nullCount, valueCount, copy(repetitionLevels),
						copy(definitionLevels), dataEncoding, buildCompressedInput(compressedLen, compressed),
						uncompressedLen, statistics);
			}
		}
		if (page == null)
		{
			page = DataPageV2.uncompressed(rowCount, nullCount, valueCount, copy(repetitionLevels),
					copy(definitionLevels), dataEncoding, copy(data), statistics);
		}
		pages.add(page);
		LOG.debug("page written for {} bytes and {} records", size, valueCount);
	}

	@Override
	public void writePageV2(int rowCount, int nullCount, int valueCount, BytesInput repetitionLevels,
			BytesInput definitionLevels, Encoding dataEncoding, BytesInput data, Statistics<?> statistics,
			SizeStatistics sizeStatistics) throws IOException
	{
		writePageV2(rowCount, nullCount, valueCount, repetitionLevels, definitionLevels, dataEncoding, data,
				statistics);
	}

	private static BytesInput buildCompressedInput(int compressedLen, byte[] compressed)
	{
		if (compressedLen < compressed.length / 2)
			compressed = Arrays.copyOf(compressed, compressedLen);
		return BytesInput.from(compressed, 0, compressedLen);
	}

	@Override
	public void writeDictionaryPage(DictionaryPage dictionaryPage) throws IOException
	{
		if (this.dictionaryPage != null)
		{
			throw new ParquetEncodingException("Only one dictionary page per block");
		}
		this.memSize += dictionaryPage.getBytes().size();
		if (compressor != null)
		{
			byte[] toCompress = dictionaryPage.getBytes().toByteArray();
			byte[] compressed = new byte[compressor.maxCompressedLength(toCompress.length)];
			int compressedLen = compressor.compress(toCompress, compressed);
			this.dictionaryPage = new DictionaryPage(buildCompressedInput(compressedLen, compressed),
					dictionaryPage.getUncompressedSize(), dictionaryPage.getDictionarySize(),
					dictionaryPage.getEncoding());
		}
		else
		{
			this.dictionaryPage = dictionaryPage.copy();
		}
		LOG.debug("dictionary page written for {} bytes and {} records", dictionaryPage.getBytes().size(),
				dictionaryPage.getDictionarySize());
	}

	@Override
	public long getMemSize()
	{
		return memSize;
	}

	@Override
	public long allocatedSize()
	{
		return memSize;
	}

	@Override
	public String memUsageString(String prefix)
	{
		return String.format("%s %,d bytes", prefix, memSize);
	}

	public List<DataPage> getPages()
	{
		return pages;
	}

	public DictionaryPage getDictionaryPage()
	{
		return dictionaryPage;
	}

	public CompressionCodec getCompressionCodec()
	{
		return compressionCodec;
	}
}
