package com.earnix.parquet.layer.writer;

import com.earnix.parquet.layer.utils.ParquetEnumUtils;
import org.apache.parquet.bytes.BytesInput;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.page.DataPage;
import org.apache.parquet.column.page.DataPageV2;
import org.apache.parquet.column.page.DictionaryPage;
import org.apache.parquet.format.CompressionCodec;
import org.apache.parquet.format.DataPageHeaderV2;
import org.apache.parquet.format.DictionaryPageHeader;
import org.apache.parquet.format.Encoding;
import org.apache.parquet.format.PageHeader;
import org.apache.parquet.format.PageType;
import org.apache.parquet.format.Util;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The serialized headers and pages of one column chunk, ready to be appended to a parquet file
 */
public class ColumnChunkPages
{
	private final ColumnDescriptor columnDescriptor;
	private final Set<Encoding> encodingSet = EnumSet.noneOf(Encoding.class);
	private final List<byte[]> headersAndPages;
	private final long numValues;
	private final long uncompressedBytes;
	private final long compressedBytes;
	private final CompressionCodec compressionCodec;

	public ColumnChunkPages(ColumnDescriptor columnDescriptor, DictionaryPage dictionaryPage,
			List<? extends DataPage> dataPages, CompressionCodec compressionCodec)
	{
		this.columnDescriptor = columnDescriptor;
		this.compressionCodec = compressionCodec;
		int numPages = dictionaryPage == null ? dataPages.size() : dataPages.size() + 1;
		this.headersAndPages = new ArrayList<>(2 * numPages);
		long uncompressedBytes = 0;
		if (dictionaryPage != null)
		{
			DictionaryPageHeader dictionaryPageHeader = new DictionaryPageHeader();
			Encoding enc = ParquetEnumUtils.convert(dictionaryPage.getEncoding());
			dictionaryPageHeader.setEncoding(enc);
			encodingSet.add(enc);
			dictionaryPageHeader.setIs_sorted(false);
			dictionaryPageHeader.setNum_values(dictionaryPage.getDictionarySize());

			PageHeader pageHeader = new PageHeader();
			pageHeader.setType(PageType.DICTIONARY_PAGE);
			pageHeader.setDictionary_page_header(dictionaryPageHeader);
			pageHeader.setUncompressed_page_size(dictionaryPage.getUncompressedSize());
			pageHeader.setCompressed_page_size(dictionaryPage.getCompressedSize());

			uncompressedBytes += storeHeaderBytes(pageHeader);
			uncompressedBytes += dictionaryPage.getUncompressedSize();
			addBytes(dictionaryPage.getBytes());
		}

		long numValues = 0;
		for (DataPage dataPage : dataPages)
		{
			if (!(dataPage instanceof DataPageV2))
				throw new IllegalStateException("Unexpected page " + dataPage);
			uncompressedBytes += addPage((DataPageV2) dataPage);
			numValues += dataPage.getValueCount();
		}
		this.uncompressedBytes = uncompressedBytes;
		this.compressedBytes = headersAndPages.stream().mapToLong(Array::getLength).sum();
		this.numValues = numValues;
	}

	private int addPage(DataPageV2 dataPage)
	{
		DataPageHeaderV2 dataPageHeader = new DataPageHeaderV2();
		dataPageHeader.setNum_values(dataPage.getValueCount());
		dataPageHeader.setNum_nulls(dataPage.getNullCount());
		dataPageHeader.setNum_rows(dataPage.getRowCount());
		Encoding enc = ParquetEnumUtils.convert(dataPage.getDataEncoding());
		encodingSet.add(enc);
		dataPageHeader.setEncoding(enc);
		dataPageHeader.setDefinition_levels_byte_length(Math.toIntExact(dataPage.getDefinitionLevels().size()));
		dataPageHeader.setRepetition_levels_byte_length(Math.toIntExact(dataPage.getRepetitionLevels().size()));
		dataPageHeader.setIs_compressed(dataPage.isCompressed());

		PageHeader pageHeader = new PageHeader();
		pageHeader.setUncompressed_page_size(dataPage.getUncompressedSize());
		pageHeader.setCompressed_page_size(dataPage.getCompressedSize());
		pageHeader.setType(PageType.DATA_PAGE_V2);
		pageHeader.setData_page_header_v2(dataPageHeader);

		int headerSizeInBytes = storeHeaderBytes(pageHeader);
		addBytes(dataPage.getRepetitionLevels());
		addBytes(dataPage.getDefinitionLevels());
		addBytes(dataPage.getData());
		return headerSizeInBytes + dataPage.getUncompressedSize();
	}

	private void addBytes(BytesInput input)
	{
		try
		{
			if (input.size() > 0)
				headersAndPages.add(input.toByteArray());
		}
		catch (IOException ex)
		{
			throw new UncheckedIOException(ex);
		}
	}

	private int storeHeaderBytes(PageHeader pageHeader)
	{
		ByteArrayOutputStream baos = new ByteArrayOutputStream();
		try
		{
			Util.writePageHeader(pageHeader, baos);
		}
		catch (IOException ex)
		{
			// should never happen with byte array output stream.
			throw new UncheckedIOException(ex);
		}
		byte[] written = baos.toByteArray();
		headersAndPages.add(written);
		return written.length;
	}

	/**
	 * Write the bytes of this column chunk to an output stream
	 *
	 * @param os the output stream to write the bytes to
	 * @throws IOException on failure to write to the OutputStream
	 */
	public void writeToOutputStream(OutputStream os) throws IOException
	{
		for (byte[] toWrite : headersAndPages)
			os.write(toWrite);
	}

	/**
	 * @return The total number of bytes that this chunk takes when persisted
	 */
	public long totalBytesForStorage()
	{
		return compressedBytes;
	}

	public long getUncompressedBytes()
	{
		return uncompressedBytes;
	}

	public long getNumValues()
	{
		return numValues;
	}

	public Set<Encoding> getEncodingSet()
	{
		return Collections.unmodifiableSet(encodingSet);
	}

	public CompressionCodec getCompressionCodec()
	{
		return compressionCodec;
	}

	public ColumnDescriptor getColumnDescriptor()
	{
		return columnDescriptor;
	}
}
