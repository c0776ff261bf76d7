package com.earnix.parquet.layer.reader;

import com.earnix.parquet.layer.reader.chunk.internal.ChunkDecompressToPageStoreFactory;
import com.earnix.parquet.layer.reader.chunk.internal.InMemChunk;
import com.earnix.parquet.layer.utils.ParquetMagicUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.apache.commons.io.input.CountingInputStream;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.format.ColumnChunk;
import org.apache.parquet.format.CompressionCodec;

import java.io.IOException;
import java.io.InputStream;

public class ParquetReaderUtils
{
	/**
	 * @param columnChunk the chunk to get the length of
	 * @return the length of the column chunk as stored in the parquet file
	 */
	public static long getLen(ColumnChunk columnChunk)
	{
		return columnChunk.getMeta_data().getTotal_compressed_size();
	}

	/**
	 * @param columnChunk the column chunk metadata
	 * @return the start offset of the column chunk in the parquet file.
	 */
	public static long getStartOffset(ColumnChunk columnChunk)
	{
		long startOffset = columnChunk.getMeta_data().getData_page_offset();

		// only use the dictionary as the start offset if it is valid. This should match the logic in the open source
		// java parquet driver in ParquetMetadataConverter.getOffset()
		if (columnChunk.getMeta_data().isSetDictionary_page_offset()
				&& columnChunk.getMeta_data().getDictionary_page_offset() > 0L
				&& columnChunk.getMeta_data().getDictionary_page_offset() < startOffset)
		{
			startOffset = columnChunk.getMeta_data().getDictionary_page_offset();
		}

		if (startOffset < ParquetMagicUtils.PARQUET_MAGIC.length())
			throw new IllegalArgumentException("Corrupted chunk metadata invalid startOffset.");

		return startOffset;
	}

	/**
	 * Read all the pages of a column chunk into memory. The stream is not closed.
	 *
	 * @param colDescriptor    the column of the chunk
	 * @param is               stream positioned at the first page of the chunk
	 * @param chunkLen         the number of bytes of the chunk
	 * @param compressionCodec the codec the pages are compressed with
	 * @return the decompressed chunk
	 * @throws IOException on failure reading or decompressing the pages
	 */
	public static InMemChunk readInMemChunk(ColumnDescriptor colDescriptor, InputStream is, long chunkLen,
			CompressionCodec compressionCodec) throws IOException
	{
		CountingInputStream countingInputStream = new CountingInputStream(
				BoundedInputStream.builder().setInputStream(is).setMaxCount(chunkLen).get());
		return new InMemChunk(
				ChunkDecompressToPageStoreFactory.buildColumnChunkPageStore(colDescriptor, countingInputStream,
						chunkLen, compressionCodec));
	}
}
