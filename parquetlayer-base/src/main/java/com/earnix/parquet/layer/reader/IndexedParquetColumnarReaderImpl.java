package com.earnix.parquet.layer.reader;

import com.earnix.parquet.layer.RowGroupRowIndex;
import com.earnix.parquet.layer.reader.chunk.internal.InMemChunk;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.format.ColumnChunk;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.RowGroup;
import org.apache.parquet.schema.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.earnix.parquet.layer.reader.ParquetReaderUtils.getLen;
import static com.earnix.parquet.layer.reader.ParquetReaderUtils.getStartOffset;
import static com.earnix.parquet.layer.reader.ParquetReaderUtils.readInMemChunk;

/**
 * A {@link IndexedParquetColumnarReader} that reads through a {@link ParquetReaderInputStreamSupplier}
 */
public class IndexedParquetColumnarReaderImpl implements IndexedParquetColumnarReader
{
	private static final Logger LOG = LoggerFactory.getLogger(IndexedParquetColumnarReaderImpl.class);

	private final MessageType messageType;
	private final ParquetReaderInputStreamSupplier inputStreamSupplier;
	private final FileMetaData fileMetaData;
	private final RowGroupRowIndex rowGroupRowIndex;
	private final List<ColumnDescriptor> columnDescriptors;
	private final Map<List<String>, ColumnDescriptor> descriptorByPathMap;
	private final List<Map<ColumnDescriptor, ColumnChunk>> rowGroupToIndexedMetadata;

	/**
	 * Construct an indexed parquet columnar reader
	 *
	 * @param inputStreamSupplier supplier to get arbitrary InputStreams for parquet files agnostic to backing storage
	 *                            (filesystem, memory, etc.)
	 * @throws IOException on an IO failure reading the footer, or if the file layout is not supported
	 */
	public IndexedParquetColumnarReaderImpl(ParquetReaderInputStreamSupplier inputStreamSupplier) throws IOException
	{
		this.inputStreamSupplier = Objects.requireNonNull(inputStreamSupplier, "inputStreamSupplier");
		this.fileMetaData = inputStreamSupplier.readMetaData();
		this.rowGroupRowIndex = new RowGroupRowIndex(fileMetaData);
		this.messageType = ParquetMetadataUtils.buildMessageType(fileMetaData);

		rowGroupToIndexedMetadata = new ArrayList<>(fileMetaData.getRow_groupsSize());

		for (int rowGroupIdx = 0; rowGroupIdx < fileMetaData.getRow_groupsSize(); rowGroupIdx++)
		{
			RowGroup rowGroup = fileMetaData.getRow_groups().get(rowGroupIdx);
			Map<ColumnDescriptor, ColumnChunk> columnDescriptorColumnMetaDataMap = new HashMap<>();
			Iterator<ColumnChunk> it = rowGroup.getColumnsIterator();
			while (it != null && it.hasNext())
			{
				ColumnChunk columnChunk = it.next();
				assertChunkInSameFile(columnChunk, rowGroupIdx);
				ColumnDescriptor descriptor = messageType.getColumnDescription(
						columnChunk.getMeta_data().getPath_in_schema().toArray(new String[0]));
				ColumnChunk old = columnDescriptorColumnMetaDataMap.put(descriptor, columnChunk);
				assertNoDuplicateColumnChunks(old, descriptor);
			}
			rowGroupToIndexedMetadata.add(columnDescriptorColumnMetaDataMap);
		}

		descriptorByPathMap = new HashMap<>();
		this.columnDescriptors = List.copyOf(messageType.getColumns());
		for (ColumnDescriptor descriptor : this.columnDescriptors)
		{
			descriptorByPathMap.put(Arrays.asList(descriptor.getPath()), descriptor);
		}
		LOG.debug("Indexed {}: {} row groups, {} rows, {} columns", describeSource(), getNumRowGroups(),
				getTotalNumRows(), columnDescriptors.size());
	}

	private static void assertChunkInSameFile(ColumnChunk columnChunk, int rowGroup)
			throws UnsupportedEncodingException
	{
		// we don't support getting chunks from other files.
		if (columnChunk.isSetFile_path())
		{
			throw new UnsupportedEncodingException(
					"Column chunk in row group " + rowGroup + " is stored in external file " + columnChunk.getFile_path());
		}
		if (!columnChunk.isSetMeta_data())
		{
			throw new UnsupportedEncodingException("Column chunk in row group " + rowGroup + " has no metadata");
		}
	}

	private void assertNoDuplicateColumnChunks(ColumnChunk old, ColumnDescriptor descriptor)
			throws UnsupportedEncodingException
	{
		if (old != null)
		{
			throw new UnsupportedEncodingException(
					"Col " + descriptor + " present twice in RowGroup " + rowGroupToIndexedMetadata.size());
		}
	}

	private ColumnChunk getColumnChunk(int rowGroup, ColumnDescriptor descriptor)
	{
		if (rowGroup < 0 || rowGroup >= this.rowGroupToIndexedMetadata.size())
		{
			throw new IllegalArgumentException("Tried to read row group " + rowGroup + " but there are only "
					+ this.rowGroupToIndexedMetadata.size() + " row groups.");
		}
		Map<ColumnDescriptor, ColumnChunk> rowGrpMap = this.rowGroupToIndexedMetadata.get(rowGroup);
		ColumnChunk colChunk = rowGrpMap.get(Objects.requireNonNull(descriptor, "descriptor must not be null"));
		return Objects.requireNonNull(colChunk, "Column not found in row group.");
	}

	@Override
	public InMemChunk readInMem(int rowGroup, ColumnDescriptor descriptor) throws IOException
	{
		ColumnChunk columnChunk = getColumnChunk(rowGroup, descriptor);
		long start = getStartOffset(columnChunk);
		long len = getLen(columnChunk);
		try (InputStream is = inputStreamSupplier.createInputStream(start, len))
		{
			return readInMemChunk(descriptor, is, len, columnChunk.getMeta_data().getCodec());
		}
	}

	@Override
	public ColumnDescriptor getDescriptorByPath(String... path)
	{
		return descriptorByPathMap.get(Arrays.asList(path));
	}

	@Override
	public String describeSource()
	{
		return inputStreamSupplier.describe();
	}

	@Override
	public int getNumRowGroups()
	{
		return rowGroupRowIndex.getNumRowGroups();
	}

	@Override
	public long getNumRowsInRowGroup(int rowGroup)
	{
		return rowGroupRowIndex.getNumRows(rowGroup);
	}

	@Override
	public long getTotalNumRows()
	{
		return fileMetaData.getNum_rows();
	}

	@Override
	public RowGroupRowIndex getRowGroupRowIndex()
	{
		return rowGroupRowIndex;
	}

	@Override
	public MessageType getMessageType()
	{
		return messageType;
	}

	@Override
	public List<ColumnDescriptor> getColumnDescriptors()
	{
		return columnDescriptors;
	}

	@Override
	public ColumnDescriptor getDescriptor(int colOffset)
	{
		return columnDescriptors.get(colOffset);
	}
}
