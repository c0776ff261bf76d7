package com.earnix.parquet.layer.index;

import com.earnix.parquet.layer.RowGroupRowIndex;
import com.earnix.parquet.layer.exceptions.MalformedPathException;
import com.earnix.parquet.layer.exceptions.MissingPathColumnException;
import com.earnix.parquet.layer.exceptions.ParquetLayerOpenException;
import com.earnix.parquet.layer.path.LayerPath;
import com.earnix.parquet.layer.reader.IndexedParquetColumnarReader;
import com.earnix.parquet.layer.reader.chunk.ChunkValuesReader;
import com.earnix.parquet.layer.reader.chunk.internal.ChunkValuesReaderFactory;
import com.earnix.parquet.layer.reader.chunk.internal.InMemChunk;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.schema.PrimitiveType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds a {@link PathIndex} by scanning the path column of every row group once. Rows whose value is null, malformed,
 * relative, an attribute path or the root are skipped.
 */
public class PathIndexBuilder
{
	private static final Logger LOG = LoggerFactory.getLogger(PathIndexBuilder.class);

	/**
	 * Name of the column holding the node paths
	 */
	public static final String PATH_COLUMN = "path";

	private final Map<LayerPath, PathLocation> locations = new LinkedHashMap<>();
	private long skippedRows;

	/**
	 * Index the path column of a parquet source
	 *
	 * @param reader the reader of the source
	 * @return the index
	 * @throws MissingPathColumnException if there is no path column
	 * @throws ParquetLayerOpenException  if the path column is a group, is repeated or is not a byte array column
	 * @throws IOException                on failure to read or decode the path column
	 */
	public static PathIndex fromReader(IndexedParquetColumnarReader reader) throws IOException
	{
		ColumnDescriptor pathDescriptor = reader.getDescriptorByName(PATH_COLUMN);
		if (pathDescriptor == null)
		{
			if (reader.getMessageType().containsField(PATH_COLUMN))
			{
				throw new ParquetLayerOpenException("Column '" + PATH_COLUMN + "' of " + reader.describeSource()
						+ " must be a flat column, not a group");
			}
			throw new MissingPathColumnException(reader.describeSource(), PATH_COLUMN);
		}
		if (pathDescriptor.getMaxRepetitionLevel() > 0)
		{
			throw new ParquetLayerOpenException(
					"Column '" + PATH_COLUMN + "' of " + reader.describeSource() + " must not be repeated");
		}
		PrimitiveType.PrimitiveTypeName physicalType = pathDescriptor.getPrimitiveType().getPrimitiveTypeName();
		if (physicalType != PrimitiveType.PrimitiveTypeName.BINARY)
		{
			throw new ParquetLayerOpenException(
					"Column '" + PATH_COLUMN + "' of " + reader.describeSource() + " must be a byte array column, not "
							+ physicalType);
		}

		PathIndexBuilder builder = new PathIndexBuilder();
		RowGroupRowIndex rowGroupRowIndex = reader.getRowGroupRowIndex();
		for (int rowGroup = 0; rowGroup < rowGroupRowIndex.getNumRowGroups(); rowGroup++)
		{
			int numRows = rowGroupRowIndex.getNumRowsAsInt(rowGroup);
			if (numRows == 0)
				continue;

			InMemChunk chunk = reader.readInMem(rowGroup, pathDescriptor);
			if (chunk.getTotalValues() != numRows)
			{
				throw new IOException("Path column of row group " + rowGroup + " has " + chunk.getTotalValues()
						+ " values, expected " + numRows);
			}
			ChunkValuesReader values = ChunkValuesReaderFactory.createChunkReader(chunk);
			for (int row = 0; row < numRows; row++)
			{
				if (row > 0 && !values.next())
					throw new IOException("Path column of row group " + rowGroup + " ended at row " + row);
				String text = values.isNull() ? null : values.getBinary().toStringUsingUTF8();
				builder.add(text, rowGroup, row);
			}
		}

		PathIndex index = builder.build();
		if (index.getSkippedRows() > 0)
		{
			LOG.warn("Skipped {} rows of {} with a null, malformed or non absolute node path",
					index.getSkippedRows(), reader.describeSource());
		}
		return index;
	}

	/**
	 * Add a value of the path column
	 *
	 * @param text      the path text or null
	 * @param rowGroup  the row group of the value
	 * @param rowOffset the row offset of the value inside the row group
	 * @return whether the value was indexed
	 */
	public boolean add(String text, int rowGroup, int rowOffset)
	{
		if (text == null)
		{
			skip(text, rowGroup, rowOffset, "null value");
			return false;
		}

		LayerPath path;
		try
		{
			path = LayerPath.parse(text);
		}
		catch (MalformedPathException ex)
		{
			skip(text, rowGroup, rowOffset, ex.getMessage());
			return false;
		}

		if (!path.isAbsolute())
		{
			skip(text, rowGroup, rowOffset, "relative path");
			return false;
		}
		if (!path.isNodePath())
		{
			skip(text, rowGroup, rowOffset, "not a node path");
			return false;
		}
		// last write wins, LinkedHashMap keeps the position of the first write
		locations.put(path, new PathLocation(rowGroup, rowOffset));
		return true;
	}

	private void skip(String text, int rowGroup, int rowOffset, String reason)
	{
		skippedRows++;
		LOG.debug("Skipping path value '{}' at row group {} row {}: {}", text, rowGroup, rowOffset, reason);
	}

	public PathIndex build()
	{
		return new PathIndex(locations, skippedRows);
	}
}
