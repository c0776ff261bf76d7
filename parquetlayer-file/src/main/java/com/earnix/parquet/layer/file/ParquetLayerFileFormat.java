package com.earnix.parquet.layer.file;

import com.earnix.parquet.layer.config.ParquetLayerConfig;
import com.earnix.parquet.layer.data.ParquetLayerData;
import com.earnix.parquet.layer.exceptions.ParquetLayerOpenException;
import com.earnix.parquet.layer.file.reader.ParquetFileReaderFactory;
import com.earnix.parquet.layer.reader.IndexedParquetColumnarReader;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * The entry point a host uses to load {@code .parquet} files as read only layers
 */
public class ParquetLayerFileFormat
{
	private static final Logger LOG = LoggerFactory.getLogger(ParquetLayerFileFormat.class);

	public static final String FORMAT_ID = "parquetFormat";
	public static final String VERSION = "1.0";
	public static final String TARGET = "usd";
	public static final String EXTENSION = "parquet";

	private final ParquetLayerConfig config;

	public ParquetLayerFileFormat()
	{
		this(new ParquetLayerConfig());
	}

	public ParquetLayerFileFormat(ParquetLayerConfig config)
	{
		this.config = Objects.requireNonNull(config, "config");
	}

	public String getFormatId()
	{
		return FORMAT_ID;
	}

	public String getVersion()
	{
		return VERSION;
	}

	public String getTarget()
	{
		return TARGET;
	}

	public String getExtension()
	{
		return EXTENSION;
	}

	/**
	 * @param path a file
	 * @return whether the file name carries the parquet extension, ignoring case. The file is not opened.
	 */
	public boolean canRead(Path path)
	{
		if (path == null || path.getFileName() == null)
			return false;
		return EXTENSION.equalsIgnoreCase(FilenameUtils.getExtension(path.getFileName().toString()));
	}

	/**
	 * Open a parquet file as a layer with the configuration of this format
	 *
	 * @param path the parquet file
	 * @return the opened layer, the caller should close it
	 * @throws ParquetLayerOpenException if the file could not be opened as a layer
	 */
	public ParquetLayerData read(Path path) throws ParquetLayerOpenException
	{
		return read(path, config);
	}

	/**
	 * Open a parquet file as a layer
	 *
	 * @param path   the parquet file
	 * @param config the layer configuration
	 * @return the opened layer, the caller should close it
	 * @throws ParquetLayerOpenException if the file could not be opened as a layer
	 */
	public ParquetLayerData read(Path path, ParquetLayerConfig config) throws ParquetLayerOpenException
	{
		Objects.requireNonNull(path, "path");
		Objects.requireNonNull(config, "config");
		LOG.debug("Reading {} as a layer", path);
		try
		{
			IndexedParquetColumnarReader reader = ParquetFileReaderFactory.createIndexedColumnarFileReader(path);
			return ParquetLayerData.open(reader, config);
		}
		catch (ParquetLayerOpenException ex)
		{
			throw ex;
		}
		catch (IOException | RuntimeException ex)
		{
			throw new ParquetLayerOpenException("Failed to open parquet layer " + path, ex);
		}
	}
}
