package com.earnix.parquet.layer.file.reader;

import com.earnix.parquet.layer.utils.ParquetMagicUtils;
import org.apache.commons.io.IOUtils;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.Util;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * Reads the thrift footer of a parquet file
 */
public class ParquetFileMetadataReader
{
	private ParquetFileMetadataReader()
	{
	}

	/**
	 * @param path the parquet file
	 * @return the parsed footer
	 * @throws IOException on failure reading the file, or if it is not a parquet file
	 */
	public static FileMetaData readFileMetadata(Path path) throws IOException
	{
		try (FileChannel fc = FileChannel.open(path))
		{
			return readMetadata(fc, path);
		}
	}

	/**
	 * Read the footer of an opened file
	 *
	 * @param fc   the opened file
	 * @param path the file, for error messages
	 * @return the parsed footer
	 * @throws IOException on failure reading the file, or if it is not a parquet file
	 */
	static FileMetaData readMetadata(FileChannel fc, Path path) throws IOException
	{
		long size = fc.size();
		if (size < ParquetMagicUtils.TRAILER_LENGTH + ParquetMagicUtils.magicBytes().length)
			throw new IOException("File " + path + " is too small to be a parquet file: " + size + " bytes");

		ByteBuffer head = ByteBuffer.allocate(ParquetMagicUtils.magicBytes().length);
		fc.position(0L);
		IOUtils.readFully(fc, head);
		head.flip();
		if (!ParquetMagicUtils.expectMagic(head))
			throw new IOException("File " + path + " does not start with the parquet magic");

		ByteBuffer trailer = ByteBuffer.allocate(ParquetMagicUtils.TRAILER_LENGTH);
		fc.position(size - ParquetMagicUtils.TRAILER_LENGTH);
		IOUtils.readFully(fc, trailer);
		trailer.flip();
		long footerStart = ParquetMagicUtils.footerStartOffset(trailer, size);

		fc.position(footerStart);
		return Util.readFileMetaData(Channels.newInputStream(fc));
	}
}
