package com.earnix.parquet.layer.file.reader;

import org.apache.commons.io.function.IOSupplier;
import org.apache.commons.io.input.BoundedInputStream;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * Supplies an input stream over a byte range of a file. Every stream owns its own file channel, so no descriptor is
 * held between reads.
 */
public class FileRangeInputStreamSupplier implements IOSupplier<InputStream>
{
	private final Path path;
	private final long startOffset;
	private final long numBytesToRead;

	/**
	 * @param path           the file to read
	 * @param startOffset    the start offset in the file
	 * @param numBytesToRead the length of the range
	 */
	public FileRangeInputStreamSupplier(Path path, long startOffset, long numBytesToRead)
	{
		if (startOffset < 0 || numBytesToRead < 0)
			throw new IllegalArgumentException("Invalid range " + startOffset + "+" + numBytesToRead + " of " + path);
		this.path = path;
		this.startOffset = startOffset;
		this.numBytesToRead = numBytesToRead;
	}

	/**
	 * Open a new input stream for the range. The caller MUST close the returned stream, which closes the file.
	 *
	 * @return the input stream
	 * @throws IOException on failure to open the file, or if the file is shorter than the range
	 */
	@Override
	public InputStream get() throws IOException
	{
		boolean success = false;
		FileChannel fc = FileChannel.open(path);
		try
		{
			sanityCheckFileLen(fc);
			fc.position(startOffset);
			InputStream ret = BoundedInputStream.builder().setInputStream(Channels.newInputStream(fc))
					.setMaxCount(numBytesToRead).get();
			success = true;
			return ret;
		}
		finally
		{
			// on success the returned stream owns the channel
			if (!success)
				fc.close();
		}
	}

	private void sanityCheckFileLen(FileChannel fc) throws IOException
	{
		long fileLen = fc.size();
		if (fileLen < startOffset + numBytesToRead)
		{
			throw new IOException(
					"File " + path + " ends before end offset: " + startOffset + " len: " + numBytesToRead + " size: "
							+ fileLen);
		}
	}

	public Path getPath()
	{
		return path;
	}

	public long getStartOffset()
	{
		return startOffset;
	}

	public long getNumBytesToRead()
	{
		return numBytesToRead;
	}
}
