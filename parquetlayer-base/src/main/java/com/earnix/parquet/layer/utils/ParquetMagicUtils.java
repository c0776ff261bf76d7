package com.earnix.parquet.layer.utils;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Parquet magic bytes and the trailing "footer length + magic" block
 */
public class ParquetMagicUtils
{
	/**
	 * The parquet magic string
	 */
	public static final String PARQUET_MAGIC = "PAR1";
	private static final byte[] PARQUET_MAGIC_BYTES = PARQUET_MAGIC.getBytes(StandardCharsets.US_ASCII);

	/**
	 * Size of the trailer at the very end of a parquet file: the little endian footer length followed by the magic
	 */
	public static final int TRAILER_LENGTH = Integer.BYTES + PARQUET_MAGIC_BYTES.length;

	/**
	 * Returns whether magic was contained in the byte buffer
	 *
	 * @param buf the byte buffer to check
	 * @return whether the magic was contained
	 */
	public static boolean expectMagic(ByteBuffer buf)
	{
		if (buf.remaining() < PARQUET_MAGIC_BYTES.length)
			return false;
		for (byte magicByte : PARQUET_MAGIC_BYTES)
		{
			if (buf.get() != magicByte)
				return false;
		}
		return true;
	}

	/**
	 * @return a copy of the magic bytes
	 */
	public static byte[] magicBytes()
	{
		return PARQUET_MAGIC_BYTES.clone();
	}

	/**
	 * Parse the trailer of a parquet file
	 *
	 * @param trailer    exactly {@link #TRAILER_LENGTH} bytes read from the end of the file
	 * @param sourceSize the total size of the file
	 * @return the start offset of the thrift footer
	 * @throws IOException if the magic is missing or the footer length is not consistent with the file size
	 */
	public static long footerStartOffset(ByteBuffer trailer, long sourceSize) throws IOException
	{
		if (trailer.remaining() != TRAILER_LENGTH)
			throw new IOException("Expected " + TRAILER_LENGTH + " trailer bytes, got " + trailer.remaining());
		trailer.order(ByteOrder.LITTLE_ENDIAN);// the parquet format is little endian
		int footerLen = trailer.getInt();
		if (!expectMagic(trailer))
			throw new IOException("Parquet file did not contain expected magic");

		long startPos = sourceSize - TRAILER_LENGTH - footerLen;
		if (footerLen <= 0 || startPos < PARQUET_MAGIC_BYTES.length)
			throw new IOException("Invalid parquet footer length " + footerLen + " for size " + sourceSize);
		return startPos;
	}

	public static byte[] createFooterAndMagic(int metadataSize)
	{
		byte[] footerLenAndMagic = new byte[TRAILER_LENGTH];
		ByteBuffer footerLenAndMagicByteBuf = ByteBuffer.wrap(footerLenAndMagic);
		footerLenAndMagicByteBuf.order(ByteOrder.LITTLE_ENDIAN);// the parquet format is little endian
		footerLenAndMagicByteBuf.putInt(metadataSize);
		footerLenAndMagicByteBuf.put(PARQUET_MAGIC_BYTES);
		if (footerLenAndMagicByteBuf.hasRemaining())
		{
			throw new IllegalStateException();
		}
		return footerLenAndMagic;
	}
}
