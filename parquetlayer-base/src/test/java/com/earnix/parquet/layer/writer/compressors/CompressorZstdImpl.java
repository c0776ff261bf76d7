package com.earnix.parquet.layer.writer.compressors;

import com.github.luben.zstd.Zstd;

public class CompressorZstdImpl implements Compressor
{
	private static final int COMPRESSION_LEVEL = 2;

	@Override
	public int compress(byte[] input, byte[] output)
	{
		long compressedSize = Zstd.compress(output, input, COMPRESSION_LEVEL);
		if (Zstd.isError(compressedSize))
		{
			throw new IllegalStateException("Error compressing bytes: " + Zstd.getErrorName(compressedSize));
		}
		return Math.toIntExact(compressedSize);
	}

	@Override
	public int maxCompressedLength(int numBytes)
	{
		return Math.toIntExact(Zstd.compressBound(numBytes));
	}
}
