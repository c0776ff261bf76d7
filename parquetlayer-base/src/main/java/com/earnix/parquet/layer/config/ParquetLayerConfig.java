package com.earnix.parquet.layer.config;

public class ParquetLayerConfig
{
	/**
	 * Value of {@link #getMaxCachedBlocks()} that keeps every loaded block until the layer is closed
	 */
	public static final long UNBOUNDED = 0L;

	private final long maxCachedBlocks;

	public ParquetLayerConfig()
	{
		this(UNBOUNDED);
	}

	/**
	 * @param maxCachedBlocks the maximum number of (attribute, row group) blocks kept in memory. Least recently used
	 *                        blocks are evicted beyond this. Zero or negative means unbounded.
	 */
	public ParquetLayerConfig(long maxCachedBlocks)
	{
		this.maxCachedBlocks = maxCachedBlocks;
	}

	public long getMaxCachedBlocks()
	{
		return maxCachedBlocks;
	}

	public boolean isCacheBounded()
	{
		return maxCachedBlocks > 0;
	}
}
