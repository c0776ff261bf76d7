package com.earnix.parquet.layer.cache;

import com.earnix.parquet.layer.config.ParquetLayerConfig;
import com.earnix.parquet.layer.schema.PropertyColumn;
import com.earnix.parquet.layer.schema.PropertySchema;
import com.google.common.base.Throwables;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.CacheStats;
import com.google.common.cache.LoadingCache;
import com.google.common.cache.RemovalListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Lazily loads and retains attribute blocks. A block is read on the first request for it and served from memory
 * afterwards; concurrent requests for the same missing block load it once. Failed loads are not cached.
 */
public class BlockCache
{
	private static final Logger LOG = LoggerFactory.getLogger(BlockCache.class);

	private final PropertySchema schema;
	private final int numRowGroups;
	private final LoadingCache<BlockKey, BlockValues> cache;

	public BlockCache(PropertySchema schema, int numRowGroups, BlockLoader loader, ParquetLayerConfig config)
	{
		this.schema = schema;
		this.numRowGroups = numRowGroups;

		CacheBuilder<Object, Object> builder = CacheBuilder.newBuilder().recordStats();
		if (config.isCacheBounded())
		{
			// a single segment keeps eviction in global least recently used order
			builder.concurrencyLevel(1).maximumSize(config.getMaxCachedBlocks());
		}
		RemovalListener<BlockKey, BlockValues> removalListener = notification -> {
			if (notification.wasEvicted())
				LOG.debug("Evicted block {}", notification.getKey());
		};
		this.cache = builder.removalListener(removalListener).build(new CacheLoader<BlockKey, BlockValues>()
		{
			@Override
			public BlockValues load(BlockKey key) throws IOException
			{
				PropertyColumn column = schema.get(key.getAttributeName()).orElseThrow(
						() -> new IllegalStateException("Unknown attribute " + key.getAttributeName()));
				return loader.load(column, key.getRowGroup());
			}
		});
	}

	/**
	 * Get the values of an attribute in a row group, loading them on a miss
	 *
	 * @param attributeName the attribute name
	 * @param rowGroup      the row group
	 * @return the block, empty without any I/O if the attribute is unknown, unsupported, or the row group is out of
	 * 		range
	 * @throws UncheckedIOException if the block could not be read
	 */
	public Optional<BlockValues> get(String attributeName, int rowGroup)
	{
		if (!schema.contains(attributeName) || rowGroup < 0 || rowGroup >= numRowGroups)
			return Optional.empty();
		try
		{
			return Optional.of(cache.get(new BlockKey(attributeName, rowGroup)));
		}
		catch (ExecutionException ex)
		{
			Throwable cause = ex.getCause();
			if (cause instanceof IOException)
				throw new UncheckedIOException((IOException) cause);
			Throwables.throwIfUnchecked(cause);
			throw new IllegalStateException(cause);
		}
	}

	/**
	 * @param key the block
	 * @return whether the block is in memory
	 */
	public boolean isCached(BlockKey key)
	{
		return cache.getIfPresent(key) != null;
	}

	public long size()
	{
		return cache.size();
	}

	public CacheStats stats()
	{
		return cache.stats();
	}

	/**
	 * Drop every block
	 */
	public void invalidateAll()
	{
		cache.invalidateAll();
		cache.cleanUp();
	}
}
