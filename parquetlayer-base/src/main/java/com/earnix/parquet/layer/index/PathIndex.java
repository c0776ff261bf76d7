package com.earnix.parquet.layer.index;

import com.earnix.parquet.layer.path.LayerPath;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The node paths found in the path column, mapped to the location of their source row. Iteration follows the first
 * appearance of each path; when a path appears more than once the last row wins.
 */
public class PathIndex
{
	private final Map<LayerPath, PathLocation> locations;
	private final long skippedRows;

	/**
	 * @param locations   the indexed paths in iteration order
	 * @param skippedRows the number of rows whose path value could not be indexed
	 */
	public PathIndex(Map<LayerPath, PathLocation> locations, long skippedRows)
	{
		for (LayerPath path : locations.keySet())
		{
			if (!path.isAbsolute() || !path.isNodePath())
				throw new IllegalArgumentException("Only absolute node paths can be indexed: " + path);
		}
		this.locations = Collections.unmodifiableMap(new LinkedHashMap<>(locations));
		this.skippedRows = skippedRows;
	}

	public Optional<PathLocation> getLocation(LayerPath path)
	{
		return Optional.ofNullable(locations.get(path));
	}

	public boolean contains(LayerPath path)
	{
		return locations.containsKey(path);
	}

	/**
	 * @return the indexed paths in iteration order
	 */
	public Set<LayerPath> paths()
	{
		return locations.keySet();
	}

	public int size()
	{
		return locations.size();
	}

	/**
	 * @return the number of rows that were skipped because the path value was null or not an absolute node path
	 */
	public long getSkippedRows()
	{
		return skippedRows;
	}
}
