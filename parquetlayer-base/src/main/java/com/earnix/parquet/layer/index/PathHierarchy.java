package com.earnix.parquet.layer.index;

import com.earnix.parquet.layer.path.LayerPath;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The structurally complete tree of a {@link PathIndex}: every indexed path plus all of its ancestors, and the
 * ordered child names of every node. The root is a key of the children map but never a member of the paths.
 */
public class PathHierarchy
{
	private final ImmutableSet<LayerPath> allPaths;
	private final ImmutableMap<LayerPath, ImmutableList<String>> childrenMap;

	private PathHierarchy(ImmutableSet<LayerPath> allPaths, ImmutableMap<LayerPath, ImmutableList<String>> childrenMap)
	{
		this.allPaths = allPaths;
		this.childrenMap = childrenMap;
	}

	/**
	 * Synthesize the missing ancestors of the indexed paths. Children are listed in order of first discovery.
	 *
	 * @param index the path index
	 * @return the hierarchy
	 */
	public static PathHierarchy build(PathIndex index)
	{
		LayerPath root = LayerPath.absoluteRoot();
		Set<LayerPath> allPaths = new LinkedHashSet<>();
		Map<LayerPath, Set<String>> children = new LinkedHashMap<>();
		children.put(root, new LinkedHashSet<>());

		for (LayerPath leaf : index.paths())
		{
			LayerPath current = leaf;
			// an already visited node has all its ancestors registered
			while (!current.isRoot() && allPaths.add(current))
			{
				LayerPath parent = current.getParent();
				children.computeIfAbsent(parent, p -> new LinkedHashSet<>()).add(current.getName());
				current = parent;
			}
		}

		ImmutableMap.Builder<LayerPath, ImmutableList<String>> childrenMap = ImmutableMap.builder();
		children.forEach((parent, names) -> childrenMap.put(parent, ImmutableList.copyOf(names)));
		return new PathHierarchy(ImmutableSet.copyOf(allPaths), childrenMap.build());
	}

	/**
	 * @param path a node path
	 * @return whether the path is an indexed node or one of the ancestors of an indexed node
	 */
	public boolean contains(LayerPath path)
	{
		return allPaths.contains(path);
	}

	/**
	 * @return all the node paths of the tree (the root excluded), in order of first discovery
	 */
	public Set<LayerPath> allPaths()
	{
		return allPaths;
	}

	/**
	 * @param path a node path or the root
	 * @return the ordered child names, empty if the node has no children or is unknown
	 */
	public List<String> getChildren(LayerPath path)
	{
		return childrenMap.getOrDefault(path, ImmutableList.of());
	}

	/**
	 * @param path a node path or the root
	 * @return whether the path is a key of the children map
	 */
	public boolean hasChildren(LayerPath path)
	{
		return childrenMap.containsKey(path);
	}

	public int size()
	{
		return allPaths.size();
	}
}
