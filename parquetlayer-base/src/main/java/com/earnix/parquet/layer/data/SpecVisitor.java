package com.earnix.parquet.layer.data;

import com.earnix.parquet.layer.path.LayerPath;

@FunctionalInterface
public interface SpecVisitor
{
	/**
	 * @param data the visited layer
	 * @param path the visited path
	 * @return false to stop the traversal
	 */
	boolean visitSpec(LayerData data, LayerPath path);
}
