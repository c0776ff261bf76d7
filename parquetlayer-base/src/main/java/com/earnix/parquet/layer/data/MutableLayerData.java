package com.earnix.parquet.layer.data;

import com.earnix.parquet.layer.path.LayerPath;

/**
 * The mutation entry points a host may call on any layer
 */
public interface MutableLayerData extends LayerData
{
	void createSpec(LayerPath path, SpecType specType);

	void eraseSpec(LayerPath path);

	void moveSpec(LayerPath oldPath, LayerPath newPath);

	void set(LayerPath path, FieldKey field, Object value);

	void erase(LayerPath path, FieldKey field);

	void setTimeSample(LayerPath path, double time, Object value);

	void eraseTimeSample(LayerPath path, double time);
}
