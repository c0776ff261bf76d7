package com.earnix.parquet.layer.data;

import com.earnix.parquet.layer.exceptions.ReadOnlyViolationException;
import com.earnix.parquet.layer.path.LayerPath;

/**
 * Base class of layers that only implement the read side. Every mutation fails with
 * {@link ReadOnlyViolationException}.
 */
public abstract class ReadOnlyLayerData implements MutableLayerData
{
	@Override
	public final void createSpec(LayerPath path, SpecType specType)
	{
		throw new ReadOnlyViolationException("createSpec(" + path + ")");
	}

	@Override
	public final void eraseSpec(LayerPath path)
	{
		throw new ReadOnlyViolationException("eraseSpec(" + path + ")");
	}

	@Override
	public final void moveSpec(LayerPath oldPath, LayerPath newPath)
	{
		throw new ReadOnlyViolationException("moveSpec(" + oldPath + ", " + newPath + ")");
	}

	@Override
	public final void set(LayerPath path, FieldKey field, Object value)
	{
		throw new ReadOnlyViolationException("set(" + path + ", " + field + ")");
	}

	@Override
	public final void erase(LayerPath path, FieldKey field)
	{
		throw new ReadOnlyViolationException("erase(" + path + ", " + field + ")");
	}

	@Override
	public final void setTimeSample(LayerPath path, double time, Object value)
	{
		throw new ReadOnlyViolationException("setTimeSample(" + path + ", " + time + ")");
	}

	@Override
	public final void eraseTimeSample(LayerPath path, double time)
	{
		throw new ReadOnlyViolationException("eraseTimeSample(" + path + ", " + time + ")");
	}
}
