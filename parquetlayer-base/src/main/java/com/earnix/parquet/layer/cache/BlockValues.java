package com.earnix.parquet.layer.cache;

import com.earnix.parquet.layer.schema.AttributeType;

import java.util.BitSet;
import java.util.Optional;

/**
 * The materialized values of one attribute column in one row group. The backing array has one element per row; rows
 * flagged in the null mask have no value.
 */
public abstract class BlockValues
{
	private final int numRows;
	private final BitSet nulls;

	BlockValues(int numRows, BitSet nulls)
	{
		this.numRows = numRows;
		this.nulls = nulls;
	}

	public abstract AttributeType getType();

	/**
	 * @param row the row offset inside the row group
	 * @return the boxed value of a non-null row
	 */
	protected abstract Object boxedValue(int row);

	public int getNumRows()
	{
		return numRows;
	}

	public boolean isNull(int row)
	{
		checkRow(row);
		return nulls.get(row);
	}

	/**
	 * @param row the row offset inside the row group
	 * @return the boxed value, empty if the cell is null
	 */
	public Optional<Object> getValue(int row)
	{
		if (isNull(row))
			return Optional.empty();
		return Optional.of(boxedValue(row));
	}

	/**
	 * @return the number of null cells
	 */
	public int getNullCount()
	{
		return nulls.cardinality();
	}

	protected void checkRow(int row)
	{
		if (row < 0 || row >= numRows)
			throw new IndexOutOfBoundsException("Row " + row + " out of range, block has " + numRows + " rows");
	}

	public static final class FloatValues extends BlockValues
	{
		private final float[] values;

		public FloatValues(float[] values, BitSet nulls)
		{
			super(values.length, nulls);
			this.values = values;
		}

		public float getFloat(int row)
		{
			checkRow(row);
			return values[row];
		}

		@Override
		public AttributeType getType()
		{
			return AttributeType.FLOAT;
		}

		@Override
		protected Object boxedValue(int row)
		{
			return values[row];
		}
	}

	public static final class DoubleValues extends BlockValues
	{
		private final double[] values;

		public DoubleValues(double[] values, BitSet nulls)
		{
			super(values.length, nulls);
			this.values = values;
		}

		public double getDouble(int row)
		{
			checkRow(row);
			return values[row];
		}

		@Override
		public AttributeType getType()
		{
			return AttributeType.DOUBLE;
		}

		@Override
		protected Object boxedValue(int row)
		{
			return values[row];
		}
	}

	public static final class IntValues extends BlockValues
	{
		private final int[] values;

		public IntValues(int[] values, BitSet nulls)
		{
			super(values.length, nulls);
			this.values = values;
		}

		public int getInt(int row)
		{
			checkRow(row);
			return values[row];
		}

		@Override
		public AttributeType getType()
		{
			return AttributeType.INT;
		}

		@Override
		protected Object boxedValue(int row)
		{
			return values[row];
		}
	}

	public static final class LongValues extends BlockValues
	{
		private final long[] values;

		public LongValues(long[] values, BitSet nulls)
		{
			super(values.length, nulls);
			this.values = values;
		}

		public long getLong(int row)
		{
			checkRow(row);
			return values[row];
		}

		@Override
		public AttributeType getType()
		{
			return AttributeType.INT64;
		}

		@Override
		protected Object boxedValue(int row)
		{
			return values[row];
		}
	}

	public static final class BooleanValues extends BlockValues
	{
		private final boolean[] values;

		public BooleanValues(boolean[] values, BitSet nulls)
		{
			super(values.length, nulls);
			this.values = values;
		}

		public boolean getBoolean(int row)
		{
			checkRow(row);
			return values[row];
		}

		@Override
		public AttributeType getType()
		{
			return AttributeType.BOOL;
		}

		@Override
		protected Object boxedValue(int row)
		{
			return values[row];
		}
	}

	public static final class StringValues extends BlockValues
	{
		private final String[] values;

		public StringValues(String[] values, BitSet nulls)
		{
			super(values.length, nulls);
			this.values = values;
		}

		public String getString(int row)
		{
			checkRow(row);
			return values[row];
		}

		@Override
		public AttributeType getType()
		{
			return AttributeType.STRING;
		}

		@Override
		protected Object boxedValue(int row)
		{
			return values[row];
		}
	}
}
