package com.earnix.parquet.layer.schema;

import com.earnix.parquet.layer.exceptions.UnsupportedColumnTypeException;
import org.apache.parquet.schema.PrimitiveType;

/**
 * The attribute value types of a layer. Each parquet physical type that can be read maps onto exactly one of them.
 */
public enum AttributeType
{
	FLOAT("float", Float.class),
	DOUBLE("double", Double.class),
	INT("int", Integer.class),
	INT64("int64", Long.class),
	BOOL("bool", Boolean.class),
	STRING("string", String.class);

	private final String typeName;
	private final Class<?> valueClass;

	AttributeType(String typeName, Class<?> valueClass)
	{
		this.typeName = typeName;
		this.valueClass = valueClass;
	}

	/**
	 * @return the name of the type as reported by the typeName field
	 */
	public String getTypeName()
	{
		return typeName;
	}

	/**
	 * @return the boxed java class of the values of this type
	 */
	public Class<?> getValueClass()
	{
		return valueClass;
	}

	/**
	 * @param physicalType the parquet physical type
	 * @return the attribute type of columns of this physical type
	 * @throws UnsupportedColumnTypeException for INT96 and FIXED_LEN_BYTE_ARRAY
	 */
	public static AttributeType fromPhysicalType(PrimitiveType.PrimitiveTypeName physicalType)
			throws UnsupportedColumnTypeException
	{
		return switch (physicalType)
		{
			case FLOAT -> FLOAT;
			case DOUBLE -> DOUBLE;
			case INT32 -> INT;
			case INT64 -> INT64;
			case BOOLEAN -> BOOL;
			case BINARY -> STRING;
			case INT96, FIXED_LEN_BYTE_ARRAY -> throw new UnsupportedColumnTypeException(physicalType);
		};
	}

	@Override
	public String toString()
	{
		return typeName;
	}
}
