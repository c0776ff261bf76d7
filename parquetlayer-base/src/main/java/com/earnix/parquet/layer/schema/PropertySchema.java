package com.earnix.parquet.layer.schema;

import com.earnix.parquet.layer.exceptions.UnsupportedColumnTypeException;
import com.earnix.parquet.layer.path.LayerPath;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.parquet.column.ColumnDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The attribute columns of a layer, in schema order. Nested or repeated columns, columns with an unsupported physical
 * type and columns whose name cannot be used as an attribute name are recorded as unsupported and are absent
 * everywhere.
 */
public class PropertySchema
{
	private static final Logger LOG = LoggerFactory.getLogger(PropertySchema.class);

	private final ImmutableMap<String, PropertyColumn> columns;
	private final ImmutableList<String> unsupportedColumns;

	private PropertySchema(ImmutableMap<String, PropertyColumn> columns, ImmutableList<String> unsupportedColumns)
	{
		this.columns = columns;
		this.unsupportedColumns = unsupportedColumns;
	}

	/**
	 * Build the schema from the leaf columns of a parquet file
	 *
	 * @param descriptors the columns in schema order
	 * @param pathColumn  the name of the path column, which is not an attribute
	 * @return the schema
	 */
	public static PropertySchema build(List<ColumnDescriptor> descriptors, String pathColumn)
	{
		Map<String, PropertyColumn> columns = new LinkedHashMap<>();
		ImmutableList.Builder<String> unsupported = ImmutableList.builder();
		for (ColumnDescriptor descriptor : descriptors)
		{
			String[] columnPath = descriptor.getPath();
			String name = String.join(".", columnPath);
			if (name.equals(pathColumn))
				continue;
			if (columnPath.length > 1 || descriptor.getMaxRepetitionLevel() > 0)
			{
				LOG.warn("Column '{}' is ignored: only flat, non repeated columns can be attributes", name);
				unsupported.add(name);
				continue;
			}
			if (!LayerPath.isValidAttributeName(name))
			{
				LOG.warn("Column '{}' cannot be used as an attribute name and is ignored", name);
				unsupported.add(name);
				continue;
			}
			try
			{
				AttributeType type = AttributeType.fromPhysicalType(
						descriptor.getPrimitiveType().getPrimitiveTypeName());
				columns.put(name, new PropertyColumn(name, descriptor, type));
			}
			catch (UnsupportedColumnTypeException ex)
			{
				LOG.warn("Column '{}' is ignored: {}", name, ex.getMessage());
				unsupported.add(name);
			}
		}
		return new PropertySchema(ImmutableMap.copyOf(columns), unsupported.build());
	}

	/**
	 * @param name the attribute name
	 * @return the column of a supported attribute
	 */
	public Optional<PropertyColumn> get(String name)
	{
		return Optional.ofNullable(columns.get(name));
	}

	public boolean contains(String name)
	{
		return columns.containsKey(name);
	}

	/**
	 * @return the supported attribute names in schema order
	 */
	public Set<String> names()
	{
		return columns.keySet();
	}

	/**
	 * @return the names of the columns that are not exposed as attributes
	 */
	public List<String> getUnsupportedColumns()
	{
		return unsupportedColumns;
	}

	public int size()
	{
		return columns.size();
	}

	public boolean isEmpty()
	{
		return columns.isEmpty();
	}
}
