package com.earnix.parquet.layer.data;

import com.earnix.parquet.layer.cache.BlockCache;
import com.earnix.parquet.layer.cache.BlockLoader;
import com.earnix.parquet.layer.cache.BlockValues;
import com.earnix.parquet.layer.config.ParquetLayerConfig;
import com.earnix.parquet.layer.exceptions.ParquetLayerOpenException;
import com.earnix.parquet.layer.index.PathHierarchy;
import com.earnix.parquet.layer.index.PathIndex;
import com.earnix.parquet.layer.index.PathIndexBuilder;
import com.earnix.parquet.layer.index.PathLocation;
import com.earnix.parquet.layer.path.LayerPath;
import com.earnix.parquet.layer.reader.IndexedParquetColumnarReader;
import com.earnix.parquet.layer.schema.PropertyColumn;
import com.earnix.parquet.layer.schema.PropertySchema;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

/**
 * A read only layer over a parquet source. The path column is indexed once when the layer is opened; attribute values
 * are read lazily, one (attribute, row group) block at a time, on the first query that needs them.
 * <p>
 * Queries are thread safe. Closing the layer drops the loaded blocks; the layer must not be queried afterwards.
 * </p>
 */
public class ParquetLayerData extends ReadOnlyLayerData implements Closeable
{
	private static final Logger LOG = LoggerFactory.getLogger(ParquetLayerData.class);

	private final String sourceName;
	private final PathIndex pathIndex;
	private final PathHierarchy hierarchy;
	private final PropertySchema propertySchema;
	private final BlockCache blockCache;
	private final List<String> propertyNames;
	private volatile boolean closed;

	private ParquetLayerData(String sourceName, PathIndex pathIndex, PathHierarchy hierarchy,
			PropertySchema propertySchema, BlockCache blockCache)
	{
		this.sourceName = sourceName;
		this.pathIndex = pathIndex;
		this.hierarchy = hierarchy;
		this.propertySchema = propertySchema;
		this.blockCache = blockCache;
		this.propertyNames = ImmutableList.copyOf(propertySchema.names());
	}

	/**
	 * Open a layer with the default configuration
	 *
	 * @param reader the reader of the parquet source
	 * @return the opened layer
	 * @throws ParquetLayerOpenException if the source has no usable path column or could not be read
	 */
	public static ParquetLayerData open(IndexedParquetColumnarReader reader) throws ParquetLayerOpenException
	{
		return open(reader, new ParquetLayerConfig());
	}

	/**
	 * Open a layer: index the path column, synthesize the ancestors and resolve the attribute columns. No attribute
	 * value is read.
	 *
	 * @param reader the reader of the parquet source
	 * @param config the layer configuration
	 * @return the opened layer
	 * @throws ParquetLayerOpenException if the source has no usable path column or could not be read
	 */
	public static ParquetLayerData open(IndexedParquetColumnarReader reader, ParquetLayerConfig config)
			throws ParquetLayerOpenException
	{
		Objects.requireNonNull(reader, "reader");
		Objects.requireNonNull(config, "config");
		String sourceName = reader.describeSource();

		PathIndex pathIndex;
		try
		{
			pathIndex = PathIndexBuilder.fromReader(reader);
		}
		catch (ParquetLayerOpenException ex)
		{
			throw ex;
		}
		catch (IOException | RuntimeException ex)
		{
			throw new ParquetLayerOpenException("Failed to index the path column of " + sourceName, ex);
		}

		PathHierarchy hierarchy = PathHierarchy.build(pathIndex);
		PropertySchema propertySchema = PropertySchema.build(reader.getColumnDescriptors(),
				PathIndexBuilder.PATH_COLUMN);
		BlockCache blockCache = new BlockCache(propertySchema, reader.getNumRowGroups(), new BlockLoader(reader),
				config);

		LOG.info("Opened {}: {} rows in {} row groups, {} indexed paths, {} nodes, {} attributes ({} unsupported)",
				sourceName, reader.getTotalNumRows(), reader.getNumRowGroups(), pathIndex.size(), hierarchy.size(),
				propertySchema.size(), propertySchema.getUnsupportedColumns().size());
		return new ParquetLayerData(sourceName, pathIndex, hierarchy, propertySchema, blockCache);
	}

	@Override
	public boolean streamsData()
	{
		return false;
	}

	@Override
	public boolean hasSpec(LayerPath path)
	{
		return getSpecType(path) != SpecType.UNKNOWN;
	}

	@Override
	public SpecType getSpecType(LayerPath path)
	{
		checkOpen();
		switch (path.getKind())
		{
			case ROOT:
				return SpecType.PSEUDO_ROOT;
			case NODE:
				return hierarchy.contains(path) ? SpecType.PRIM : SpecType.UNKNOWN;
			case ATTRIBUTE:
				return isKnownAttribute(path) ? SpecType.ATTRIBUTE : SpecType.UNKNOWN;
			default:
				throw new IllegalStateException("Unhandled path kind " + path.getKind());
		}
	}

	@Override
	public boolean has(LayerPath path, FieldKey field)
	{
		if (field == FieldKey.PRIM_CHILDREN)
		{
			checkOpen();
			return !path.isAttributePath() && hierarchy.hasChildren(path);
		}
		return get(path, field).isPresent();
	}

	@Override
	public Optional<Object> get(LayerPath path, FieldKey field)
	{
		checkOpen();
		switch (path.getKind())
		{
			case ROOT:
				return getRootField(field);
			case NODE:
				return getNodeField(path, field);
			case ATTRIBUTE:
				return getAttributeField(path, field);
			default:
				throw new IllegalStateException("Unhandled path kind " + path.getKind());
		}
	}

	private Optional<Object> getRootField(FieldKey field)
	{
		if (field == FieldKey.PRIM_CHILDREN)
			return Optional.of(hierarchy.getChildren(LayerPath.absoluteRoot()));
		return Optional.empty();
	}

	private Optional<Object> getNodeField(LayerPath path, FieldKey field)
	{
		if (!hierarchy.contains(path))
			return Optional.empty();
		switch (field)
		{
			case PRIM_CHILDREN:
				return Optional.of(hierarchy.getChildren(path));
			case PROPERTIES:
				if (!pathIndex.contains(path) || propertySchema.isEmpty())
					return Optional.empty();
				return Optional.of(propertyNames);
			case SPECIFIER:
				return Optional.of(Specifier.OVER);
			case CUSTOM:
			case DEFAULT:
			case TYPE_NAME:
			case VARIABILITY:
				return Optional.empty();
			default:
				throw new IllegalStateException("Unhandled field " + field);
		}
	}

	private Optional<Object> getAttributeField(LayerPath path, FieldKey field)
	{
		if (!isKnownAttribute(path))
			return Optional.empty();
		switch (field)
		{
			case DEFAULT:
				return readValue(path);
			case TYPE_NAME:
				return propertySchema.get(path.getAttributeName()).<Object>map(PropertyColumn::getType);
			case VARIABILITY:
				return Optional.of(Variability.VARYING);
			case CUSTOM:
				return Optional.of(Boolean.FALSE);
			case PRIM_CHILDREN:
			case PROPERTIES:
			case SPECIFIER:
				return Optional.empty();
			default:
				throw new IllegalStateException("Unhandled field " + field);
		}
	}

	private Optional<Object> readValue(LayerPath attributePath)
	{
		PathLocation location = pathIndex.getLocation(attributePath.getNodePath()).orElseThrow();
		Optional<BlockValues> block = blockCache.get(attributePath.getAttributeName(), location.getRowGroup());
		return block.flatMap(values -> values.getValue(location.getRowOffset()));
	}

	private boolean isKnownAttribute(LayerPath attributePath)
	{
		return pathIndex.contains(attributePath.getNodePath())
				&& propertySchema.contains(attributePath.getAttributeName());
	}

	@Override
	public Set<FieldKey> list(LayerPath path)
	{
		checkOpen();
		EnumSet<FieldKey> fields = EnumSet.noneOf(FieldKey.class);
		switch (path.getKind())
		{
			case ROOT:
				fields.add(FieldKey.PRIM_CHILDREN);
				break;
			case ATTRIBUTE:
				if (isKnownAttribute(path))
				{
					fields.add(FieldKey.CUSTOM);
					fields.add(FieldKey.DEFAULT);
					fields.add(FieldKey.TYPE_NAME);
					fields.add(FieldKey.VARIABILITY);
				}
				break;
			case NODE:
				if (!hierarchy.getChildren(path).isEmpty())
					fields.add(FieldKey.PRIM_CHILDREN);
				if (pathIndex.contains(path) && !propertySchema.isEmpty())
					fields.add(FieldKey.PROPERTIES);
				if (hierarchy.contains(path))
					fields.add(FieldKey.SPECIFIER);
				break;
			default:
				throw new IllegalStateException("Unhandled path kind " + path.getKind());
		}
		return Collections.unmodifiableSet(fields);
	}

	@Override
	public void visitSpecs(SpecVisitor visitor)
	{
		checkOpen();
		if (!visitor.visitSpec(this, LayerPath.absoluteRoot()))
			return;

		for (LayerPath path : hierarchy.allPaths())
		{
			if (!visitor.visitSpec(this, path))
				return;

			if (pathIndex.contains(path))
			{
				for (String propertyName : propertyNames)
				{
					if (!visitor.visitSpec(this, path.appendAttribute(propertyName)))
						return;
				}
			}
		}
	}

	@Override
	public SortedSet<Double> listAllTimeSamples()
	{
		return ImmutableSortedSet.of();
	}

	@Override
	public SortedSet<Double> listTimeSamplesForPath(LayerPath path)
	{
		return ImmutableSortedSet.of();
	}

	@Override
	public Optional<Pair<Double, Double>> getBracketingTimeSamples(double time)
	{
		return Optional.empty();
	}

	@Override
	public Optional<Pair<Double, Double>> getBracketingTimeSamplesForPath(LayerPath path, double time)
	{
		return Optional.empty();
	}

	@Override
	public int getNumTimeSamplesForPath(LayerPath path)
	{
		return 0;
	}

	@Override
	public Optional<Object> queryTimeSample(LayerPath path, double time)
	{
		return Optional.empty();
	}

	public String getSourceName()
	{
		return sourceName;
	}

	public PathIndex getPathIndex()
	{
		return pathIndex;
	}

	public PathHierarchy getHierarchy()
	{
		return hierarchy;
	}

	public PropertySchema getPropertySchema()
	{
		return propertySchema;
	}

	public BlockCache getBlockCache()
	{
		return blockCache;
	}

	public boolean isClosed()
	{
		return closed;
	}

	private void checkOpen()
	{
		if (closed)
			throw new IllegalStateException("Layer " + sourceName + " is closed");
	}

	/**
	 * Drop every loaded block. Closing twice is a no-op.
	 */
	@Override
	public void close()
	{
		if (closed)
			return;
		closed = true;
		blockCache.invalidateAll();
		LOG.debug("Closed {}", sourceName);
	}
}
