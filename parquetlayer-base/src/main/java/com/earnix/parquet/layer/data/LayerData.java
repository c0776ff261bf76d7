package com.earnix.parquet.layer.data;

import com.earnix.parquet.layer.path.LayerPath;
import org.apache.commons.lang3.tuple.Pair;

import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

/**
 * The read side of a hierarchical layer: a tree of nodes addressed by {@link LayerPath}, each answering a closed set
 * of {@link FieldKey fields}. A miss is never an exception: it is an empty optional, false or
 * {@link SpecType#UNKNOWN}.
 */
public interface LayerData
{
	/**
	 * @return whether the layer is produced incrementally while it is read
	 */
	boolean streamsData();

	/**
	 * @param path the path
	 * @return whether the path is the root, a node or an attribute of this layer
	 */
	boolean hasSpec(LayerPath path);

	/**
	 * @param path the path
	 * @return the kind of the spec at the path
	 */
	SpecType getSpecType(LayerPath path);

	/**
	 * @param path  the path
	 * @param field the field
	 * @return whether the field has a value
	 */
	boolean has(LayerPath path, FieldKey field);

	/**
	 * @param path  the path
	 * @param field the field
	 * @return the value of the field, empty if the path does not answer the field
	 */
	Optional<Object> get(LayerPath path, FieldKey field);

	/**
	 * @param path      the path
	 * @param fieldName the field token
	 * @return the value of the field, empty for unknown tokens
	 */
	default Optional<Object> get(LayerPath path, String fieldName)
	{
		return FieldKey.fromToken(fieldName).flatMap(field -> get(path, field));
	}

	/**
	 * @param path the path
	 * @return the fields the path answers, sorted by token
	 */
	Set<FieldKey> list(LayerPath path);

	/**
	 * Visit the root, then every node, each node that has a source row followed by its attributes
	 *
	 * @param visitor the visitor, traversal stops as soon as it returns false
	 */
	void visitSpecs(SpecVisitor visitor);

	SortedSet<Double> listAllTimeSamples();

	SortedSet<Double> listTimeSamplesForPath(LayerPath path);

	Optional<Pair<Double, Double>> getBracketingTimeSamples(double time);

	Optional<Pair<Double, Double>> getBracketingTimeSamplesForPath(LayerPath path, double time);

	int getNumTimeSamplesForPath(LayerPath path);

	Optional<Object> queryTimeSample(LayerPath path, double time);
}
