package com.earnix.parquet.layer.path;

import com.earnix.parquet.layer.exceptions.MalformedPathException;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An immutable slash delimited path addressing a node or an attribute of a layer.
 * <ul>
 * <li>the absolute root: {@code /}</li>
 * <li>a node path: {@code /World/Sphere1}, or a relative one such as {@code Sphere1}</li>
 * <li>an attribute path: {@code /World/Sphere1.temperature}</li>
 * </ul>
 * Node names must match {@code [A-Za-z_][A-Za-z0-9_]*}. Attribute names are any non-empty text without a slash.
 * Equality and ordering are by the textual form.
 */
public final class LayerPath implements Comparable<LayerPath>
{
	public enum Kind
	{
		ROOT, NODE, ATTRIBUTE
	}

	private static final char SEPARATOR = '/';
	private static final char ATTRIBUTE_SEPARATOR = '.';
	private static final Pattern NODE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private static final LayerPath ROOT = new LayerPath("/", Kind.ROOT, true, ImmutableList.of(), null);

	private final String text;
	private final Kind kind;
	private final boolean absolute;
	private final ImmutableList<String> nodeNames;
	private final String attributeName;

	private LayerPath(String text, Kind kind, boolean absolute, ImmutableList<String> nodeNames,
			String attributeName)
	{
		this.text = text;
		this.kind = kind;
		this.absolute = absolute;
		this.nodeNames = nodeNames;
		this.attributeName = attributeName;
	}

	/**
	 * @return the absolute root path {@code /}
	 */
	public static LayerPath absoluteRoot()
	{
		return ROOT;
	}

	/**
	 * Parse a path
	 *
	 * @param text the textual form
	 * @return the parsed path
	 * @throws MalformedPathException if the text does not follow the path grammar
	 */
	public static LayerPath parse(String text)
	{
		Objects.requireNonNull(text, "text");
		if (text.isEmpty())
			throw new MalformedPathException(text, "empty path");
		if (text.equals(ROOT.text))
			return ROOT;

		boolean absolute = text.charAt(0) == SEPARATOR;
		String body = absolute ? text.substring(1) : text;
		String[] segments = StringUtils.splitPreserveAllTokens(body, SEPARATOR);

		ImmutableList.Builder<String> nodeNames = ImmutableList.builderWithExpectedSize(segments.length);
		String attributeName = null;
		for (int i = 0; i < segments.length; i++)
		{
			String segment = segments[i];
			boolean last = i == segments.length - 1;
			int attributeSeparator = segment.indexOf(ATTRIBUTE_SEPARATOR);
			if (last && attributeSeparator >= 0)
			{
				attributeName = segment.substring(attributeSeparator + 1);
				if (attributeName.isEmpty())
					throw new MalformedPathException(text, "empty attribute name");
				segment = segment.substring(0, attributeSeparator);
			}
			if (!isValidNodeName(segment))
				throw new MalformedPathException(text, "invalid node name '" + segment + "'");
			nodeNames.add(segment);
		}
		return new LayerPath(text, attributeName == null ? Kind.NODE : Kind.ATTRIBUTE, absolute, nodeNames.build(),
				attributeName);
	}

	/**
	 * @param name a candidate node name
	 * @return whether the name can be used as a node name
	 */
	public static boolean isValidNodeName(String name)
	{
		return name != null && NODE_NAME.matcher(name).matches();
	}

	/**
	 * @param name a candidate attribute name
	 * @return whether the name can be used as an attribute name
	 */
	public static boolean isValidAttributeName(String name)
	{
		return StringUtils.isNotEmpty(name) && name.indexOf(SEPARATOR) < 0;
	}

	public Kind getKind()
	{
		return kind;
	}

	public boolean isAbsolute()
	{
		return absolute;
	}

	public boolean isRoot()
	{
		return kind == Kind.ROOT;
	}

	public boolean isNodePath()
	{
		return kind == Kind.NODE;
	}

	public boolean isAttributePath()
	{
		return kind == Kind.ATTRIBUTE;
	}

	/**
	 * @return the names of the nodes from the top level node down to this node (or the node owning this attribute)
	 */
	public List<String> getNodeNames()
	{
		return nodeNames;
	}

	/**
	 * The parent of an attribute path is the node owning it, the parent of a node is the node one level up. The
	 * top level nodes of an absolute path have the root as parent.
	 *
	 * @return the parent path, or null for the root and for single element relative paths
	 */
	public LayerPath getParent()
	{
		switch (kind)
		{
			case ROOT:
				return null;
			case ATTRIBUTE:
				return getNodePath();
			default:
				if (nodeNames.size() == 1)
					return absolute ? ROOT : null;
				List<String> parentNames = nodeNames.subList(0, nodeNames.size() - 1);
				return new LayerPath(join(absolute, parentNames), Kind.NODE, absolute, ImmutableList.copyOf(parentNames),
						null);
		}
	}

	/**
	 * @return the last element: the attribute name of attribute paths, the node name otherwise, empty for the root
	 */
	public String getName()
	{
		switch (kind)
		{
			case ROOT:
				return "";
			case ATTRIBUTE:
				return attributeName;
			default:
				return nodeNames.get(nodeNames.size() - 1);
		}
	}

	/**
	 * @return the node part of this path: the owning node for attribute paths, this path otherwise
	 */
	public LayerPath getNodePath()
	{
		if (kind != Kind.ATTRIBUTE)
			return this;
		return new LayerPath(join(absolute, nodeNames), Kind.NODE, absolute, nodeNames, null);
	}

	/**
	 * @return the attribute name
	 * @throws IllegalStateException if this is not an attribute path
	 */
	public String getAttributeName()
	{
		if (kind != Kind.ATTRIBUTE)
			throw new IllegalStateException(text + " is not an attribute path");
		return attributeName;
	}

	/**
	 * @param name the attribute name
	 * @return the path of an attribute of this node
	 */
	public LayerPath appendAttribute(String name)
	{
		if (kind != Kind.NODE)
			throw new IllegalStateException("Attributes can only be appended to node paths, not " + text);
		if (!isValidAttributeName(name))
			throw new MalformedPathException(String.valueOf(name), "invalid attribute name");
		return new LayerPath(text + ATTRIBUTE_SEPARATOR + name, Kind.ATTRIBUTE, absolute, nodeNames, name);
	}

	private static String join(boolean absolute, List<String> names)
	{
		String joined = String.join(String.valueOf(SEPARATOR), names);
		return absolute ? SEPARATOR + joined : joined;
	}

	@Override
	public int compareTo(LayerPath o)
	{
		return text.compareTo(o.text);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof LayerPath))
			return false;
		return text.equals(((LayerPath) o).text);
	}

	@Override
	public int hashCode()
	{
		return text.hashCode();
	}

	@Override
	public String toString()
	{
		return text;
	}
}
