package com.earnix.parquet.layer.reader;

import com.earnix.parquet.layer.utils.ParquetEnumUtils;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.SchemaElement;
import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;

import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Utils for processing parquet metadata
 */
public class ParquetMetadataUtils
{
	private static final String MALFORMED_SCHEMA = "Malformed parquet schema";

	/**
	 * Build the message type from parquet footer metadata. Groups and repeated fields are kept as they are, deciding
	 * which leaves are usable is left to the caller.
	 *
	 * @param md the parquet footer metadata
	 * @return the message type
	 * @throws UnsupportedEncodingException if the flattened schema elements do not form a single tree
	 */
	public static MessageType buildMessageType(FileMetaData md) throws UnsupportedEncodingException
	{
		Iterator<SchemaElement> it = md.getSchemaIterator();
		if (it == null || !it.hasNext())
			throw new UnsupportedEncodingException("Parquet footer has no schema");
		SchemaElement root = it.next();
		List<Type> fields = readChildren(root, it);
		if (it.hasNext())
		{
			throw new UnsupportedEncodingException(
					MALFORMED_SCHEMA + ": elements left after the " + root.getNum_children() + " children of the root");
		}
		return new MessageType(root.getName(), fields);
	}

	private static List<Type> readChildren(SchemaElement parent, Iterator<SchemaElement> it)
			throws UnsupportedEncodingException
	{
		List<Type> children = new ArrayList<>(parent.getNum_children());
		for (int i = 0; i < parent.getNum_children(); i++)
		{
			if (!it.hasNext())
			{
				throw new UnsupportedEncodingException(
						MALFORMED_SCHEMA + ": " + parent.getName() + " declares " + parent.getNum_children()
								+ " children but only " + i + " follow");
			}
			children.add(readType(it.next(), it));
		}
		return children;
	}

	private static Type readType(SchemaElement schemaElement, Iterator<SchemaElement> it)
			throws UnsupportedEncodingException
	{
		String nameKey = schemaElement.getName();
		if (!schemaElement.isSetRepetition_type())
			throw new UnsupportedEncodingException(MALFORMED_SCHEMA + ": field " + nameKey + " has no repetition");
		Type.Repetition repetition = ParquetEnumUtils.convert(schemaElement.getRepetition_type());

		if (schemaElement.getNum_children() > 0)
			return new GroupType(repetition, nameKey, readChildren(schemaElement, it));
		if (!schemaElement.isSetType())
			throw new UnsupportedEncodingException(MALFORMED_SCHEMA + ": field " + nameKey + " has no type");

		PrimitiveType.PrimitiveTypeName primitiveTypeName = ParquetEnumUtils.convert(schemaElement.getType());
		if (primitiveTypeName == PrimitiveType.PrimitiveTypeName.FIXED_LEN_BYTE_ARRAY)
		{
			if (!schemaElement.isSetType_length() || schemaElement.getType_length() <= 0)
				throw new UnsupportedEncodingException("fixed length binary must have a valid len: " + nameKey);
			return new PrimitiveType(repetition, primitiveTypeName, schemaElement.getType_length(), nameKey);
		}
		return new PrimitiveType(repetition, primitiveTypeName, nameKey);
	}
}
