package com.earnix.parquet.layer.data;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fields a layer answers. Constants are declared in the alphabetical order of their tokens, so an
 * {@link java.util.EnumSet} of fields iterates sorted.
 */
public enum FieldKey
{
	CUSTOM("custom"),
	DEFAULT("default"),
	PRIM_CHILDREN("primChildren"),
	PROPERTIES("properties"),
	SPECIFIER("specifier"),
	TYPE_NAME("typeName"),
	VARIABILITY("variability");

	private static final Map<String, FieldKey> BY_TOKEN = Arrays.stream(values())
			.collect(Collectors.toUnmodifiableMap(FieldKey::getToken, Function.identity()));

	private final String token;

	FieldKey(String token)
	{
		this.token = token;
	}

	public String getToken()
	{
		return token;
	}

	/**
	 * @param token the field token
	 * @return the field, empty for tokens this layer does not know
	 */
	public static Optional<FieldKey> fromToken(String token)
	{
		return Optional.ofNullable(BY_TOKEN.get(token));
	}

	@Override
	public String toString()
	{
		return token;
	}
}
