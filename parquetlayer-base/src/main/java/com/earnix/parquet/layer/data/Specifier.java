package com.earnix.parquet.layer.data;

/**
 * How a node is declared. Parquet layers only ever override nodes defined elsewhere.
 */
public enum Specifier
{
	DEF,
	OVER,
	CLASS
}
