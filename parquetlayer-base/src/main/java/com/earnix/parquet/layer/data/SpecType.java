package com.earnix.parquet.layer.data;

public enum SpecType
{
	PSEUDO_ROOT,
	PRIM,
	ATTRIBUTE,
	UNKNOWN
}
