package com.earnix.parquet.layer.data;

public enum Variability
{
	VARYING,
	UNIFORM
}
