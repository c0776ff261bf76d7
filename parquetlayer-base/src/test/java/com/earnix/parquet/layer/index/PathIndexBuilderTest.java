package com.earnix.parquet.layer.index;

import com.earnix.parquet.layer.path.LayerPath;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertThrows;

public class PathIndexBuilderTest
{
	@Test
	public void testValidPathsAreIndexed()
	{
		PathIndexBuilder builder = new PathIndexBuilder();
		Assert.assertTrue(builder.add("/World/Sphere1", 0, 0));
		Assert.assertTrue(builder.add("/World/Cube1", 0, 1));
		PathIndex index = builder.build();

		Assert.assertEquals(2, index.size());
		Assert.assertEquals(0, index.getSkippedRows());
		Assert.assertEquals(new PathLocation(0, 1), index.getLocation(LayerPath.parse("/World/Cube1")).get());
		Assert.assertFalse(index.contains(LayerPath.parse("/World")));
	}

	@Test
	public void testInvalidValuesAreSkipped()
	{
		PathIndexBuilder builder = new PathIndexBuilder();
		Assert.assertTrue(builder.add("/A", 0, 0));
		Assert.assertFalse(builder.add(null, 0, 1));
		Assert.assertFalse(builder.add("NotAbsolute", 0, 2));
		Assert.assertFalse(builder.add("/A.attr", 0, 3));
		Assert.assertFalse(builder.add("/", 0, 4));
		Assert.assertFalse(builder.add("/bad path", 0, 5));
		Assert.assertFalse(builder.add("", 0, 6));
		PathIndex index = builder.build();

		Assert.assertEquals(Collections.singleton(LayerPath.parse("/A")), index.paths());
		Assert.assertEquals(6, index.getSkippedRows());
	}

	@Test
	public void testLastWriteWinsAndFirstPositionKept()
	{
		PathIndexBuilder builder = new PathIndexBuilder();
		builder.add("/A", 0, 0);
		builder.add("/B", 0, 1);
		builder.add("/A", 1, 0);
		PathIndex index = builder.build();

		Assert.assertEquals(new PathLocation(1, 0), index.getLocation(LayerPath.parse("/A")).get());
		Assert.assertEquals(Arrays.asList(LayerPath.parse("/A"), LayerPath.parse("/B")),
				Arrays.asList(index.paths().toArray()));
	}

	@Test
	public void testIndexRejectsNonAbsoluteNodePaths()
	{
		assertThrows(IllegalArgumentException.class,
				() -> new PathIndex(Collections.singletonMap(LayerPath.parse("Relative"), new PathLocation(0, 0)), 0));
		assertThrows(IllegalArgumentException.class,
				() -> new PathIndex(Collections.singletonMap(LayerPath.parse("/A.b"), new PathLocation(0, 0)), 0));
		assertThrows(IllegalArgumentException.class, () -> new PathLocation(-1, 0));
	}
}
