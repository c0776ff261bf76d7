package com.earnix.parquet.layer.index;

import com.earnix.parquet.layer.path.LayerPath;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class PathHierarchyTest
{
	private static PathIndex index(String... paths)
	{
		PathIndexBuilder builder = new PathIndexBuilder();
		for (int i = 0; i < paths.length; i++)
			builder.add(paths[i], 0, i);
		return builder.build();
	}

	private static List<LayerPath> parse(String... paths)
	{
		List<LayerPath> ret = new ArrayList<>();
		for (String path : paths)
			ret.add(LayerPath.parse(path));
		return ret;
	}

	@Test
	public void testAncestorsAreSynthesized()
	{
		PathHierarchy hierarchy = PathHierarchy.build(index("/World/Sphere1", "/World/Cube1"));

		Assert.assertEquals(parse("/World/Sphere1", "/World", "/World/Cube1"), new ArrayList<>(hierarchy.allPaths()));
		Assert.assertTrue(hierarchy.contains(LayerPath.parse("/World")));
		Assert.assertFalse(hierarchy.contains(LayerPath.absoluteRoot()));
		Assert.assertEquals(Arrays.asList("Sphere1", "Cube1"), hierarchy.getChildren(LayerPath.parse("/World")));
		Assert.assertEquals(Collections.singletonList("World"), hierarchy.getChildren(LayerPath.absoluteRoot()));
	}

	@Test
	public void testEveryAncestorUpToTheRootExists()
	{
		PathHierarchy hierarchy = PathHierarchy.build(index("/A/B/C/D", "/A/X"));
		for (LayerPath path : hierarchy.allPaths())
		{
			LayerPath parent = path.getParent();
			Assert.assertTrue(parent.isRoot() || hierarchy.contains(parent));
			Assert.assertTrue(hierarchy.getChildren(parent).contains(path.getName()));
		}
		Assert.assertEquals(5, hierarchy.size());
		Assert.assertEquals(Arrays.asList("B", "X"), hierarchy.getChildren(LayerPath.parse("/A")));
	}

	@Test
	public void testChildrenAreNotDuplicated()
	{
		PathHierarchy hierarchy = PathHierarchy.build(index("/A/B", "/A", "/A/B/C", "/A/C"));
		Assert.assertEquals(Arrays.asList("B", "C"), hierarchy.getChildren(LayerPath.parse("/A")));
		Assert.assertEquals(Collections.singletonList("C"), hierarchy.getChildren(LayerPath.parse("/A/B")));
		Assert.assertEquals(Collections.singletonList("A"), hierarchy.getChildren(LayerPath.absoluteRoot()));
	}

	@Test
	public void testLeavesHaveNoChildren()
	{
		PathHierarchy hierarchy = PathHierarchy.build(index("/A/B"));
		Assert.assertTrue(hierarchy.hasChildren(LayerPath.parse("/A")));
		Assert.assertFalse(hierarchy.hasChildren(LayerPath.parse("/A/B")));
		Assert.assertTrue(hierarchy.getChildren(LayerPath.parse("/A/B")).isEmpty());
		Assert.assertTrue(hierarchy.getChildren(LayerPath.parse("/Unknown")).isEmpty());
	}

	@Test
	public void testEmptyIndex()
	{
		PathHierarchy hierarchy = PathHierarchy.build(index());
		Assert.assertEquals(0, hierarchy.size());
		Assert.assertTrue(hierarchy.hasChildren(LayerPath.absoluteRoot()));
		Assert.assertTrue(hierarchy.getChildren(LayerPath.absoluteRoot()).isEmpty());
	}

	@Test
	public void testBuildIsDeterministic()
	{
		PathIndex index = index("/World/Sphere1", "/Other/Thing", "/World/Cube1/Face");
		PathHierarchy first = PathHierarchy.build(index);
		PathHierarchy second = PathHierarchy.build(index);
		Assert.assertEquals(new ArrayList<>(first.allPaths()), new ArrayList<>(second.allPaths()));
		for (LayerPath path : first.allPaths())
			Assert.assertEquals(first.getChildren(path), second.getChildren(path));
	}
}
