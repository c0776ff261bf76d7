package com.earnix.parquet.layer.file.reader;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.assertThrows;

public class FileRangeInputStreamSupplierTest
{
	private Path tmpFolder;
	private Path file;

	@Before
	public void setUp() throws Exception
	{
		tmpFolder = Files.createTempDirectory("file_range_test");
		file = tmpFolder.resolve("bytes.bin");
		Files.write(file, "0123456789".getBytes(StandardCharsets.US_ASCII));
	}

	@After
	public void tearDown() throws Exception
	{
		FileUtils.forceDelete(tmpFolder.toFile());
	}

	@Test
	public void testReadRange() throws IOException
	{
		FileRangeInputStreamSupplier supplier = new FileRangeInputStreamSupplier(file, 3, 4);
		try (InputStream is = supplier.get())
		{
			Assert.assertEquals("3456", IOUtils.toString(is, StandardCharsets.US_ASCII));
		}
		Assert.assertEquals(file, supplier.getPath());
		Assert.assertEquals(3, supplier.getStartOffset());
		Assert.assertEquals(4, supplier.getNumBytesToRead());
	}

	@Test
	public void testEveryStreamIsIndependent() throws IOException
	{
		FileRangeInputStreamSupplier supplier = new FileRangeInputStreamSupplier(file, 8, 2);
		try (InputStream first = supplier.get(); InputStream second = supplier.get())
		{
			Assert.assertEquals('8', first.read());
			Assert.assertEquals("89", IOUtils.toString(second, StandardCharsets.US_ASCII));
			Assert.assertEquals('9', first.read());
			Assert.assertEquals(-1, first.read());
		}
	}

	@Test
	public void testRangePastEndOfFile()
	{
		IOException ex = assertThrows(IOException.class, () -> new FileRangeInputStreamSupplier(file, 8, 3).get());
		Assert.assertTrue(ex.getMessage().contains(file.toString()));
		assertThrows(IOException.class, () -> new FileRangeInputStreamSupplier(file, 11, 0).get());
	}

	@Test
	public void testMissingFile()
	{
		assertThrows(IOException.class,
				() -> new FileRangeInputStreamSupplier(tmpFolder.resolve("missing.bin"), 0, 1).get());
	}

	@Test
	public void testNegativeRange()
	{
		assertThrows(IllegalArgumentException.class, () -> new FileRangeInputStreamSupplier(file, -1, 1));
		assertThrows(IllegalArgumentException.class, () -> new FileRangeInputStreamSupplier(file, 0, -1));
	}
}
