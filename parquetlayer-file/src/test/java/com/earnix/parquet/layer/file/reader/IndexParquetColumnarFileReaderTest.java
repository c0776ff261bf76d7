package com.earnix.parquet.layer.file.reader;

import com.earnix.parquet.layer.reader.IndexedParquetColumnarReader;
import com.earnix.parquet.layer.reader.chunk.ChunkValuesReader;
import com.earnix.parquet.layer.reader.chunk.internal.ChunkValuesReaderFactory;
import com.earnix.parquet.layer.writer.LayerFixtures;
import org.apache.commons.io.FileUtils;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.format.CompressionCodec;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reading arbitrary column chunks from a parquet file
 */
public class IndexParquetColumnarFileReaderTest
{
	private Path tmpFolder;

	@Before
	public void setUp() throws Exception
	{
		tmpFolder = Files.createTempDirectory("index_parquet_test");
	}

	@After
	public void tearDown() throws Exception
	{
		FileUtils.forceDelete(tmpFolder.toFile());
	}

	@Test
	public void simpleTest() throws Exception
	{
		Path parquetFile = LayerFixtures.allTypes(CompressionCodec.ZSTD).writeTo(tmpFolder.resolve("all.parquet"));

		IndexedParquetColumnarReader fileReader = ParquetFileReaderFactory.createIndexedColumnarFileReader(parquetFile);
		Assert.assertEquals(parquetFile.toString(), fileReader.describeSource());
		Assert.assertEquals(3, fileReader.getNumRowGroups());
		Assert.assertEquals(5, fileReader.getTotalNumRows());
		Assert.assertEquals(8, fileReader.getNumColumns());

		ColumnDescriptor d = fileReader.getDescriptorByName("d");
		ChunkValuesReader reader = ChunkValuesReaderFactory.createChunkReader(fileReader.readInMem(2, d));
		Assert.assertEquals(2, reader.getTotalValues());
		Assert.assertEquals(-2.0, reader.getDouble(), 0.0);
		Assert.assertTrue(reader.next());
		Assert.assertEquals(9.0, reader.getDouble(), 0.0);
		Assert.assertFalse(reader.next());

		// chunks can be read in any order and more than once
		ChunkValuesReader first = ChunkValuesReaderFactory.createChunkReader(fileReader.readInMem(0, d));
		Assert.assertEquals(2.5, first.getDouble(), 0.0);
		Assert.assertTrue(first.next());
		Assert.assertTrue(first.isNull());
		ChunkValuesReader again = ChunkValuesReaderFactory.createChunkReader(fileReader.readInMem(2, d));
		Assert.assertEquals(-2.0, again.getDouble(), 0.0);
	}
}
