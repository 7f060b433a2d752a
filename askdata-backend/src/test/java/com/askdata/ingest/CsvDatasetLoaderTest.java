package com.askdata.ingest;

import com.askdata.TestDatasets;
import com.askdata.model.ColumnType;
import com.askdata.model.Dataset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CsvDatasetLoaderTest {

    private CsvDatasetLoader loader;

    @BeforeEach
    void setUp() {
        loader = new CsvDatasetLoader(new CatalogBuilder(), 1000);
    }

    @Test
    void testLoadsTypedDataset() {
        LoadedDataset loaded = load(TestDatasets.SALES_CSV);
        Dataset dataset = loaded.dataset();

        assertEquals("data.csv", dataset.getSourceName());
        assertEquals(10, dataset.rowCount());
        assertEquals(Arrays.asList("date", "region", "product", "sales", "quantity"), dataset.getColumns());
        assertEquals(dataset.getVersion(), loaded.catalog().getDatasetVersion());

        assertEquals(ColumnType.DATETIME, loaded.catalog().typeOf("date").orElseThrow());
        assertEquals(ColumnType.CATEGORICAL, loaded.catalog().typeOf("region").orElseThrow());
        assertEquals(ColumnType.FLOAT, loaded.catalog().typeOf("sales").orElseThrow());
        assertEquals(ColumnType.INTEGER, loaded.catalog().typeOf("quantity").orElseThrow());

        assertEquals(100.5, dataset.value(0, 3));
        assertEquals(3L, dataset.value(0, 4));
    }

    @Test
    void testEachLoadGetsNewVersion() {
        assertNotEquals(load(TestDatasets.SALES_CSV).dataset().getVersion(),
                load(TestDatasets.SALES_CSV).dataset().getVersion());
    }

    @Test
    void testHeaderCleanup() {
        LoadedDataset loaded = load("\uFEFFname,,name\na,b,c\n");
        assertEquals(Arrays.asList("name", "column_2", "name_2"), loaded.dataset().getColumns());
    }

    @Test
    void testQuotedFields() {
        LoadedDataset loaded = load("city,note\n\"Portland, OR\",\"said \"\"hi\"\"\"\n");
        assertEquals("Portland, OR", loaded.dataset().value(0, 0));
        assertEquals("said \"hi\"", loaded.dataset().value(0, 1));
    }

    @Test
    void testShortRowsArePaddedWithMissing() {
        LoadedDataset loaded = load("a,b,c\n1,2,3\n4,5\n");
        assertEquals(2, loaded.dataset().rowCount());
        assertNull(loaded.dataset().value(1, 2));
    }

    @Test
    void testBlankLinesAreSkipped() {
        LoadedDataset loaded = load("a,b\n1,2\n\n,\n3,4\n");
        assertEquals(2, loaded.dataset().rowCount());
    }

    @Test
    void testMissingMarkersBecomeNull() {
        LoadedDataset loaded = load("a,b\n1,x\nNA,y\n3,n/a\n");
        assertEquals(ColumnType.INTEGER, loaded.catalog().typeOf("a").orElseThrow());
        assertNull(loaded.dataset().value(1, 0));
        assertNull(loaded.dataset().value(2, 1));
    }

    @Test
    void testLongRowIsRejected() {
        DatasetLoadException e = assertThrows(DatasetLoadException.class, () -> load("a,b\n1,2\n3,4,5\n"));
        assertTrue(e.getMessage().contains("3 fields"));
    }

    @Test
    void testHeaderOnlyIsRejected() {
        DatasetLoadException e = assertThrows(DatasetLoadException.class, () -> load("a,b\n"));
        assertTrue(e.getMessage().contains("no data rows"));
    }

    @Test
    void testEmptyFileIsRejected() {
        DatasetLoadException e = assertThrows(DatasetLoadException.class, () -> load(""));
        assertTrue(e.getMessage().contains("no header row"));
    }

    @Test
    void testRowLimit() {
        CsvDatasetLoader small = new CsvDatasetLoader(new CatalogBuilder(), 2);
        assertThrows(DatasetLoadException.class, () -> small.load("x.csv",
                new ByteArrayInputStream("a\n1\n2\n3\n".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void testLoadFromPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sales.csv");
        Files.writeString(file, TestDatasets.SALES_CSV);

        LoadedDataset loaded = loader.load(file);
        assertEquals("sales.csv", loaded.dataset().getSourceName());
        assertEquals(10, loaded.dataset().rowCount());
    }

    @Test
    void testMissingPathIsRejected(@TempDir Path dir) {
        assertThrows(DatasetLoadException.class, () -> loader.load(dir.resolve("missing.csv")));
    }

    private LoadedDataset load(String csv) {
        return loader.load("data.csv", new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));
    }
}
