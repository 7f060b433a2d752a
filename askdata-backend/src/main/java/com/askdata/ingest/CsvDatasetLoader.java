package com.askdata.ingest;

import de.siegmar.fastcsv.reader.CsvReader;
import de.siegmar.fastcsv.reader.CsvRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads comma-separated files with a header row.
 *
 * <p>Blank header cells are named {@code column_<n>} and repeated names get a numeric suffix so
 * that column names stay unique. Short rows are padded with missing values; rows with more
 * fields than the header are rejected.
 */
public class CsvDatasetLoader implements DatasetLoader {
    private static final Logger log = LoggerFactory.getLogger(CsvDatasetLoader.class);

    private static final char BOM = '\uFEFF';

    private final CatalogBuilder catalogBuilder;
    private final int maxRows;

    public CsvDatasetLoader(CatalogBuilder catalogBuilder, int maxRows) {
        this.catalogBuilder = catalogBuilder;
        this.maxRows = maxRows;
    }

    @Override
    public LoadedDataset load(String sourceName, InputStream in) {
        if (in == null) {
            throw new DatasetLoadException("No file content provided");
        }
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        List<String> columns = null;
        List<List<String>> rows = new ArrayList<>();
        try (CsvReader<CsvRecord> csv = CsvReader.builder()
                .skipEmptyLines(true)
                .ignoreDifferentFieldCount(true)
                .ofCsvRecord(reader)) {
            for (CsvRecord record : csv) {
                if (isBlank(record)) {
                    continue;
                }
                if (columns == null) {
                    columns = headerNames(record.getFields());
                    continue;
                }
                if (rows.size() >= maxRows) {
                    throw new DatasetLoadException("Dataset exceeds the limit of " + maxRows + " rows");
                }
                rows.add(widen(record, columns.size()));
            }
        } catch (IOException | UncheckedIOException e) {
            throw new DatasetLoadException("Failed to read " + sourceName, e);
        } catch (DatasetLoadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DatasetLoadException("Malformed CSV in " + sourceName + ": " + e.getMessage(), e);
        }

        if (columns == null || columns.isEmpty()) {
            throw new DatasetLoadException("File " + sourceName + " has no header row");
        }
        if (rows.isEmpty()) {
            throw new DatasetLoadException("File " + sourceName + " has no data rows");
        }

        LoadedDataset loaded = catalogBuilder.build(sourceName, columns, rows);
        log.info("Loaded dataset (source={}, rows={}, columns={}, version={})",
                sourceName, rows.size(), columns.size(), loaded.dataset().getVersion());
        return loaded;
    }

    private static List<String> widen(CsvRecord record, int width) {
        List<String> fields = record.getFields();
        if (fields.size() > width) {
            throw new DatasetLoadException("Line " + record.getStartingLineNumber() + " has "
                    + fields.size() + " fields, header has " + width);
        }
        List<String> row = new ArrayList<>(width);
        row.addAll(fields);
        while (row.size() < width) {
            row.add(null);
        }
        return row;
    }

    private static List<String> headerNames(List<String> raw) {
        List<String> out = new ArrayList<>(raw.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < raw.size(); i++) {
            String name = raw.get(i) == null ? "" : raw.get(i).trim();
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1).trim();
            }
            if (name.isEmpty()) {
                name = "column_" + (i + 1);
            }
            String unique = name;
            int suffix = 2;
            while (!seen.add(unique)) {
                unique = name + "_" + suffix++;
            }
            out.add(unique);
        }
        return out;
    }

    private static boolean isBlank(CsvRecord record) {
        for (String field : record.getFields()) {
            if (field != null && !field.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
