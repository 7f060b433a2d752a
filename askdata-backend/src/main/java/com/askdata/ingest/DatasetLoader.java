package com.askdata.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Turns raw file content into a typed dataset and its catalog.
 */
public interface DatasetLoader {

    /**
     * Parses a stream.
     *
     * @param sourceName file name shown to the user
     * @param in file content; not closed by the loader
     * @return dataset and catalog
     * @throws DatasetLoadException when the content cannot be parsed
     */
    LoadedDataset load(String sourceName, InputStream in);

    /**
     * Parses a file from disk.
     *
     * @param path file path
     * @return dataset and catalog
     * @throws DatasetLoadException when the file is missing or cannot be parsed
     */
    default LoadedDataset load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new DatasetLoadException("Dataset file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(path.getFileName().toString(), in);
        } catch (IOException e) {
            throw new DatasetLoadException("Failed to read dataset file: " + path.getFileName(), e);
        }
    }
}
