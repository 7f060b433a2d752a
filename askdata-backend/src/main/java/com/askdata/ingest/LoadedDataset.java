package com.askdata.ingest;

import com.askdata.model.ColumnCatalog;
import com.askdata.model.Dataset;

/**
 * A freshly loaded dataset together with the catalog built from it. Both share one version.
 *
 * @param dataset typed rows
 * @param catalog column types
 */
public record LoadedDataset(Dataset dataset, ColumnCatalog catalog) {
}
