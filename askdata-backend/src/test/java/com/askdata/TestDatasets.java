package com.askdata;

import com.askdata.ingest.CatalogBuilder;
import com.askdata.ingest.LoadedDataset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Small fixed datasets shared by the tests.
 */
public final class TestDatasets {

    public static final String SALES_CSV = String.join("\n",
            "date,region,product,sales,quantity",
            "2024-01-01,north,A,100.5,3",
            "2024-01-02,south,B,200.0,5",
            "2024-01-03,east,A,150.25,2",
            "2024-01-04,west,B,80.0,1",
            "2024-01-05,north,B,120.0,4",
            "2024-01-06,south,A,90.0,6",
            "2024-01-07,east,B,60.0,2",
            "2024-01-08,west,A,110.0,3",
            "2024-01-09,north,A,130.0,5",
            "2024-01-10,south,B,70.0,1") + "\n";

    private TestDatasets() {
    }

    /**
     * Ten sales rows: date (datetime), region and product (categorical), sales (float), quantity (integer).
     * Total sales is 1110.75.
     */
    public static LoadedDataset sales() {
        List<String> lines = Arrays.asList(SALES_CSV.split("\n"));
        List<String> header = Arrays.asList(lines.get(0).split(","));
        List<List<String>> rows = new ArrayList<>();
        for (String line : lines.subList(1, lines.size())) {
            rows.add(Arrays.asList(line.split(",", -1)));
        }
        return new CatalogBuilder().build("sales.csv", header, rows);
    }

    public static LoadedDataset of(List<String> header, List<List<String>> rows) {
        return new CatalogBuilder().build("test.csv", header, rows);
    }
}
