package com.mikov.emailverifier.bulk;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Reads header-keyed CSV rows. Values are trimmed and blank lines skipped.
 */
public class CsvRecordSource implements RecordSource {

    private static final ObjectReader ROW_READER = new CsvMapper()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .readerForMapOf(String.class)
            .with(CsvSchema.emptySchema().withHeader());

    private final InputStream input;

    public CsvRecordSource(final InputStream input) {
        this.input = input;
    }

    @Override
    public List<Map<String, String>> readRecords() throws IOException {
        try (MappingIterator<Map<String, String>> rows = ROW_READER.readValues(input)) {
            return rows.readAll();
        }
    }
}
