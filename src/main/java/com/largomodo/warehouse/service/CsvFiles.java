package com.largomodo.warehouse.service;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.Reader;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Shared Jackson CSV setup for the warehouse files.
 * <p>
 * Every file starts with a header line whose column names must match the row type, so a file
 * without one is rejected instead of losing its first row. Lines starting with {@code #} and blank lines are skipped,
 * unquoted fields are trimmed, and an empty field reads as null. Rows with missing or extra
 * columns fail. Quoted fields may contain commas.
 */
final class CsvFiles {

    static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
            .enable(CsvParser.Feature.FAIL_ON_MISSING_COLUMNS)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .build();

    private CsvFiles() {
        // Static utility class - prevent instantiation
    }

    /**
     * Header schema for a {@code @JsonPropertyOrder} row type.
     */
    static CsvSchema schemaFor(Class<?> rowType) {
        return MAPPER.schemaFor(rowType).withHeader().withStrictHeaders(true).withComments();
    }

    /**
     * Reads every row and converts it to a domain object.
     *
     * @param sourceName file or resource name used in error messages
     * @param converter  may throw IllegalArgumentException or DateTimeException for invalid values
     * @throws IOException on malformed CSV or rejected values; the message names the line or row
     */
    static <R, T> List<T> readAll(ObjectReader reader, Reader source, String sourceName,
                                  Function<R, T> converter) throws IOException {
        List<T> result = new ArrayList<>();
        int rowNumber = 0;
        try (MappingIterator<R> rows = reader.readValues(source)) {
            while (rows.hasNextValue()) {
                R row = rows.nextValue();
                rowNumber++;
                try {
                    result.add(converter.apply(row));
                } catch (IllegalArgumentException | DateTimeException e) {
                    throw new IOException(sourceName + " row " + rowNumber + ": " + e.getMessage(), e);
                }
            }
        } catch (JsonProcessingException e) {
            throw new IOException(sourceName + describeLine(e.getLocation()) + ": " + e.getOriginalMessage(), e);
        }
        return result;
    }

    private static String describeLine(JsonLocation location) {
        return location != null && location.getLineNr() > 0 ? " line " + location.getLineNr() : "";
    }
}
