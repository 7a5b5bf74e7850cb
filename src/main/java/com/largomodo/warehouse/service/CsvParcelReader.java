package com.largomodo.warehouse.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectReader;
import com.largomodo.warehouse.core.domain.Parcel;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads parcel lists ({@code tracking_id,size,destination}) for the conveyor or truck planning.
 * Destinations containing commas must be quoted.
 */
public class CsvParcelReader {

    private static final ObjectReader READER = CsvFiles.MAPPER.readerFor(Row.class)
            .with(CsvFiles.schemaFor(Row.class));

    /**
     * @return parcels in file order
     * @throws IOException if the file cannot be read or a row is malformed (message names the line or row)
     */
    public List<Parcel> read(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("File must not be null");
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.getFileName().toString());
        }
    }

    /**
     * Reads a parcel list bundled on the classpath.
     *
     * @param resourcePath absolute classpath reference (leading slash required)
     */
    public List<Parcel> readResource(String resourcePath) throws IOException {
        try (InputStream stream = getClass().getResourceAsStream(resourcePath)) {
            if (stream == null) {
                throw new IOException("Internal resource " + resourcePath +
                        " not found. Ensure application is built correctly.");
            }
            return read(new InputStreamReader(stream, StandardCharsets.UTF_8), resourcePath);
        }
    }

    private List<Parcel> read(Reader reader, String sourceName) throws IOException {
        return CsvFiles.readAll(READER, reader, sourceName,
                (Row row) -> new Parcel(row.trackingId(), row.size(), row.destination()));
    }

    @JsonPropertyOrder({"tracking_id", "size", "destination"})
    private record Row(
            @JsonProperty("tracking_id") String trackingId,
            @JsonProperty("size") int size,
            @JsonProperty("destination") String destination) {}
}
