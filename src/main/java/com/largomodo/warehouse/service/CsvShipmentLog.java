package com.largomodo.warehouse.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.largomodo.warehouse.core.ShipmentLog;
import com.largomodo.warehouse.core.domain.ShipmentEvent;
import com.largomodo.warehouse.core.domain.ShipmentStatus;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

/**
 * Append-only shipment log file with rows {@code tracking_id,bin_id,timestamp,status}.
 * <p>
 * Timestamps are ISO-8601 instants; bin id is left empty for truck events; status is written as
 * {@link ShipmentStatus#getLogCode()}. The header is written when the file is first created.
 * Each event opens, appends and closes the file, so every recorded line is on disk before
 * {@link #record(ShipmentEvent)} returns.
 */
public class CsvShipmentLog implements ShipmentLog {

    private static final CsvSchema SCHEMA = CsvFiles.schemaFor(Row.class);
    private static final ObjectWriter NEW_FILE_WRITER = CsvFiles.MAPPER.writer(SCHEMA);
    private static final ObjectWriter APPEND_WRITER = CsvFiles.MAPPER.writer(SCHEMA.withoutHeader());
    private static final ObjectReader READER = CsvFiles.MAPPER.readerFor(Row.class).with(SCHEMA);

    private final Path file;

    public CsvShipmentLog(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("File must not be null");
        }
        this.file = file;
    }

    @Override
    public void record(ShipmentEvent event) throws IOException {
        boolean fresh = !Files.exists(file) || Files.size(file) == 0;
        ObjectWriter writer = fresh ? NEW_FILE_WRITER : APPEND_WRITER;
        Row row = new Row(event.trackingId(), event.binId(), event.timestamp().toString(),
                event.status().getLogCode());
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            writer.writeValue(out, row);
        }
    }

    /**
     * Reads back every recorded event.
     *
     * @return events in file order, empty if the file does not exist
     * @throws IOException on read errors or malformed rows
     */
    public List<ShipmentEvent> readAll() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return CsvFiles.readAll(READER, reader, file.getFileName().toString(), CsvShipmentLog::toEvent);
        }
    }

    private static ShipmentEvent toEvent(Row row) {
        if (row.timestamp() == null) {
            throw new IllegalArgumentException("timestamp is missing for " + row.trackingId());
        }
        return new ShipmentEvent(
                row.trackingId(),
                row.binId(),
                ShipmentStatus.fromLogCode(row.status()),
                Instant.parse(row.timestamp()));
    }

    @JsonPropertyOrder({"tracking_id", "bin_id", "timestamp", "status"})
    private record Row(
            @JsonProperty("tracking_id") String trackingId,
            @JsonProperty("bin_id") Integer binId,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("status") String status) {}
}
