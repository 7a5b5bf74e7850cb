package com.largomodo.warehouse.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.largomodo.warehouse.core.domain.StorageBin;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.List;

/**
 * Row layout shared by bin files: {@code bin_id,capacity,current_usage,location_code}.
 */
final class BinCsvFormat {

    private static final CsvSchema SCHEMA = CsvFiles.schemaFor(Row.class);
    private static final ObjectReader READER = CsvFiles.MAPPER.readerFor(Row.class).with(SCHEMA);
    private static final ObjectWriter WRITER = CsvFiles.MAPPER.writer(SCHEMA);

    private BinCsvFormat() {
    }

    static List<StorageBin> parse(Reader reader, String sourceName) throws IOException {
        return CsvFiles.readAll(READER, reader, sourceName,
                (Row row) -> new StorageBin(row.binId(), row.capacity(), row.currentUsage(), row.locationCode()));
    }

    /**
     * Writes the header and one row per bin. Closes the writer.
     */
    static void write(Writer writer, List<StorageBin> bins) throws IOException {
        try (SequenceWriter rows = WRITER.writeValues(writer)) {
            for (StorageBin bin : bins) {
                rows.write(new Row(bin.getBinId(), bin.getCapacity(), bin.getUsedSpace(), bin.getLocationCode()));
            }
        }
    }

    @JsonPropertyOrder({"bin_id", "capacity", "current_usage", "location_code"})
    private record Row(
            @JsonProperty("bin_id") int binId,
            @JsonProperty("capacity") int capacity,
            @JsonProperty("current_usage") int currentUsage,
            @JsonProperty("location_code") String locationCode) {}
}
