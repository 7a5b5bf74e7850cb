package com.largomodo.warehouse.core.domain;

/**
 * State changes reported to the shipment log.
 * <p>
 * Log codes are what the CSV shipment log writes; they match the codes used by existing
 * shipment_logs data.
 */
public enum ShipmentStatus {
    STORED("STORED"),
    LOADED("LOADED_ON_TRUCK"),
    REMOVED("REMOVED_FROM_TRUCK");

    private final String logCode;

    ShipmentStatus(String logCode) {
        this.logCode = logCode;
    }

    public String getLogCode() {
        return logCode;
    }

    /**
     * Accepts either the enum name or the log code.
     *
     * @throws IllegalArgumentException if the value matches neither
     */
    public static ShipmentStatus fromLogCode(String value) {
        for (ShipmentStatus status : values()) {
            if (status.logCode.equals(value) || status.name().equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown shipment status: " + value);
    }
}
