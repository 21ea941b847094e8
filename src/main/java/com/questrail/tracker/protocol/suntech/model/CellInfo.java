package com.questrail.tracker.protocol.suntech.model;

/**
 * Serving cell information from a status report.
 *
 * @param cellId  cell tower id, rendered as 8 hex digits
 * @param mcc     mobile country code (BCD decoded)
 * @param mnc     mobile network code (BCD decoded)
 * @param lac     location area code, rendered as 4 hex digits
 * @param rxLevel received signal level
 */
public record CellInfo(
        String cellId,
        long mcc,
        long mnc,
        String lac,
        int rxLevel
) {
}
