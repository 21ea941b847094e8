package com.questrail.tracker.protocol.suntech.model;

/**
 * Byte order in which a MAC address was found on the wire.
 */
public enum MacOrientation {
    BIG_ENDIAN,
    LITTLE_ENDIAN
}
