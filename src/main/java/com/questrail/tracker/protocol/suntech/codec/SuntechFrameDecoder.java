package com.questrail.tracker.protocol.suntech.codec;

import com.questrail.tracker.protocol.suntech.model.DecodedReport;

/**
 * SuntechFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for Suntech report frames.
 *
 * <p>This interface defines the inbound boundary between the bytes of one
 * transport read and a structured {@link DecodedReport}.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Selecting a report layout from the header byte</li>
 *   <li>Decoding fields, degrading gracefully on short frames</li>
 *   <li>Extracting BLE sightings from scan reports</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Session state (ignition, position, sighting frequency)</li>
 *   <li>Storing reports</li>
 *   <li>Acknowledging or echoing frames</li>
 *   <li>Reassembling frames across reads</li>
 * </ul>
 *
 * <p>Decoding is pure computation: implementations perform no I/O and hold no
 * per-frame state, so one instance may be shared by all connections.</p>
 */
public interface SuntechFrameDecoder
{
    /**
     * Decode one frame.
     *
     * <p>This method never throws for any input, including an empty array:
     * failures are returned as {@code ParseError} or {@code UnknownHeader}
     * values carrying the original bytes.</p>
     *
     * @param frame bytes of one transport read
     * @return the decoded report; never {@code null}
     */
    DecodedReport decode(byte[] frame);
}
