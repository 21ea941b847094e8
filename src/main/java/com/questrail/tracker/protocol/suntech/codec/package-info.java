/**
 * Suntech Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the Suntech
 * ST6560 binary report protocol. The codec turns the bytes of one transport
 * read into one {@link com.questrail.tracker.protocol.suntech.model.DecodedReport}.</p>
 *
 * <h2>Architectural Placement</h2>
 *
 * <pre>
 *   byte[] frame (one TCP read)
 *        → SuntechFrameDecoder        (header dispatch, field decoding)
 *            → DecodedReport          (status, BLE scan, or error value)
 *                → TelemetryAggregator
 *                    → session state, history, beacon events
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>No frame reassembly: each read is one frame. The packet length field
 *       is carried through but not validated.</li>
 *   <li>No checksum validation and no acknowledgment generation.</li>
 *   <li>No exception crosses {@link com.questrail.tracker.protocol.suntech.codec.SuntechFrameDecoder#decode(byte[])};
 *       failures become report values that keep the original bytes.</li>
 * </ul>
 *
 * <h2>Configuration-Dependent Behavior</h2>
 * <p>Which BLE addresses count as tracker tags is decided by
 * {@link com.questrail.tracker.protocol.suntech.config.TargetPrefixes}, supplied
 * when the decoder is constructed. Field decoding does not depend on it.</p>
 */
package com.questrail.tracker.protocol.suntech.codec;
