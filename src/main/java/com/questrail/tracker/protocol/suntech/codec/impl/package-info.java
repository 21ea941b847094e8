/**
 * Suntech Codec Implementation
 * =============================================================================
 *
 * <p>Concrete decoders behind
 * {@link com.questrail.tracker.protocol.suntech.codec.SuntechFrameDecoder}.</p>
 *
 * <ul>
 *   <li>{@code SuntechPrimitives}: BCD, date/time, coordinate and hundredths rules</li>
 *   <li>{@code FrameReader}: bounds-aware big-endian reads with defaults</li>
 *   <li>{@code StatusReportDecoder}: fixed-layout STT report</li>
 *   <li>{@code BeaconScanReportDecoder}: variable-layout BLE scan report</li>
 *   <li>{@code MacAddressResolver}: byte-order resolution of embedded addresses</li>
 *   <li>{@link com.questrail.tracker.protocol.suntech.codec.impl.DefaultSuntechFrameDecoder}: header dispatch</li>
 * </ul>
 *
 * <p>Only the dispatcher and the resolver are public. The per-report decoders
 * signal unrecoverable truncation with
 * {@link com.questrail.tracker.protocol.suntech.codec.impl.SuntechDecodeException},
 * which the dispatcher converts into a report value.</p>
 */
package com.questrail.tracker.protocol.suntech.codec.impl;
