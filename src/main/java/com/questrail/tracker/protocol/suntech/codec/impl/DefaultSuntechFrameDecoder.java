package com.questrail.tracker.protocol.suntech.codec.impl;

import com.questrail.tracker.protocol.suntech.codec.SuntechFrameDecoder;
import com.questrail.tracker.protocol.suntech.codec.SuntechHeader;
import com.questrail.tracker.protocol.suntech.config.TargetPrefixes;
import com.questrail.tracker.protocol.suntech.model.DecodeErrorKind;
import com.questrail.tracker.protocol.suntech.model.DecodedReport;
import com.questrail.tracker.protocol.suntech.model.ParseError;
import com.questrail.tracker.protocol.suntech.model.UnknownHeader;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * DefaultSuntechFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SuntechFrameDecoder}.
 *
 * <p>Dispatch is a single step keyed by the first byte:</p>
 * <ul>
 *   <li>empty frame: {@code ParseError} ({@link DecodeErrorKind#EMPTY_FRAME})</li>
 *   <li>{@code 0x81}: status report; failure becomes a {@code ParseError}</li>
 *   <li>{@code 0x82}: status report; failure becomes an {@code UnknownHeader}
 *       tagged {@value #STATUS_VARIANT_LABEL}</li>
 *   <li>{@code 0xAA}, {@code 0xBA}: BLE scan report (identical decoding)</li>
 *   <li>anything else: {@code UnknownHeader}</li>
 * </ul>
 */
public final class DefaultSuntechFrameDecoder implements SuntechFrameDecoder
{
    static final String STATUS_VARIANT_LABEL = "STT Variant";
    static final String UNKNOWN_HEADER_LABEL = "Unknown Header";

    private final StatusReportDecoder statusDecoder;
    private final BeaconScanReportDecoder beaconDecoder;

    public DefaultSuntechFrameDecoder() {
        this(TargetPrefixes.defaults());
    }

    public DefaultSuntechFrameDecoder(TargetPrefixes targetPrefixes) {
        Objects.requireNonNull(targetPrefixes, "targetPrefixes");
        this.statusDecoder = new StatusReportDecoder();
        this.beaconDecoder = new BeaconScanReportDecoder(new MacAddressResolver(targetPrefixes));
    }

    @Override
    public DecodedReport decode(byte[] frame) {
        if (frame == null || frame.length == 0) {
            return ParseError.of(DecodeErrorKind.EMPTY_FRAME, "empty message", frame);
        }

        final int headerByte = frame[0] & 0xFF;
        Optional<SuntechHeader> header = SuntechHeader.fromByte(headerByte);
        if (header.isEmpty()) {
            return new UnknownHeader(headerByte, UNKNOWN_HEADER_LABEL, frame);
        }

        return switch (header.get()) {
            case STATUS -> decodeOrError("STT parse error", () -> statusDecoder.decode(frame), frame);
            case STATUS_VARIANT -> decodeStatusVariant(frame);
            case BLE_SCAN, BLE_SCAN_WITH_ACK ->
                    decodeOrError("BDA parse error", () -> beaconDecoder.decode(frame), frame);
        };
    }

    private DecodedReport decodeStatusVariant(byte[] frame) {
        try {
            return statusDecoder.decode(frame);
        }
        catch (RuntimeException e) {
            return new UnknownHeader(frame[0] & 0xFF, STATUS_VARIANT_LABEL, frame);
        }
    }

    private static DecodedReport decodeOrError(String context,
                                               Supplier<DecodedReport> decoder,
                                               byte[] frame) {
        try {
            return decoder.get();
        }
        catch (SuntechDecodeException e) {
            return ParseError.of(e.kind(), context + ": " + e.getMessage(), frame);
        }
        catch (RuntimeException e) {
            // Decoder defect: keep the bytes for later re-analysis.
            return ParseError.of(DecodeErrorKind.DECODE_FAILURE, context + ": " + e, frame);
        }
    }
}
