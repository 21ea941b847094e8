package com.questrail.tracker.protocol.suntech.codec.impl;

import com.questrail.tracker.protocol.suntech.model.DecodeErrorKind;

import java.util.Objects;

/**
 * Indicates that a frame could not be decoded into a report.
 *
 * <p>Raised only for failures that make the whole report undecodable, most
 * commonly a frame shorter than its required leading fields. Missing optional
 * fields are never signalled this way. The exception does not cross the
 * frame decoder boundary; {@link DefaultSuntechFrameDecoder} converts it into
 * a report value.</p>
 */
public final class SuntechDecodeException extends RuntimeException
{
    private final DecodeErrorKind kind;

    public SuntechDecodeException(DecodeErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public DecodeErrorKind kind() {
        return kind;
    }
}
