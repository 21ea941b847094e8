package com.questrail.tracker.protocol.suntech.codec.impl;

import com.questrail.tracker.protocol.suntech.model.DecodeErrorKind;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * FrameReader
 * -----------------------------------------------------------------------------
 * Bounds-aware, big-endian field access over one received frame.
 *
 * <p>Two families of reads are offered:</p>
 * <ul>
 *   <li>{@link #require(int, String)} followed by the plain accessors, for the
 *       leading fields a report cannot exist without</li>
 *   <li>{@code ...Or(offset, default)} and {@code opt...} reads, for fields
 *       that are decoded only when the frame is long enough to carry them</li>
 * </ul>
 *
 * <p>Optional reads never throw; a short frame simply yields the default.</p>
 */
final class FrameReader
{
    private final byte[] frame;

    FrameReader(byte[] frame) {
        this.frame = Objects.requireNonNull(frame, "frame");
    }

    boolean has(int offset, int length) {
        return offset >= 0 && length >= 0 && offset + length <= frame.length;
    }

    /**
     * @throws SuntechDecodeException if fewer than {@code length} bytes are available
     */
    void require(int length, String what) {
        if (frame.length < length) {
            throw new SuntechDecodeException(DecodeErrorKind.TRUNCATED_REQUIRED_FIELD,
                    what + " too short: " + frame.length + " bytes (expected at least " + length + ")");
        }
    }

    int u8(int offset) {
        return frame[offset] & 0xFF;
    }

    int s8(int offset) {
        return frame[offset];
    }

    int u16(int offset) {
        return ((frame[offset] & 0xFF) << 8) | (frame[offset + 1] & 0xFF);
    }

    int u24(int offset) {
        return ((frame[offset] & 0xFF) << 16)
                | ((frame[offset + 1] & 0xFF) << 8)
                | (frame[offset + 2] & 0xFF);
    }

    int s32(int offset) {
        return ((frame[offset] & 0xFF) << 24)
                | ((frame[offset + 1] & 0xFF) << 16)
                | ((frame[offset + 2] & 0xFF) << 8)
                | (frame[offset + 3] & 0xFF);
    }

    long u32(int offset) {
        return s32(offset) & 0xFFFF_FFFFL;
    }

    byte[] slice(int offset, int length) {
        return Arrays.copyOfRange(frame, offset, offset + length);
    }

    // ---------------------------------------------------------------------
    // Optional reads
    // ---------------------------------------------------------------------

    int u8Or(int offset, int defaultValue) {
        return has(offset, 1) ? u8(offset) : defaultValue;
    }

    int u16Or(int offset, int defaultValue) {
        return has(offset, 2) ? u16(offset) : defaultValue;
    }

    long u32Or(int offset, long defaultValue) {
        return has(offset, 4) ? u32(offset) : defaultValue;
    }

    OptionalInt optU8(int offset) {
        return has(offset, 1) ? OptionalInt.of(u8(offset)) : OptionalInt.empty();
    }

    OptionalInt optU16(int offset) {
        return has(offset, 2) ? OptionalInt.of(u16(offset)) : OptionalInt.empty();
    }

    OptionalInt optS32(int offset) {
        return has(offset, 4) ? OptionalInt.of(s32(offset)) : OptionalInt.empty();
    }

    Optional<byte[]> optSlice(int offset, int length) {
        return has(offset, length) ? Optional.of(slice(offset, length)) : Optional.empty();
    }

    /**
     * Returns {@code length} bytes from {@code offset}, zero-filled where the
     * frame ends early.
     */
    byte[] sliceOrZeros(int offset, int length) {
        byte[] out = new byte[length];
        if (offset < frame.length) {
            int available = Math.min(length, frame.length - offset);
            System.arraycopy(frame, offset, out, 0, available);
        }
        return out;
    }
}
