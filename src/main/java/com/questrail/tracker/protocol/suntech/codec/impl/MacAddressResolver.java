package com.questrail.tracker.protocol.suntech.codec.impl;

import com.questrail.tracker.protocol.suntech.config.TargetPrefixes;
import com.questrail.tracker.protocol.suntech.model.MacOrientation;

import java.util.Objects;

/**
 * MacAddressResolver
 * -----------------------------------------------------------------------------
 * Resolves the byte order of a 6-byte BLE address found in a frame.
 *
 * <p>The firmware writes addresses in either byte order depending on where in
 * the report they come from. Both renderings are tested against the configured
 * target prefixes: big-endian first, then reversed. The first orientation that
 * matches wins; when neither matches the address is reported big-endian and
 * not a target.</p>
 */
public final class MacAddressResolver
{
    public static final int MAC_LENGTH = 6;

    /**
     * @param address     canonical colon-separated address in the resolved orientation
     * @param orientation orientation the address was resolved in
     * @param target      true if the resolved rendering carries a target prefix
     */
    public record ResolvedMac(String address, MacOrientation orientation, boolean target) {

        public String addressKey() {
            return address.replace(":", "");
        }
    }

    private final TargetPrefixes targets;

    public MacAddressResolver(TargetPrefixes targets) {
        this.targets = Objects.requireNonNull(targets, "targets");
    }

    /**
     * Resolves the six bytes at {@code offset}.
     *
     * @throws IndexOutOfBoundsException if fewer than six bytes remain
     */
    public ResolvedMac resolve(byte[] frame, int offset) {
        Objects.checkFromIndexSize(offset, MAC_LENGTH, frame.length);

        String bigEndian = SuntechPrimitives.toHex(frame, offset, MAC_LENGTH);
        if (targets.matches(bigEndian)) {
            return new ResolvedMac(format(bigEndian), MacOrientation.BIG_ENDIAN, true);
        }

        String littleEndian = SuntechPrimitives.toHex(reversed(frame, offset), 0, MAC_LENGTH);
        if (targets.matches(littleEndian)) {
            return new ResolvedMac(format(littleEndian), MacOrientation.LITTLE_ENDIAN, true);
        }

        return new ResolvedMac(format(bigEndian), MacOrientation.BIG_ENDIAN, false);
    }

    static String format(String hex12) {
        StringBuilder sb = new StringBuilder(17);
        for (int i = 0; i < hex12.length(); i += 2) {
            if (i > 0) {
                sb.append(':');
            }
            sb.append(hex12, i, i + 2);
        }
        return sb.toString();
    }

    private static byte[] reversed(byte[] frame, int offset) {
        byte[] out = new byte[MAC_LENGTH];
        for (int i = 0; i < MAC_LENGTH; i++) {
            out[i] = frame[offset + MAC_LENGTH - 1 - i];
        }
        return out;
    }
}
