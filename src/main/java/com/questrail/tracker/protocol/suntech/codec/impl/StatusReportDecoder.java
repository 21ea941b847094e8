package com.questrail.tracker.protocol.suntech.codec.impl;

import com.questrail.tracker.protocol.suntech.model.CellInfo;
import com.questrail.tracker.protocol.suntech.model.DeviceStatus;
import com.questrail.tracker.protocol.suntech.model.FixStatus;
import com.questrail.tracker.protocol.suntech.model.GpsFix;
import com.questrail.tracker.protocol.suntech.model.MessageType;
import com.questrail.tracker.protocol.suntech.model.StatusReport;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * StatusReportDecoder
 * -----------------------------------------------------------------------------
 * Decodes the fixed-layout STT status report ({@code 0x81}/{@code 0x82}).
 *
 * <h2>Layout (big-endian)</h2>
 * <pre>
 *   0..14   common prefix ({@link FramePrefix})
 *   15      message type          16..18  date (BCD)     19..21  time (BCD)
 *   22..25  cell id               26..27  MCC (BCD)      28..29  MNC (BCD)
 *   30..31  LAC                   32      RX level
 *   33..36  latitude              37..40  longitude
 *   41..42  speed                 43..44  course
 *   45      satellites            46      fix status
 *   47      input state           48      output state   49      device mode
 *   50      report type           51..52  message number
 *   53      reserved              54..57  assignment bitmap
 *   58..    trailing fields announced by the assignment bitmap
 * </pre>
 *
 * <p>Only bytes 0..15 are required. Every later field is read only when
 * present and otherwise takes its default, so truncated frames still decode to
 * a {@link StatusReport}.</p>
 *
 * <h2>Trailing fields</h2>
 * <p>Bit 0 of the assignment bitmap announces a 2-byte input voltage in mV at
 * offset 58; bit 1 announces a 1-byte battery level after it. A voltage
 * outside 10 V..20 V is implausible for the vehicle supply and indicates a
 * field-alignment error, so it is reported absent rather than clamped.</p>
 */
final class StatusReportDecoder
{
    static final int REQUIRED_LENGTH = 16;
    static final int FULL_LENGTH = 58;

    static final int MIN_INPUT_VOLTAGE_MV = 10_000;
    static final int MAX_INPUT_VOLTAGE_MV = 20_000;

    static final long ASSIGN_INPUT_VOLTAGE = 0x0000_0001L;
    static final long ASSIGN_BATTERY_LEVEL = 0x0000_0002L;

    private static final int OFF_MESSAGE_TYPE = 15;
    private static final int OFF_DATE = 16;
    private static final int OFF_TIME = 19;
    private static final int OFF_CELL_ID = 22;
    private static final int OFF_MCC = 26;
    private static final int OFF_MNC = 28;
    private static final int OFF_LAC = 30;
    private static final int OFF_RX_LEVEL = 32;
    private static final int OFF_LATITUDE = 33;
    private static final int OFF_LONGITUDE = 37;
    private static final int OFF_SPEED = 41;
    private static final int OFF_COURSE = 43;
    private static final int OFF_SATELLITES = 45;
    private static final int OFF_FIX = 46;
    private static final int OFF_INPUT_STATE = 47;
    private static final int OFF_OUTPUT_STATE = 48;
    private static final int OFF_MODE = 49;
    private static final int OFF_REPORT_TYPE = 50;
    private static final int OFF_MESSAGE_NUMBER = 51;
    private static final int OFF_ASSIGN_MAP = 54;

    /**
     * @throws SuntechDecodeException if the frame is shorter than the required prefix
     */
    StatusReport decode(byte[] frame) {
        Objects.requireNonNull(frame, "frame");

        FrameReader reader = new FrameReader(frame);
        reader.require(REQUIRED_LENGTH, "STT message");

        FramePrefix prefix = FramePrefix.read(reader);
        MessageType messageType = MessageType.fromRaw(reader.u8(OFF_MESSAGE_TYPE));

        String date = SuntechPrimitives.decodeDate(reader.sliceOrZeros(OFF_DATE, 3));
        String time = SuntechPrimitives.decodeTime(reader.sliceOrZeros(OFF_TIME, 3));

        long assignMap = reader.u32Or(OFF_ASSIGN_MAP, 0L);
        int trailing = Math.max(0, frame.length - FULL_LENGTH);

        OptionalInt voltage = OptionalInt.empty();
        OptionalInt battery = OptionalInt.empty();
        int offset = FULL_LENGTH;
        if ((assignMap & ASSIGN_INPUT_VOLTAGE) != 0) {
            voltage = plausibleVoltage(reader.optU16(offset));
            offset += 2;
        }
        if ((assignMap & ASSIGN_BATTERY_LEVEL) != 0) {
            battery = percent(reader.optU8(offset));
        }

        return new StatusReport(
                prefix.header(),
                prefix.packetLength(),
                prefix.deviceId(),
                prefix.reportMap(),
                prefix.model(),
                prefix.softwareVersion(),
                messageType,
                date,
                time,
                readGps(reader),
                readCell(reader),
                readStatus(reader),
                assignMap,
                trailing,
                voltage,
                battery,
                frame
        );
    }

    static boolean isPlausibleVoltage(int millivolts) {
        return millivolts >= MIN_INPUT_VOLTAGE_MV && millivolts <= MAX_INPUT_VOLTAGE_MV;
    }

    private static GpsFix readGps(FrameReader reader) {
        double lat = reader.has(OFF_LATITUDE, 4)
                ? SuntechPrimitives.decodeCoordinate(reader.s32(OFF_LATITUDE)) : 0.0;
        double lon = reader.has(OFF_LONGITUDE, 4)
                ? SuntechPrimitives.decodeCoordinate(reader.s32(OFF_LONGITUDE)) : 0.0;

        return new GpsFix(
                lat,
                lon,
                SuntechPrimitives.decodeHundredths(reader.u16Or(OFF_SPEED, 0)),
                SuntechPrimitives.decodeHundredths(reader.u16Or(OFF_COURSE, 0)),
                reader.u8Or(OFF_SATELLITES, 0),
                FixStatus.fromRaw(reader.u8Or(OFF_FIX, 0))
        );
    }

    private static CellInfo readCell(FrameReader reader) {
        long mcc = reader.has(OFF_MCC, 2) ? SuntechPrimitives.decodeBcd(reader.slice(OFF_MCC, 2)) : 0;
        long mnc = reader.has(OFF_MNC, 2) ? SuntechPrimitives.decodeBcd(reader.slice(OFF_MNC, 2)) : 0;

        return new CellInfo(
                String.format("%08X", reader.u32Or(OFF_CELL_ID, 0L)),
                mcc,
                mnc,
                String.format("%04X", reader.u16Or(OFF_LAC, 0)),
                reader.u8Or(OFF_RX_LEVEL, 0)
        );
    }

    private static Optional<DeviceStatus> readStatus(FrameReader reader) {
        if (!reader.has(OFF_INPUT_STATE, 1)) {
            return Optional.empty();
        }
        return Optional.of(new DeviceStatus(
                reader.u8(OFF_INPUT_STATE),
                reader.u8Or(OFF_OUTPUT_STATE, 0),
                reader.u8Or(OFF_MODE, 0),
                reader.u8Or(OFF_REPORT_TYPE, 0),
                reader.u16Or(OFF_MESSAGE_NUMBER, 0)
        ));
    }

    private static OptionalInt plausibleVoltage(OptionalInt raw) {
        if (raw.isPresent() && isPlausibleVoltage(raw.getAsInt())) {
            return raw;
        }
        return OptionalInt.empty();
    }

    private static OptionalInt percent(OptionalInt raw) {
        if (raw.isPresent() && raw.getAsInt() <= 100) {
            return raw;
        }
        return OptionalInt.empty();
    }
}
