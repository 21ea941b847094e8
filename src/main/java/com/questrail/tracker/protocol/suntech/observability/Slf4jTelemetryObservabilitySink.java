package com.questrail.tracker.protocol.suntech.observability;

import com.questrail.tracker.protocol.suntech.model.BeaconScanReport;
import com.questrail.tracker.protocol.suntech.model.ParseError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TelemetryObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jTelemetryObservabilitySink implements TelemetryObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTelemetryObservabilitySink.class);

    @Override
    public void onTransportEvent(TelemetryTransportEvent event) {
        if (event.detail().isEmpty()) {
            log.info("Suntech transport {}: {}", event.kind(), event.address());
        } else {
            log.info("Suntech transport {}: {} ({})", event.kind(), event.address(), event.detail());
        }
    }

    @Override
    public void onFrameDecoded(TelemetryFrameEvent event) {
        if (event.report() instanceof ParseError error) {
            log.warn("Frame from {} ({} bytes) not decoded: {} {}",
                event.remote(), event.byteLength(), error.kind(), error.reason());
            return;
        }
        if (event.undecoded()) {
            log.warn("Frame from {} ({} bytes) has unsupported header: {}",
                event.remote(), event.byteLength(), event.report().reportType());
            return;
        }
        if (event.report() instanceof BeaconScanReport scan) {
            log.info("BLE scan from {}: device {} sensors {}/{} target={}",
                event.remote(), scan.deviceId(), scan.sensorsParsed(),
                scan.expectedSensorCount(), scan.hasTargetMac());
            return;
        }
        log.debug("Frame from {} ({} bytes): {}",
            event.remote(), event.byteLength(), event.report().reportType());
    }

    @Override
    public void onError(TelemetryErrorEvent event) {
        log.error("Suntech Error: {}", event.message(), event.cause());
    }
}
