package com.p14n.filebroker.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Tracer;

public interface TelemetryConfig extends AutoCloseable {
    Meter getMeter();

    Tracer getTracer();

    OpenTelemetry getOpenTelemetry();

    @Override
    void close();
}
