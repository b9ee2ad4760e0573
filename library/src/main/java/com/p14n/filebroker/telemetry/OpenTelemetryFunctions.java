package com.p14n.filebroker.telemetry;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import com.p14n.filebroker.data.Traceable;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapSetter;

public class OpenTelemetryFunctions {

        private static final String TRACEPARENT = "traceparent";

        private OpenTelemetryFunctions() {
        }

        /**
         * Captures the current trace context as a W3C traceparent header value.
         *
         * @return the header value, or null when no propagator writes one
         */
        public static String serializeTraceContext(OpenTelemetry ot) {
                Map<String, String> carrier = new HashMap<>();
                TextMapSetter<Map<String, String>> setter = Map::put;
                ot.getPropagators().getTextMapPropagator().inject(Context.current(), carrier, setter);
                return carrier.get(TRACEPARENT);
        }

        public static Context deserializeTraceContext(OpenTelemetry ot, String traceparent) {
                Map<String, String> carrier = new HashMap<>();
                carrier.put(TRACEPARENT, traceparent);
                return ot.getPropagators().getTextMapPropagator().extract(Context.current(), carrier,
                                new MapTextMapGetter());
        }

        /**
         * Runs the action inside a span named {@code spanName}, parented on the
         * message's traceparent when it has one. Exceptions are recorded on the
         * span and rethrown.
         */
        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, Traceable message,
                        String spanName, Supplier<T> action) {

                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setAttribute("topic", message.topic())
                                .setAttribute("message.id", message.id())
                                .setAttribute("subject", message.subject());
                if (message.traceparent() != null) {
                        sb.setParent(deserializeTraceContext(ot, message.traceparent()));
                }
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
