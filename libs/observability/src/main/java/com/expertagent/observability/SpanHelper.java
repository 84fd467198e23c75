package com.expertagent.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that runs a unit of work inside an
 * INTERNAL span and stamps it with the current {@link CorrelationContext}.
 * <p>
 * The helper does not configure the SDK. Hosts that want spans exported configure an
 * OpenTelemetry SDK at boot time; otherwise the no-op tracer makes this a pass-through.
 */
public final class SpanHelper {

    private final Tracer tracer;

    /**
     * @param tracer the OpenTelemetry tracer (typically from {@code OpenTelemetry#getTracer})
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new span. Runtime exceptions are recorded on the span and
     * rethrown unchanged.
     *
     * @param spanName   name for the span
     * @param attributes span attributes to set before the work starts
     * @param work       the work to execute
     * @param <T>        return type
     * @return the value produced by {@code work}
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        SpanBuilder builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.orgId() != null) {
                span.setAttribute("org.id", ctx.orgId());
            }
            if (ctx.principalId() != null) {
                span.setAttribute("principal.id", ctx.principalId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Returns the current span so callers can add attributes computed inside the work.
     */
    public Span currentSpan() {
        return Span.current();
    }

    public Tracer tracer() {
        return tracer;
    }
}
