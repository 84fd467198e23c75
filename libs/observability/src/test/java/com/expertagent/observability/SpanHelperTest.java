package com.expertagent.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Uses {@link InMemorySpanExporter} directly so finished spans can be inspected synchronously.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
        spanHelper = new SpanHelper(sdk.getTracer("authz-test"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        spanExporter.reset();
    }

    @Test
    @DisplayName("rejects null tracer")
    void rejectsNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Test
    @DisplayName("runs work in a span with the given attributes and returns its result")
    void runsWorkInSpan() {
        String result = spanHelper.inSpan("authz.evaluate", Map.of("authz.action", "GetAgent"), () -> "ok");

        assertThat(result).isEqualTo("ok");
        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertThat(spans).hasSize(1);
        assertThat(spans.get(0).getName()).isEqualTo("authz.evaluate");
        assertThat(spans.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        assertThat(spans.get(0).getAttributes().get(AttributeKey.stringKey("authz.action")))
                .isEqualTo("GetAgent");
    }

    @Test
    @DisplayName("stamps correlation attributes from the current context")
    void stampsCorrelation() {
        CorrelationContextHolder.set(new CorrelationContext("corr-abc", "org-1", "u1", null, null, null));

        spanHelper.inSpan("authz.evaluate", Map.of(), () -> true);

        var attributes = spanExporter.getFinishedSpanItems().get(0).getAttributes();
        assertThat(attributes.get(AttributeKey.stringKey("correlation.id"))).isEqualTo("corr-abc");
        assertThat(attributes.get(AttributeKey.stringKey("org.id"))).isEqualTo("org-1");
        assertThat(attributes.get(AttributeKey.stringKey("principal.id"))).isEqualTo("u1");
    }

    @Test
    @DisplayName("records the exception and rethrows it")
    void recordsAndRethrows() {
        assertThatThrownBy(() -> spanHelper.inSpan("failing", Map.of(), () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getEvents()).isNotEmpty();
    }
}
