package com.expertagent.authzservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.expertagent.observability.CorrelationContext;
import com.expertagent.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates a correlation ID when none is provided")
    void generatesCorrelationId() throws Exception {
        var response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest(), response, (req, resp) -> {});

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }

    @Test
    @DisplayName("treats a blank header as missing")
    void blankHeader() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "  ");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank().isNotEqualTo("  ");
    }

    @Test
    @DisplayName("propagates the caller's correlation ID")
    void propagatesCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "test-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("exposes the ID to the holder and the MDC while the chain runs")
    void populatesContextDuringChain() throws Exception {
        var capturedId = new AtomicReference<String>();
        var capturedMdc = new AtomicReference<String>();
        FilterChain capturingChain = (req, resp) -> {
            capturedId.set(CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElse(null));
            capturedMdc.set(MDC.get(CorrelationContext.MDC_CORRELATION_ID));
        };
        var request = new MockHttpServletRequest();
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "during-chain-123");

        filter.doFilter(request, new MockHttpServletResponse(), capturingChain);

        assertThat(capturedId.get()).isEqualTo("during-chain-123");
        assertThat(capturedMdc.get()).isEqualTo("during-chain-123");
    }

    @Test
    @DisplayName("clears the context after the request")
    void clearsContext() throws Exception {
        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(CorrelationContextHolder.get()).isEmpty();
        assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
    }
}
