package com.rostra.eventservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

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
        MDC.clear();
    }

    @Test
    @DisplayName("generates correlation ID when none provided")
    void generatesCorrelationIdWhenNoneProvided() throws Exception {
        var request = new MockHttpServletRequest();
        var response = new MockHttpServletResponse();
        FilterChain chain = (req, resp) -> {};

        filter.doFilter(request, response, chain);

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }

    @Test
    @DisplayName("propagates existing correlation ID from header")
    void propagatesExistingCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "test-abc-123");
        var response = new MockHttpServletResponse();
        FilterChain chain = (req, resp) -> {};

        filter.doFilter(request, response, chain);

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("treats a blank header as absent")
    void replacesBlankHeader() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "   ");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isNotBlank().isNotEqualTo("   ");
    }

    @Test
    @DisplayName("exposes the ID in the MDC while the chain runs and removes it afterwards")
    void populatesMdcDuringChain() throws Exception {
        var captured = new AtomicReference<String>();
        FilterChain capturingChain = (req, resp) -> captured.set(MDC.get(CorrelationIdFilter.MDC_KEY));

        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "during-chain-123");

        filter.doFilter(request, new MockHttpServletResponse(), capturingChain);

        assertThat(captured.get()).isEqualTo("during-chain-123");
        assertThat(MDC.get(CorrelationIdFilter.MDC_KEY)).isNull();
    }
}
