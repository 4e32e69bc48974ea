package com.layergen.web;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    void callerRequestIdIsPutInMdcAndEchoed() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/codegen/status");
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();
        FilterChain chain = (req, res) -> seen.set(MDC.get(TraceIdFilter.MDC_TRACE_ID));

        filter.doFilter(request, response, chain);

        assertThat(seen.get()).isEqualTo("req-42");
        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isEqualTo("req-42");
        assertThat(MDC.get(TraceIdFilter.MDC_TRACE_ID)).isNull();
    }

    @Test
    void blankRequestIdIsReplacedWithFreshOne() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/codegen/generate");
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "  ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(MDC.get(TraceIdFilter.MDC_TRACE_ID)));

        assertThat(seen.get()).isNotBlank();
        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isEqualTo(seen.get());
    }
}
