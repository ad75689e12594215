package com.give.payout.api.filter;

import com.give.payout.application.service.CorrelationIdService;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter(new CorrelationIdService());

    @Test
    void testIncomingIdPropagatedAndCleared() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/admin/status");
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        // When
        filter.doFilter(request, response, (req, res) -> seen.set(MDC.get(CorrelationIdService.CORRELATION_ID_KEY)));

        // Then
        assertEquals("req-42", seen.get());
        assertEquals("req-42", response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationIdService.CORRELATION_ID_KEY));
    }

    @Test
    void testIdGeneratedWhenAbsent() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/api/admin/status"), response, (req, res) -> { });

        String generated = response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertFalse(generated.isBlank());
    }
}
