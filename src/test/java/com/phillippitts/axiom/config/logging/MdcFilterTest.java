package com.phillippitts.axiom.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.matches;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void usesRequestIdFromHeaderAndEchoesIt() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("test-request-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/sessions/s1/turns");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("test-request-123");
            assertThat(ThreadContext.get("method")).isEqualTo("POST");
            assertThat(ThreadContext.get("uri")).isEqualTo("/api/sessions/s1/turns");
            assertThat(ThreadContext.get("sessionId")).isEqualTo("s1");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(response).setHeader("X-Request-ID", "test-request-123");
        assertThat(ThreadContext.get("requestId")).isNull();
    }

    @Test
    void generatesUuidIfRequestIdHeaderIsBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("   ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/ping");

        filter.doFilter(request, response, chain);

        verify(response).setHeader(eq("X-Request-ID"),
                matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }

    @Test
    void replacesUnsafeClientRequestId() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("abc\nFAKE LOG LINE");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/ping");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).doesNotContain("FAKE");
            assertThat(ThreadContext.containsKey("sessionId")).isFalse();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void extractsSessionIdOnlyFromSessionPaths() {
        assertThat(MdcFilter.sessionId("/api/sessions/abc-1/turns")).isEqualTo("abc-1");
        assertThat(MdcFilter.sessionId("/api/sessions/abc-1")).isEqualTo("abc-1");
        assertThat(MdcFilter.sessionId("/api/turns/t-1/cancel")).isNull();
        assertThat(MdcFilter.sessionId(null)).isNull();
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/sessions/s1/turns");
        doThrow(new ServletException("Test exception")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("method")).isNull();
        assertThat(ThreadContext.get("uri")).isNull();
    }
}
