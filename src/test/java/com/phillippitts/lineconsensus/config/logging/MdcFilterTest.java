package com.phillippitts.lineconsensus.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private static final String UUID_PATTERN = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

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

        // Clear MDC before each test
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void generatesUuidIfNoRequestIdHeader() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn(null);
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/reducers/line-text");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).matches(UUID_PATTERN);
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
        verify(chain).doFilter(request, response);
    }

    @Test
    void generatesUuidIfRequestIdHeaderIsBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("   ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/actuator/health");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).matches(UUID_PATTERN);
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void setsAllValuesInSingleRequest() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-xyz");
        when(request.getHeader("X-Project-ID")).thenReturn("project-7");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/reducers/line-text/batch");

        doAnswer(invocation -> {
            Map<String, String> contextMap = ThreadContext.getContext();
            assertThat(contextMap).containsEntry("requestId", "req-xyz");
            assertThat(contextMap).containsEntry("projectId", "project-7");
            assertThat(contextMap).containsEntry("method", "POST");
            assertThat(contextMap).containsEntry("uri", "/reducers/line-text/batch");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void doesNotSetProjectIdIfHeaderIsBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getHeader("X-Project-ID")).thenReturn("  ");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/extractors/line-text");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("projectId")).isNull();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getHeader("X-Project-ID")).thenReturn("project-7");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/reducers/line-text");

        doThrow(new ServletException("Test exception")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("projectId")).isNull();
        assertThat(ThreadContext.get("method")).isNull();
        assertThat(ThreadContext.get("uri")).isNull();
    }

    @Test
    void handlesNonHttpServletRequest() throws ServletException, IOException {
        ServletRequest nonHttpRequest = mock(ServletRequest.class);

        filter.doFilter(nonHttpRequest, response, chain);

        verify(chain).doFilter(nonHttpRequest, response);
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void preventsMdcLeakageBetweenRequests() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-1");
        when(request.getHeader("X-Project-ID")).thenReturn("project-1");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/reducers/line-text");

        filter.doFilter(request, response, chain);
        assertThat(ThreadContext.get("requestId")).isNull();

        when(request.getHeader("X-Request-ID")).thenReturn("req-2");
        when(request.getHeader("X-Project-ID")).thenReturn(null);

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("req-2");
            assertThat(ThreadContext.get("projectId")).isNull();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void echoesRequestIdOnResponse() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("batch-42");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/reducers/line-text/batch");

        filter.doFilter(request, response, chain);

        verify(response).setHeader("X-Request-ID", "batch-42");
    }

    @Test
    void stripsUnsafeCharactersFromCallerIds() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-1\n2025-01-01 INFO forged");
        when(request.getHeader("X-Project-ID")).thenReturn(" letters 1850 ");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/reducers/line-text");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("req-12025-01-01INFOforged");
            assertThat(ThreadContext.get("projectId")).isEqualTo("letters1850");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void sanitizeIdCapsLengthAndRejectsUnusableValues() {
        assertThat(MdcFilter.sanitizeId("p".repeat(100))).hasSize(MdcFilter.MAX_ID_LENGTH);
        assertThat(MdcFilter.sanitizeId("%%%")).isNull();
        assertThat(MdcFilter.sanitizeId(null)).isNull();
        assertThat(MdcFilter.sanitizeId("diaries_v2.1")).isEqualTo("diaries_v2.1");
    }
}
