package com.imperium.astrocompanion.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RequestIdSupportTest {

    @AfterEach
    void clear() {
        MDC.clear();
    }

    @Test
    void resolvePrefersAttributeThenHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(RequestIdSupport.HEADER_REQUEST_ID, "from-header");
        assertEquals("from-header", RequestIdSupport.resolve(request));

        request.setAttribute(RequestIdSupport.ATTR_REQUEST_ID, "from-attr");
        assertEquals("from-attr", RequestIdSupport.resolve(request));
    }

    @Test
    void resolveGeneratesOnceAndRemembers() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        String first = RequestIdSupport.resolve(request);
        assertTrue(first.startsWith("req_"));
        assertEquals(first, RequestIdSupport.resolve(request));
    }

    @Test
    void propagateCarriesCallerContextAndRestoresWorker() {
        MDC.put("requestId", "req_caller");
        Runnable decorated = RequestIdSupport.propagate(() -> assertEquals("req_caller", MDC.get("requestId")));

        MDC.clear();
        MDC.put("requestId", "req_worker");
        decorated.run();
        assertEquals("req_worker", MDC.get("requestId"));
    }

    @Test
    void propagateWorksAcrossThreads() throws InterruptedException {
        MDC.put("requestId", "req_async");
        AtomicReference<String> seen = new AtomicReference<>();
        Thread worker = new Thread(RequestIdSupport.propagate(() -> seen.set(MDC.get("requestId"))));
        worker.start();
        worker.join();
        assertEquals("req_async", seen.get());
    }
}
