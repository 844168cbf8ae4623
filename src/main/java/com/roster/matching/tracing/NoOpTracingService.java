package com.roster.matching.tracing;

import java.util.Map;

/**
 * Default {@link TracingService} for matchers built without tracing. Every
 * resolution shares one span that ignores attributes, status and exceptions.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return DiscardingSpan.INSTANCE;
    }

    private enum DiscardingSpan implements Span {
        INSTANCE;

        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    }
}
