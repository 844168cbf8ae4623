package com.roster.matching.tracing;

import java.util.Map;

/**
 * Tracing hook for resolutions. {@link NoOpTracingService} is the default.
 */
public interface TracingService {

    Span startSpan(String operationName, Map<String, String> attributes);
}
