package com.prospect.leadengine.qualify.http;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    Map<String, List<String>> headers,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public HttpFetchResult {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    /**
     * Header names and values flattened to lower case, one {@code name: value} line per value.
     */
    public String headerText() {
        StringBuilder text = new StringBuilder();
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            for (String value : entry.getValue()) {
                text.append(entry.getKey().toLowerCase(Locale.ROOT))
                    .append(": ")
                    .append(value == null ? "" : value.toLowerCase(Locale.ROOT))
                    .append('\n');
            }
        }
        return text.toString();
    }
}
