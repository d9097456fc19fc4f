package io.patchbay.cloud;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

public record ApiRequest(
        String method, URI uri, Map<String, String> headers, @Nullable String body, @Nullable String contentType) {

    public static final String JSON = "application/json; charset=utf-8";
    public static final String TEXT = "text/plain; charset=utf-8";

    public ApiRequest {
        headers = Map.copyOf(headers);
    }

    public static ApiRequest of(String method, URI uri) {
        return new ApiRequest(method, uri, Map.of(), null, null);
    }

    public static ApiRequest get(URI uri) {
        return of("GET", uri);
    }

    public ApiRequest withBody(String body, String contentType) {
        return new ApiRequest(method, uri, headers, body, contentType);
    }

    public ApiRequest withJsonBody(String json) {
        return withBody(json, JSON);
    }

    public ApiRequest withHeader(String name, String value) {
        var copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ApiRequest(method, uri, copy, body, contentType);
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}
