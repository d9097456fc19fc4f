package io.patchbay.patch;

import java.util.List;
import java.util.Map;

/** Pre-signed blob storage endpoint: a time-limited URL with the method and headers it must be called with. */
public record SecureData(String url, String method, Map<String, List<String>> headers) {

    public SecureData {
        // absent in some server payloads
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /** First value of the {@code Host} header, or empty when the endpoint does not pin one. */
    public String host() {
        var values = headers.get("Host");
        if (values == null || values.isEmpty()) {
            return "";
        }
        return values.get(0);
    }
}
