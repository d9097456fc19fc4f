package io.patchbay.cloud;

import java.io.IOException;
import java.net.URI;
import org.jetbrains.annotations.Blocking;

/**
 * HTTP primitive used by {@link CloudPatchClient}. Implementations perform a single request/response exchange and
 * report non-2xx statuses through {@link ApiResponse#code()} rather than by throwing.
 */
public interface ServerConnection {

    /** Root of the cloud API, ending in '/'. */
    URI baseApiUri();

    /** Sends a request to the cloud API with the account credentials attached. */
    @Blocking
    ApiResponse fetch(ApiRequest request) throws IOException;

    /** Sends a request to a pre-signed endpoint; no credentials are attached. */
    @Blocking
    ApiResponse fetchUnauthenticated(ApiRequest request) throws IOException;
}
