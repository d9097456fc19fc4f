package io.patchbay.cloud;

import io.patchbay.config.PatchbaySettings;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** {@link ServerConnection} over OkHttp. One client is shared by all requests so connections are pooled. */
public class OkHttpServerConnection implements ServerConnection {
    private static final Logger logger = LogManager.getLogger(OkHttpServerConnection.class);

    private final URI baseApiUri;
    private final @Nullable String token;
    private final OkHttpClient httpClient;

    public OkHttpServerConnection(
            URI baseApiUri, @Nullable String token, Duration connectTimeout, Duration readTimeout) {
        var base = baseApiUri.toString();
        this.baseApiUri = base.endsWith("/") ? baseApiUri : URI.create(base + "/");
        this.token = token == null || token.isBlank() ? null : token;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .build();
    }

    public static OkHttpServerConnection fromSettings(PatchbaySettings settings) {
        return new OkHttpServerConnection(
                settings.getApiBaseUri(),
                settings.getApiToken().orElse(null),
                settings.getConnectTimeout(),
                settings.getReadTimeout());
    }

    @Override
    public URI baseApiUri() {
        return baseApiUri;
    }

    @Override
    public ApiResponse fetch(ApiRequest request) throws IOException {
        if (token == null) {
            logger.debug("No API token configured; sending {} without credentials", request);
        }
        return execute(request, token);
    }

    @Override
    public ApiResponse fetchUnauthenticated(ApiRequest request) throws IOException {
        return execute(request, null);
    }

    private ApiResponse execute(ApiRequest request, @Nullable String bearer) throws IOException {
        var builder = new Request.Builder().url(request.uri().toString());
        request.headers().forEach(builder::header);
        if (bearer != null) {
            builder.header("Authorization", "Bearer " + bearer);
        }
        if (request.contentType() != null && request.contentType().startsWith("application/json")) {
            builder.header("Accept", "application/json");
        }
        builder.method(request.method(), toBody(request));

        try (var response = httpClient.newCall(builder.build()).execute()) {
            var responseBody = response.body();
            var text = responseBody == null ? "" : responseBody.string();
            logger.debug("{} -> {} ({} chars)", request, response.code(), text.length());
            return new ApiResponse(response.code(), text);
        }
    }

    private static @Nullable RequestBody toBody(ApiRequest request) {
        var body = request.body();
        if (body == null) {
            // OkHttp requires a body for these methods
            return switch (request.method()) {
                case "POST", "PUT", "PATCH" -> RequestBody.create(new byte[0], null);
                default -> null;
            };
        }
        var contentType = request.contentType() == null ? ApiRequest.JSON : request.contentType();
        return RequestBody.create(body, MediaType.get(contentType));
    }
}
