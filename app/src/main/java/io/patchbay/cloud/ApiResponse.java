package io.patchbay.cloud;

public record ApiResponse(int code, String body) {

    public boolean isSuccessful() {
        return code >= 200 && code < 300;
    }
}
