package io.patchbay.cloud;

import org.jetbrains.annotations.Nullable;

/** Failure of a cloud patch operation. {@link #getStatusCode()} is only meaningful for {@link ErrorType#HTTP_ERROR}. */
public class CloudPatchException extends Exception {
    public enum ErrorType {
        NETWORK_ERROR,
        HTTP_ERROR,
        INVALID_RESPONSE,
        MISSING_PROVIDER
    }

    private final ErrorType errorType;
    private final int statusCode;

    public CloudPatchException(ErrorType errorType, String message) {
        this(errorType, message, -1, null);
    }

    public CloudPatchException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, message, -1, cause);
    }

    protected CloudPatchException(ErrorType errorType, String message, int statusCode, @Nullable Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.statusCode = statusCode;
    }

    public static CloudPatchException http(int statusCode, String message) {
        return new CloudPatchException(ErrorType.HTTP_ERROR, message, statusCode, null);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
