package com.parceltrack.common.status;

/**
 * Status codes that correspond to both gRPC status codes and HTTP status codes.
 * An API layer in front of the store can translate a failed operation into its own
 * response vocabulary from the code alone.
 */
public enum StatusCode {
    OK(200),                 // 200 OK
    INVALID_ARGUMENT(400),   // 400 Bad Request
    DEADLINE_EXCEEDED(504),  // 504 Gateway Timeout
    NOT_FOUND(404),          // 404 Not Found
    FAILED_PRECONDITION(400),// 400 Bad Request (more specific: precondition failed)
    ABORTED(409),            // 409 Conflict
    INTERNAL(500),           // 500 Internal Server Error
    UNAVAILABLE(503),        // 503 Service Unavailable
    DATA_LOSS(500);          // 500 Internal Server Error (more specific: data loss)

    private final int httpCode;

    StatusCode(int httpCode) {
        this.httpCode = httpCode;
    }

    /**
     * Returns the corresponding HTTP status code.
     */
    public int getHttpCode() {
        return httpCode;
    }

    /**
     * Returns whether this status code represents a successful operation.
     */
    public boolean isSuccess() {
        return this == OK;
    }
}
