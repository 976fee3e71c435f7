package com.redmineapi.client.common.status;

/**
 * Status codes shared by the resource engine and the HTTP transport. Each code carries the HTTP
 * status it is most closely associated with, so failures raised locally and failures reported by
 * the server can be handled uniformly by callers.
 */
public enum StatusCode {
    OK(200),                 // 200 OK
    INVALID_ARGUMENT(400),   // 400 Bad Request
    UNAUTHENTICATED(401),    // 401 Unauthorized
    PERMISSION_DENIED(403),  // 403 Forbidden
    NOT_FOUND(404),          // 404 Not Found
    ALREADY_EXISTS(409),     // 409 Conflict
    FAILED_PRECONDITION(412),// 412 Precondition Failed
    UNPROCESSABLE(422),      // 422 Unprocessable Entity (server-side validation)
    RESOURCE_EXHAUSTED(429), // 429 Too Many Requests
    INTERNAL(500),           // 500 Internal Server Error
    UNIMPLEMENTED(501),      // 501 Not Implemented
    UNAVAILABLE(503),        // 503 Service Unavailable
    DEADLINE_EXCEEDED(504);  // 504 Gateway Timeout

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

    /**
     * Maps an HTTP status code to the closest matching StatusCode.
     *
     * @param httpStatusCode the HTTP status code to convert
     * @return the corresponding StatusCode
     */
    public static StatusCode fromHttpStatus(int httpStatusCode) {
        switch (httpStatusCode) {
            case 400: return INVALID_ARGUMENT;
            case 401: return UNAUTHENTICATED;
            case 403: return PERMISSION_DENIED;
            case 404: return NOT_FOUND;
            case 409: return ALREADY_EXISTS;
            case 412: return FAILED_PRECONDITION;
            case 422: return UNPROCESSABLE;
            case 429: return RESOURCE_EXHAUSTED;
            case 500: return INTERNAL;
            case 501: return UNIMPLEMENTED;
            case 503: return UNAVAILABLE;
            case 504: return DEADLINE_EXCEEDED;
            default:
                // Map based on range
                if (httpStatusCode >= 400 && httpStatusCode < 500) {
                    return INVALID_ARGUMENT;
                } else if (httpStatusCode >= 500) {
                    return INTERNAL;
                } else {
                    return OK;
                }
        }
    }
}
