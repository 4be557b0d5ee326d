package com.insightflo.core.error;

/**
 * Thrown by the remote gateway for non-2xx responses, malformed payloads
 * and transport failures.
 */
public class RemoteException extends Exception {

    /** Status code used when no HTTP response was received. */
    public static final int NO_RESPONSE = -1;

    private final int statusCode;

    public RemoteException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransportFailure() {
        return statusCode == NO_RESPONSE;
    }

    /**
     * Server errors and transport failures are worth retrying. Client errors are not.
     */
    public boolean isRetryable() {
        return statusCode == NO_RESPONSE || statusCode >= 500 || statusCode == 429;
    }
}
