package com.insightflo.core.error;

/**
 * No network is available and there is nothing cached to fall back to.
 */
public class ConnectivityException extends Exception {

    public ConnectivityException(String message) {
        super(message);
    }
}
