package com.insightflo.news.net;

/**
 * Current network state plus change notifications.
 */
public interface ConnectivityMonitor {

    NetworkType current();

    default boolean isConnected() {
        return current().isConnected();
    }

    void addListener(ConnectivityListener listener);

    void removeListener(ConnectivityListener listener);
}
