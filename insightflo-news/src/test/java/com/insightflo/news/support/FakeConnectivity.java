package com.insightflo.news.support;

import com.insightflo.news.net.ConnectivityListener;
import com.insightflo.news.net.ConnectivityMonitor;
import com.insightflo.news.net.NetworkType;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class FakeConnectivity implements ConnectivityMonitor {

    private final List<ConnectivityListener> listeners = new CopyOnWriteArrayList<>();
    private volatile NetworkType current;

    public FakeConnectivity(NetworkType initial) {
        this.current = initial;
    }

    public static FakeConnectivity online() {
        return new FakeConnectivity(NetworkType.WIFI);
    }

    public static FakeConnectivity offline() {
        return new FakeConnectivity(NetworkType.NONE);
    }

    public void set(NetworkType next) {
        NetworkType previous = current;
        current = next;
        if (previous != next) {
            for (ConnectivityListener listener : listeners) {
                listener.onConnectivityChanged(previous, next);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    @Override
    public NetworkType current() {
        return current;
    }

    @Override
    public void addListener(ConnectivityListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(ConnectivityListener listener) {
        listeners.remove(listener);
    }
}
