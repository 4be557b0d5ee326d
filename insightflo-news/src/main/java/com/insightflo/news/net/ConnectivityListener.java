package com.insightflo.news.net;

@FunctionalInterface
public interface ConnectivityListener {

    void onConnectivityChanged(NetworkType previous, NetworkType current);
}
