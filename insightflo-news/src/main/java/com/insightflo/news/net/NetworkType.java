package com.insightflo.news.net;

public enum NetworkType {
    NONE,
    WIFI,
    CELLULAR,
    ETHERNET,
    OTHER;

    public boolean isConnected() {
        return this != NONE;
    }
}
