package com.insightflo.news.remote;

import com.insightflo.core.error.RemoteException;

@FunctionalInterface
public interface RemoteCall<T> {

    T call() throws RemoteException;
}
