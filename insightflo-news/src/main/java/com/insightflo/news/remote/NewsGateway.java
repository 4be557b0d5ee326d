package com.insightflo.news.remote;

import com.insightflo.core.error.RemoteException;
import com.insightflo.core.model.NewsRecord;

import java.util.List;

/**
 * Read access to the news backend.
 * Returned records carry the requesting user id where one is known; {@code cachedAt} is left unset.
 */
public interface NewsGateway {

    List<NewsRecord> fetchNews(int page, int limit) throws RemoteException;

    List<NewsRecord> fetchPersonalizedNews(String userId, int page, int limit) throws RemoteException;

    List<NewsRecord> searchNews(String query, int page, int limit) throws RemoteException;

    List<UserKeyword> fetchUserKeywords(String userId) throws RemoteException;
}
