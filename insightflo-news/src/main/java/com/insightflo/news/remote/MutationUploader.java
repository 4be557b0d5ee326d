package com.insightflo.news.remote;

import com.insightflo.core.error.RemoteException;
import com.insightflo.core.model.BookmarkMutation;

import java.util.List;

/**
 * Pushes local-only changes to the backend during the upload phase of a sync.
 */
@FunctionalInterface
public interface MutationUploader {

    /**
     * The backend does not accept per-field mutations yet. Nothing is uploaded
     * and pending mutations stay queued locally.
     */
    MutationUploader NONE = (userId, mutations) -> 0;

    /**
     * @return number of mutations the backend accepted
     */
    int upload(String userId, List<BookmarkMutation> mutations) throws RemoteException;
}
