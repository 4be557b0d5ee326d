package com.insightflo.news.remote;

import java.util.Optional;

/**
 * Supplies the bearer token of the signed-in user.
 * An empty token means guest access, which the backend accepts for public feeds.
 */
@FunctionalInterface
public interface SessionProvider {

    SessionProvider ANONYMOUS = Optional::empty;

    Optional<String> accessToken();
}
