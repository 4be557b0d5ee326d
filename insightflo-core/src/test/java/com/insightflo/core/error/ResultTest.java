package com.insightflo.core.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    @DisplayName("Ok should expose its value")
    void okExposesValue() {
        Result<String> result = Result.ok("news");

        assertTrue(result.isOk());
        assertEquals(Optional.of("news"), result.value());
        assertTrue(result.errorKind().isEmpty());
    }

    @Test
    @DisplayName("Ok record should hold the raw value and value() should wrap it")
    void okRecordComponent() {
        Result<String> result = Result.ok("news");
        Result<String> empty = Result.ok(null);

        assertEquals("news", ((Result.Ok<String>) result).result());
        assertEquals(new Result.Ok<>("news"), result);
        assertEquals(Optional.empty(), empty.value());
        assertTrue(empty.isOk());
    }

    @Test
    @DisplayName("Err should carry kind and message and fall back to the default")
    void errCarriesKind() {
        Result<String> result = Result.err(ErrorKind.CONNECTIVITY, "offline");

        assertFalse(result.isOk());
        assertEquals(Optional.of(ErrorKind.CONNECTIVITY), result.errorKind());
        assertEquals("fallback", result.orElse("fallback"));
        assertEquals("offline", ((Result.Err<String>) result).message());
    }

    @Test
    @DisplayName("Map should transform Ok and pass Err through")
    void mapTransformsOnlyOk() {
        Result<Integer> ok = Result.<String>ok("abc").map(String::length);
        Result<Integer> err = Result.<String>err(ErrorKind.REMOTE, "boom").map(String::length);

        assertEquals(Optional.of(3), ok.value());
        assertEquals(Optional.of(ErrorKind.REMOTE), err.errorKind());
    }

    @Test
    @DisplayName("Remote failures should be retryable only for transport, 5xx and 429")
    void remoteRetryability() {
        assertTrue(new RemoteException(RemoteException.NO_RESPONSE, "io").isRetryable());
        assertTrue(new RemoteException(503, "unavailable").isRetryable());
        assertTrue(new RemoteException(429, "slow down").isRetryable());
        assertFalse(new RemoteException(404, "missing").isRetryable());
        assertFalse(new RemoteException(401, "auth").isRetryable());
        assertTrue(new RemoteException(RemoteException.NO_RESPONSE, "io").isTransportFailure());
    }
}
