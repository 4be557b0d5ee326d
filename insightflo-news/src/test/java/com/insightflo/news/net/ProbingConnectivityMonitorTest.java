package com.insightflo.news.net;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProbingConnectivityMonitorTest {

    private HttpServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Should report a reachable host as connected")
    void reachable() {
        try (ProbingConnectivityMonitor monitor = new ProbingConnectivityMonitor(
                "http://127.0.0.1:" + server.getAddress().getPort() + "/", Duration.ofSeconds(2))) {
            assertEquals(NetworkType.OTHER, monitor.probe());
            assertTrue(monitor.isConnected());
        }
    }

    @Test
    @DisplayName("Should report an unreachable host as offline and notify listeners")
    void unreachable() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        List<String> changes = new ArrayList<>();

        try (ProbingConnectivityMonitor monitor = new ProbingConnectivityMonitor(
                "http://127.0.0.1:" + closedPort + "/", Duration.ofSeconds(2))) {
            monitor.addListener((previous, current) -> changes.add(previous + "->" + current));

            assertEquals(NetworkType.NONE, monitor.probe());
            assertFalse(monitor.isConnected());
        }
        assertEquals(List.of("OTHER->NONE"), changes);
    }

    @Test
    @DisplayName("Should notify only on transitions and survive a failing listener")
    void transitionsOnly() {
        List<NetworkType> seen = new ArrayList<>();
        try (ProbingConnectivityMonitor monitor = new ProbingConnectivityMonitor("http://127.0.0.1:1/", Duration.ofSeconds(1))) {
            monitor.addListener((previous, current) -> { throw new IllegalStateException("listener bug"); });
            monitor.addListener((previous, current) -> seen.add(current));

            monitor.update(NetworkType.OTHER);
            monitor.update(NetworkType.NONE);
            monitor.update(NetworkType.NONE);
            monitor.update(NetworkType.WIFI);
        }
        assertEquals(List.of(NetworkType.NONE, NetworkType.WIFI), seen);
    }
}
