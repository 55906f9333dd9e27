package io.dumpclean.wikidump;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class HttpTextCleanerTest {
    private HttpServer server;
    private String base;

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/clean", exchange -> {
            byte[] in = exchange.getRequestBody().readAllBytes();
            byte[] out = new String(in, StandardCharsets.UTF_8).replace("Hello", "Hi").getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
        });
        server.createContext("/fail", exchange -> {
            exchange.getRequestBody().readAllBytes();
            byte[] out = "parser crashed".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(500, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void response_body_is_the_cleaned_text() throws Exception {
        HttpTextCleaner cleaner = new HttpTextCleaner(URI.create(base + "/clean"), Duration.ofSeconds(5));
        assertEquals("Hi <SPEC_START>Wörld<SPEC_END>.", cleaner.clean("Hello <SPEC_START>Wörld<SPEC_END>."));
    }

    @Test
    void error_status_fails_the_call() {
        HttpTextCleaner cleaner = new HttpTextCleaner(URI.create(base + "/fail"), Duration.ZERO);

        TextCleanerException e = assertThrows(TextCleanerException.class, () -> cleaner.clean("text"));

        assertEquals(500, e.exitCode());
        assertEquals("parser crashed", e.output());
    }

    @Test
    void unreachable_endpoint_fails_the_call() throws Exception {
        int port;
        try (ServerSocket free = new ServerSocket(0)) {
            port = free.getLocalPort();
        }
        HttpTextCleaner cleaner = new HttpTextCleaner(URI.create("http://127.0.0.1:" + port + "/clean"), Duration.ofSeconds(2));

        assertThrows(TextCleanerException.class, () -> cleaner.clean("text"));
    }
}
