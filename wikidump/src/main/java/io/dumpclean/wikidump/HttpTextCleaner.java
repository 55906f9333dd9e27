package io.dumpclean.wikidump;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Cleaner backed by an HTTP service: POSTs the text and takes the response body as the cleaned
 * text. Any non-2xx status fails the call.
 */
public class HttpTextCleaner implements TextCleaner {
    private final HttpClient client;
    private final URI uri;
    private final Duration timeout;

    public HttpTextCleaner(URI uri, Duration timeout) {
        this.client = HttpClient.newHttpClient();
        this.uri = uri;
        this.timeout = timeout == null ? Duration.ZERO : timeout;
    }

    @Override
    public String clean(String text) throws TextCleanerException, InterruptedException {
        HttpRequest.Builder req = HttpRequest.newBuilder(uri)
                .header("Content-Type", "text/plain; charset=UTF-8")
                .POST(HttpRequest.BodyPublishers.ofString(text, StandardCharsets.UTF_8));
        if (!timeout.isZero() && !timeout.isNegative()) req.timeout(timeout);
        HttpResponse<String> resp;
        try {
            resp = client.send(req.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TextCleanerException("Cleaner request to " + uri + " failed", e);
        }
        if (resp.statusCode() / 100 != 2) {
            throw new TextCleanerException("Cleaner at " + uri + " answered " + resp.statusCode(), resp.statusCode(), resp.body());
        }
        return resp.body();
    }
}
