package com.rolesync.verifier.reconcile.http;

import com.rolesync.verifier.reconcile.model.HttpCallResult;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

/**
 * Runs a single HTTP exchange and turns every outcome, including transport failures, into an
 * {@link HttpCallResult}. Retrying is left to the callers.
 */
public class HttpCallExecutor {
    private final HttpClient client;

    public HttpCallExecutor(ExecutorService httpExecutor, int connectTimeoutSeconds) {
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(Math.max(1, connectTimeoutSeconds)))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpCallResult execute(HttpRequest request) {
        Instant startedAt = Instant.now();
        String url = request.uri().toString();
        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
            return new HttpCallResult(
                request.method(),
                url,
                response.statusCode(),
                responseBody,
                response.headers().firstValue("Retry-After").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpConnectTimeoutException e) {
            return errorResult(request, startedAt, "connect_timeout", e.getMessage());
        } catch (HttpTimeoutException e) {
            return errorResult(request, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(request, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(request, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(request, startedAt, "http_error", e.getMessage());
        }
    }

    public static boolean isTransient(HttpCallResult result) {
        if (isNetworkOrServerFailure(result)) {
            return true;
        }
        int status = result.statusCode();
        return !result.isTransportError() && (status == 408 || status == 429);
    }

    /**
     * Timeouts, connection errors and 5xx only. Any 4xx, including 408 and 429, is the caller's
     * to classify.
     */
    public static boolean isNetworkOrServerFailure(HttpCallResult result) {
        if (result.isTransportError()) {
            return !"interrupted".equals(result.errorCode()) && !"invalid_url".equals(result.errorCode());
        }
        return result.statusCode() >= 500;
    }

    public static HttpCallResult interrupted(String method, String url) {
        return new HttpCallResult(method, url, 0, null, null, Instant.now(), Duration.ZERO, "interrupted", "interrupted while waiting");
    }

    public static HttpCallResult invalidUrl(String method, String url, String message) {
        return new HttpCallResult(method, url, 0, null, null, Instant.now(), Duration.ZERO, "invalid_url", message);
    }

    private HttpCallResult errorResult(HttpRequest request, Instant startedAt, String code, String message) {
        return new HttpCallResult(
            request.method(),
            request.uri().toString(),
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
