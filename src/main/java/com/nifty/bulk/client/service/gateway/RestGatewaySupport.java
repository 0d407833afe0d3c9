package com.nifty.bulk.client.service.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.nifty.bulk.client.common.exception.BaseClientException;
import com.nifty.bulk.client.common.exception.GatewayException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Shared plumbing for the REST collaborators: bearer headers, running blocking calls off
 * the sync thread, and translating HTTP failures into client exceptions.
 */
abstract class RestGatewaySupport {

    protected final RestTemplate rest;
    private final Executor io;

    protected RestGatewaySupport(RestTemplate rest, Executor io) {
        this.rest = rest;
        this.io = io;
    }

    protected <T> CompletableFuture<T> async(Supplier<T> call) {
        return CompletableFuture.supplyAsync(call, io);
    }

    protected JsonNode exchange(HttpMethod method, String path, Object body, String bearerToken) {
        HttpHeaders h = new HttpHeaders();
        if (body != null) {
            h.setContentType(MediaType.APPLICATION_JSON);
        }
        if (bearerToken != null) {
            h.setBearerAuth(bearerToken);
        }
        try {
            ResponseEntity<JsonNode> r = rest.exchange(path, method, new HttpEntity<>(body, h), JsonNode.class);
            return r.getBody();
        } catch (HttpStatusCodeException ex) {
            throw translate(method, path, ex);
        } catch (RestClientException ex) {
            throw new GatewayException(method + " " + path + " failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * Subclasses map specific statuses to domain failures; default is a generic gateway error.
     */
    protected BaseClientException translate(HttpMethod method, String path, HttpStatusCodeException ex) {
        return new GatewayException(buildMessage(method, path, ex), ex);
    }

    protected static String buildMessage(HttpMethod method, String path, HttpStatusCodeException ex) {
        String body = ex.getResponseBodyAsString(StandardCharsets.UTF_8);
        return method + " " + path + " returned " + ex.getStatusCode().value() + ": " + body;
    }

    /**
     * Responses come either bare or wrapped as {"data": {...}}.
     */
    protected static JsonNode unwrap(JsonNode root) {
        if (root == null || root.isNull()) return null;
        JsonNode data = root.get("data");
        return (data != null && data.isObject()) ? data : root;
    }

    protected static String text(JsonNode node, String... names) {
        if (node == null) return null;
        for (String n : names) {
            JsonNode v = node.get(n);
            if (v != null && !v.isNull() && !v.asText().isBlank()) return v.asText();
        }
        return null;
    }
}
