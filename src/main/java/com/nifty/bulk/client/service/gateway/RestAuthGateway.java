package com.nifty.bulk.client.service.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.nifty.bulk.client.common.exception.AuthFailureException;
import com.nifty.bulk.client.common.exception.BaseClientException;
import com.nifty.bulk.client.common.exception.GatewayException;
import com.nifty.bulk.client.model.AuthCredentials;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Component
@Slf4j
public class RestAuthGateway extends RestGatewaySupport implements AuthGateway {

    public RestAuthGateway(RestTemplate rest, @Qualifier("gatewayExecutor") Executor io) {
        super(rest, io);
    }

    @Override
    public CompletableFuture<String> authenticate(AuthCredentials credentials) {
        return async(() -> {
            Map<String, String> body = new LinkedHashMap<>();
            String path;
            switch (credentials.getChannel()) {
                case MOBILE_OTP:
                    path = "/auth/login/mobile/verify";
                    body.put("mobile", credentials.getIdentifier());
                    body.put("otp", credentials.getSecret());
                    break;
                case SUPER_OPERATOR:
                    path = "/auth/superadmin/login";
                    body.put("email", credentials.getIdentifier());
                    body.put("password", credentials.getSecret());
                    break;
                default:
                    path = "/auth/login/email";
                    body.put("email", credentials.getIdentifier());
                    body.put("password", credentials.getSecret());
            }
            JsonNode root = exchange(HttpMethod.POST, path, body, null);
            String token = tokenOf(root);
            if (token == null) {
                throw new AuthFailureException("No token received from server");
            }
            log.info("Authenticated via {}", credentials.getChannel());
            return token;
        });
    }

    @Override
    public CompletableFuture<String> exchange(String bearerToken) {
        return async(() -> {
            JsonNode root = exchange(HttpMethod.POST, "/auth/token/refresh", null, bearerToken);
            String token = tokenOf(root);
            if (token == null) {
                throw new GatewayException("Token refresh returned no token");
            }
            return token;
        });
    }

    @Override
    public CompletableFuture<Void> revokeAll(String bearerToken) {
        return async(() -> {
            exchange(HttpMethod.POST, "/auth/logout-all", null, bearerToken);
            return null;
        });
    }

    private static String tokenOf(JsonNode root) {
        String t = text(root, "token");
        return t != null ? t : text(unwrap(root), "token");
    }

    @Override
    protected BaseClientException translate(HttpMethod method, String path, HttpStatusCodeException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (path.startsWith("/auth/login") || path.startsWith("/auth/superadmin")) {
            if (status == HttpStatus.BAD_REQUEST || status == HttpStatus.UNAUTHORIZED || status == HttpStatus.FORBIDDEN) {
                return new AuthFailureException("Login rejected (" + ex.getStatusCode().value() + ")", ex);
            }
        }
        return super.translate(method, path, ex);
    }
}
