package com.paycrypt.webhook.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Outbound POST of webhook bodies.
 *
 * Any HTTP response, 2xx or not, comes back as a {@link WebhookHttpResponse}.
 * Only failures to obtain a response are thrown, as {@link WebhookTransportException}
 * classified by cause. One RestTemplate is kept per timeout value.
 */
@Slf4j
@Component
public class WebhookHttpClient {

    private final Function<Duration, RestTemplate> templateFactory;
    private final Map<Duration, RestTemplate> templates = new ConcurrentHashMap<>();

    @Autowired
    public WebhookHttpClient(RestTemplateBuilder builder) {
        this(timeout -> builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build());
    }

    public WebhookHttpClient(Function<Duration, RestTemplate> templateFactory) {
        this.templateFactory = templateFactory;
    }

    public WebhookHttpResponse post(String url, HttpHeaders headers, String body, Duration timeout) {
        RestTemplate restTemplate = templates.computeIfAbsent(timeout, this::newTemplate);
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    URI.create(url), HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
            String responseBody = response.getBody() != null ? response.getBody() : "";
            return new WebhookHttpResponse(response.getStatusCode().value(), responseBody);
        } catch (ResourceAccessException e) {
            throw classify(e);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new WebhookTransportException(WebhookTransportException.Kind.REQUEST, e.getMessage(), e);
        }
    }

    private RestTemplate newTemplate(Duration timeout) {
        RestTemplate restTemplate = templateFactory.apply(timeout);
        restTemplate.setErrorHandler(new PassThroughErrorHandler());
        log.debug("Created webhook RestTemplate with timeout={}", timeout);
        return restTemplate;
    }

    private static WebhookTransportException classify(ResourceAccessException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage() != null ? cause.getMessage() : e.getMessage();
        if (cause instanceof SocketTimeoutException) {
            return new WebhookTransportException(WebhookTransportException.Kind.TIMEOUT, message, e);
        }
        if (cause instanceof ConnectException
                || cause instanceof UnknownHostException
                || cause instanceof NoRouteToHostException) {
            return new WebhookTransportException(WebhookTransportException.Kind.CONNECTION, message, e);
        }
        return new WebhookTransportException(WebhookTransportException.Kind.REQUEST, message, e);
    }

    /**
     * Status codes are the dispatcher's business, not exceptions.
     */
    private static final class PassThroughErrorHandler extends DefaultResponseErrorHandler {
        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }
    }
}
