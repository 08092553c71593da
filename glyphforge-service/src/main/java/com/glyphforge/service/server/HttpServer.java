/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.service.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.glyphforge.api.exceptions.DslFatalException;
import com.glyphforge.api.exceptions.ParseException;
import com.glyphforge.api.exceptions.RegistrationException;
import com.glyphforge.infra.metrics.MetricsRegistry;
import com.glyphforge.service.RecognitionService;
import com.glyphforge.service.model.RecognizeRequest;
import com.glyphforge.service.model.RecognizeResponse;
import com.glyphforge.service.model.ValidationResponse;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight HTTP front end for {@link RecognitionService}.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>POST /recognize - JSON {@link RecognizeRequest}, returns the component model and generated code</li>
 *   <li>POST /patterns/validate - pattern source as the raw body, returns a {@link ValidationResponse}</li>
 *   <li>GET /health - health check</li>
 *   <li>GET /metrics - pipeline counters and timers</li>
 * </ul>
 *
 * <p>Malformed input (bad JSON, oversized grids, unknown toolkits, pattern errors) is
 * answered with 400 and {@code {"error": message}}; anything else with 500.
 */
public class HttpServer {
    private static final Logger logger = Logger.getLogger(HttpServer.class.getName());

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final RecognitionService service;
    private final MetricsRegistry metrics;
    private final Tracer tracer;
    private final ObjectMapper objectMapper;

    /**
     * @param port port to listen on, 0 for an ephemeral port
     * @throws IOException if the server socket cannot be bound
     */
    public HttpServer(int port, RecognitionService service, MetricsRegistry metrics, Tracer tracer) throws IOException {
        this.service = Objects.requireNonNull(service, "RecognitionService cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "MetricsRegistry cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.objectMapper = new ObjectMapper();
        this.server = com.sun.net.httpserver.HttpServer.create(new InetSocketAddress(port), 0);

        this.server.createContext("/recognize", new RecognizeHandler());
        this.server.createContext("/patterns/validate", new ValidateHandler());
        this.server.createContext("/health", new HealthHandler());
        this.server.createContext("/metrics", new MetricsHandler());

        int coreCount = Runtime.getRuntime().availableProcessors();
        this.executor = Executors.newFixedThreadPool(coreCount * 2);
        this.server.setExecutor(executor);
    }

    public void start() {
        server.start();
        logger.info("Glyphforge server started on port " + port());
        logger.info("Endpoints: /recognize (POST), /patterns/validate (POST), /health (GET), /metrics (GET)");
    }

    public void stop(int delaySeconds) {
        logger.info("Stopping server...");
        server.stop(delaySeconds);
        executor.shutdown();
    }

    /** Bound port, useful when constructed with port 0. */
    public int port() {
        return server.getAddress().getPort();
    }

    class RecognizeHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            Span span = tracer.spanBuilder("http-recognize").startSpan();
            try (Scope scope = span.makeCurrent()) {
                RecognizeRequest request;
                try (InputStream is = exchange.getRequestBody()) {
                    request = objectMapper.readValue(is, RecognizeRequest.class);
                }
                RecognizeResponse response = service.recognize(request);
                span.setAttribute("toolkit", response.toolkit());
                sendResponse(exchange, 200, objectMapper.writeValueAsString(response));
            } catch (JsonProcessingException | IllegalArgumentException | ParseException
                     | DslFatalException | RegistrationException e) {
                span.recordException(e);
                sendError(exchange, 400, e.getMessage());
            } catch (RuntimeException e) {
                span.recordException(e);
                logger.log(Level.SEVERE, "Error during recognition", e);
                sendError(exchange, 500, "Internal Server Error");
            } finally {
                span.end();
            }
        }
    }

    class ValidateHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            Span span = tracer.spanBuilder("http-validate").startSpan();
            try (Scope scope = span.makeCurrent()) {
                String source;
                try (InputStream is = exchange.getRequestBody()) {
                    source = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                }
                ValidationResponse response = service.validate(source);
                span.setAttribute("valid", response.valid());
                sendResponse(exchange, response.valid() ? 200 : 422, objectMapper.writeValueAsString(response));
            } catch (RuntimeException e) {
                span.recordException(e);
                logger.log(Level.SEVERE, "Error during pattern validation", e);
                sendError(exchange, 500, "Internal Server Error");
            } finally {
                span.end();
            }
        }
    }

    class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            Map<String, Object> body = new LinkedHashMap<>();
            int patterns = service.builtInPatternCount();
            body.put("status", patterns > 0 ? "UP" : "DOWN");
            body.put("builtin_patterns", patterns);
            body.put("default_toolkit", service.config().defaultToolkit());
            sendResponse(exchange, patterns > 0 ? 200 : 503, objectMapper.writeValueAsString(body));
        }
    }

    class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            sendResponse(exchange, 200, objectMapper.writeValueAsString(metrics.snapshot()));
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendResponse(exchange, statusCode, objectMapper.writeValueAsString(
            Map.of("error", message == null ? "" : message)));
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
