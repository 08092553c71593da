package com.glyphforge.service;

import com.glyphforge.infra.config.RecognitionConfig;
import com.glyphforge.infra.metrics.MetricsRegistry;
import com.glyphforge.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.glyphforge.infra.telemetry.TracingService;
import com.glyphforge.service.model.RecognizeRequest;
import com.glyphforge.service.server.HttpServer;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point. With {@code -Dgrid.file} set, recognizes that grid once and writes the
 * generated code to {@code output.file} or stdout; otherwise serves HTTP on {@code server.port}.
 *
 * <p>Other properties: {@code patterns.file} (extra pattern source) and {@code toolkit}.
 */
public class GlyphforgeApplication {
    private static final Logger logger = Logger.getLogger(GlyphforgeApplication.class.getName());

    private final RecognitionService service;
    private final MetricsRegistry metrics;
    private final Tracer tracer;
    private HttpServer httpServer;

    public GlyphforgeApplication(RecognitionConfig config, Tracer tracer) {
        this.tracer = tracer;
        this.metrics = new InMemoryMetricsRegistry();
        this.service = new RecognitionService(config, tracer, metrics);
    }

    public static void main(String[] args) {
        configureLogging();
        try {
            GlyphforgeApplication app = new GlyphforgeApplication(
                RecognitionConfig.fromEnvironment(), TracingService.getInstance().getTracer());
            String gridFile = System.getProperty("grid.file");
            if (gridFile != null) {
                String patternsFile = System.getProperty("patterns.file");
                String code = app.generate(Paths.get(gridFile),
                    patternsFile == null ? null : Paths.get(patternsFile),
                    System.getProperty("toolkit"));
                String outputFile = System.getProperty("output.file");
                if (outputFile != null) {
                    Files.writeString(Paths.get(outputFile), code, StandardCharsets.UTF_8);
                    logger.info("Generated code written to " + outputFile);
                } else {
                    System.out.print(code);
                }
                TracingService.getInstance().shutdown();
                return;
            }
            app.start(Integer.parseInt(System.getProperty("server.port", "8080")));
            Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown));
            Thread.currentThread().join();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Application failed to start: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * One-shot run: recognizes the grid file and returns the generated code.
     *
     * @param patternsFile extra pattern source, may be null
     * @param toolkit      template set name, null for the configured default
     */
    public String generate(Path gridFile, Path patternsFile, String toolkit) throws IOException {
        String grid = Files.readString(gridFile, StandardCharsets.UTF_8);
        String patterns = patternsFile == null ? null : Files.readString(patternsFile, StandardCharsets.UTF_8);
        logger.info("Recognizing " + gridFile + (patternsFile == null ? "" : " with patterns " + patternsFile));
        return service.recognize(new RecognizeRequest(grid, patterns, toolkit, Map.of())).code();
    }

    public HttpServer start(int port) throws IOException {
        logger.info("Starting Glyphforge with OpenTelemetry");
        httpServer = new HttpServer(port, service, metrics, tracer);
        httpServer.start();
        logger.info("Glyphforge is ready to serve requests on port " + httpServer.port());
        return httpServer;
    }

    public void shutdown() {
        if (httpServer != null) {
            httpServer.stop(0);
        }
        TracingService.getInstance().shutdown();
        logger.info("Glyphforge shutdown complete");
    }

    static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = GlyphforgeApplication.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load logging.properties: " + e.getMessage(), e);
        }
    }
}
