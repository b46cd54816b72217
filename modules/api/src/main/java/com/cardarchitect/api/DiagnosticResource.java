package com.cardarchitect.api;

import com.cardarchitect.formats.api.CardFormatHandlerFactory;
import com.cardarchitect.formats.api.DetectionCriteria;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.StreamSupport;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @ConfigProperty(name = "cardarchitect.storage.root")
    String storageRoot;

    @Inject
    Instance<CardFormatHandlerFactory> factories;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of(
                "status", "ok",
                "message", "Card Architect is running"
        );
    }

    @GET
    @Path("/info")
    public Map<String, String> info() {
        return Map.of(
                "name", appName,
                "version", appVersion,
                "java", System.getProperty("java.version"),
                "profile", profile,
                "storageRoot", storageRoot
        );
    }

    /**
     * Registered upload formats, highest detection priority first.
     */
    @GET
    @Path("/formats")
    public List<Map<String, Object>> formats() {
        return StreamSupport.stream(factories.spliterator(), false)
                .map(CardFormatHandlerFactory::getDetectionCriteria)
                .sorted(Comparator.comparingInt(DetectionCriteria::priority).reversed())
                .map(c -> Map.<String, Object>of(
                        "extensions", new TreeSet<>(c.extensions()),
                        "mimeTypes", new TreeSet<>(c.mimeTypes()),
                        "priority", c.priority()))
                .toList();
    }
}
