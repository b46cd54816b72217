package com.cardarchitect.core.health;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;

@Readiness
@ApplicationScoped
public class StorageHealthCheck implements HealthCheck {

    @ConfigProperty(name = "cardarchitect.storage.root")
    String root;

    @Override
    public HealthCheckResponse call() {
        Path path = Path.of(root).toAbsolutePath();
        try {
            Files.createDirectories(path);
            if (!Files.isWritable(path)) {
                return HealthCheckResponse.named("asset-storage")
                        .down()
                        .withData("root", path.toString())
                        .withData("error", "not writable")
                        .build();
            }
            return HealthCheckResponse.named("asset-storage")
                    .up()
                    .withData("root", path.toString())
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("asset-storage")
                    .down()
                    .withData("root", path.toString())
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
