package com.cardarchitect.core.health;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class StorageHealthCheckTest {

    @TempDir
    Path tmp;

    @Test
    void upWhenRootIsCreatable() {
        StorageHealthCheck check = new StorageHealthCheck();
        check.root = tmp.resolve("assets").toString();

        HealthCheckResponse response = check.call();

        assertThat(response.getName()).isEqualTo("asset-storage");
        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(tmp.resolve("assets")).isDirectory();
    }

    @Test
    void downWhenRootIsAFile() throws Exception {
        Path file = Files.writeString(tmp.resolve("not-a-dir"), "x");
        StorageHealthCheck check = new StorageHealthCheck();
        check.root = file.toString();

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data).containsKey("error"));
    }
}
