package com.cardarchitect;

import com.cardarchitect.formats.api.CardFormatHandlerFactory;
import com.cardarchitect.formats.api.FileContext;
import com.cardarchitect.formats.registry.CardFormatRegistry;
import com.cardarchitect.util.RawContainer;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.stream.StreamSupport;

import static org.assertj.core.api.Assertions.*;

/**
 * CDI integration test verifying that CardFormatRegistry discovers the
 * PNG, CHARX and JSON handler factories via Quarkus/ArC.
 */
@QuarkusTest
class CardFormatRegistryTest {

    @Inject
    CardFormatRegistry registry;

    @Inject
    Instance<CardFormatHandlerFactory> factories;

    @Test
    void shouldDiscoverAllFactories() {
        long count = StreamSupport.stream(factories.spliterator(), false).count();

        assertThat(count).isEqualTo(3);
    }

    @Test
    void shouldFindPngHandler() {
        var handler = registry.findHandler(RawContainer.wrap(TestFiles.png()), FileContext.of("card.png"));

        assertThat(handler).hasValueSatisfying(h -> assertThat(h.formatKey()).isEqualTo("png"));
    }

    @Test
    void shouldFindCharxHandlerByMagic() {
        byte[] zip = {0x50, 0x4B, 0x03, 0x04, 0x00, 0x00, 0x00, 0x00};

        var handler = registry.findHandler(RawContainer.wrap(zip), FileContext.of("upload.bin"));

        assertThat(handler).hasValueSatisfying(h -> assertThat(h.formatKey()).isEqualTo("charx"));
    }

    @Test
    void shouldFindJsonHandlerByMimeType() {
        byte[] json = TestFiles.V2_CARD.getBytes(StandardCharsets.UTF_8);

        var handler = registry.findHandler(RawContainer.wrap(json), FileContext.of("card", "application/json"));

        assertThat(handler).hasValueSatisfying(h -> assertThat(h.formatKey()).isEqualTo("json"));
    }

    @Test
    void shouldRejectUnknownFormat() {
        byte[] gif = "GIF89a".getBytes(StandardCharsets.US_ASCII);

        assertThat(registry.findHandler(RawContainer.wrap(gif), FileContext.of("card.gif"))).isEmpty();
    }
}
