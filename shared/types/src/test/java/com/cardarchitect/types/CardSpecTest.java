package com.cardarchitect.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CardSpecTest {

    @Test
    void shouldMapGenerationsToPngKeywords() {
        assertThat(CardSpec.V3.pngKeyword()).isEqualTo("ccv3");
        assertThat(CardSpec.V2.pngKeyword()).isEqualTo("chara");
    }

    @Test
    void shouldExposeDiscriminators() {
        assertThat(CardSpec.V3.discriminator()).isEqualTo("chara_card_v3");
        assertThat(CardSpec.V2.discriminator()).isEqualTo("chara_card_v2");
    }

    @Test
    void shouldResolveFromLabel() {
        assertThat(CardSpec.fromLabel("v2")).isEqualTo(CardSpec.V2);
        assertThat(CardSpec.fromLabel("v3")).isEqualTo(CardSpec.V3);
    }

    @Test
    void shouldRejectUnknownLabel() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> CardSpec.fromLabel("v4"))
                .withMessageContaining("v4");
    }
}
