package com.cardarchitect.formats;

import com.cardarchitect.formats.card.CardDocument;
import com.cardarchitect.formats.card.ExtractedCard;
import com.cardarchitect.formats.png.PngChunk;
import com.cardarchitect.formats.png.PngChunkReader;
import com.cardarchitect.formats.uri.UriSafetyOptions;
import com.cardarchitect.types.CardSpec;
import com.cardarchitect.types.UriScheme;
import com.cardarchitect.util.RawContainer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class CardCodecTest {

    private final CardCodec codec = new CardCodec();

    @Test
    void shouldRoundTripV3Card() throws Exception {
        CardDocument card = TestCards.v3WithAssets("Round Trip ✓");

        byte[] png = codec.embedCard(TestPngs.minimal(), card);
        Optional<ExtractedCard> extracted = codec.extractCard(png);

        assertThat(extracted).isPresent();
        assertThat(extracted.get().card()).isEqualTo(card);
        assertThat(extracted.get().spec()).isEqualTo(CardSpec.V3);
        assertThat(extracted.get().source()).isEqualTo("ccv3");
    }

    @Test
    void shouldRoundTripV2CardUnderChara() throws Exception {
        CardDocument card = TestCards.v2("Vee Two");

        byte[] png = codec.embedCard(TestPngs.minimal(), card);

        assertThat(new PngChunkReader().readTextChunks(RawContainer.wrap(png)).keywords()).containsExactly("chara");
        assertThat(codec.extractCard(png)).map(ExtractedCard::card).contains(card);
    }

    @Test
    void shouldEmbedMinifiedJson() throws Exception {
        CardDocument card = TestCards.v3("Tiny");

        byte[] png = codec.embedCard(TestPngs.minimal(), card, CardSpec.V3);

        String text = new PngChunkReader().readTextChunks(RawContainer.wrap(png)).get("ccv3").orElseThrow();
        assertThat(text).isEqualTo(card.toMinifiedJson()).doesNotContain("\n");
    }

    @Test
    void shouldReplaceOlderCardWhenReembedding() throws Exception {
        byte[] original = TestPngs.withText(Map.of("ccv3", TestCards.v3Json("First")));

        byte[] updated = codec.embedCard(original, TestCards.v3("Second"));

        assertThat(codec.extractCard(updated)).map(c -> c.card().name()).contains("Second");
        assertThat(textKeywords(updated)).containsExactly("ccv3");
    }

    @Test
    void shouldReplaceV3CardWithV2Card() throws Exception {
        byte[] v3Image = TestPngs.withText(Map.of("ccv3", TestCards.v3Json("Old")));
        CardDocument v2 = TestCards.v2("New");

        byte[] png = codec.embedCard(v3Image, v2);

        ExtractedCard extracted = codec.extractCard(png).orElseThrow();
        assertThat(extracted.card()).isEqualTo(v2);
        assertThat(extracted.spec()).isEqualTo(CardSpec.V2);
        assertThat(textKeywords(png)).containsExactly("chara");
    }

    @Test
    void shouldReplaceDualCardsWithSingleV3Card() throws Exception {
        Map<String, String> texts = new LinkedHashMap<>();
        texts.put("chara", TestCards.v2Json("Old Two"));
        texts.put("ccv3", TestCards.v3Json("Old Three"));
        texts.put("Software", "Paint 1.0");
        texts.put("character", TestCards.v2Json("Other Tool"));
        byte[] image = TestPngs.withText(texts);
        CardDocument v3 = TestCards.v3("Fresh");

        byte[] png = codec.embedCard(image, v3);

        assertThat(codec.extractCard(png)).map(ExtractedCard::card).contains(v3);
        assertThat(textKeywords(png)).containsExactly("Software", "ccv3");
        assertThat(new PngChunkReader().readTextChunks(RawContainer.wrap(png)).get("Software")).contains("Paint 1.0");
    }

    @Test
    void shouldKeepNonCardChunksByteForByte() throws Exception {
        byte[] image = TestPngs.withText(Map.of("Comment", "hello"));

        byte[] png = codec.embedCard(image, TestCards.v3("Kept"));

        // everything up to the original IEND is untouched
        assertThat(Arrays.copyOf(png, image.length - 12)).isEqualTo(Arrays.copyOf(image, image.length - 12));
        assertThat(textKeywords(png)).containsExactly("Comment", "ccv3");
    }

    private static List<String> textKeywords(byte[] png) throws Exception {
        return new PngChunkReader().readChunks(RawContainer.wrap(png)).stream()
                .filter(c -> c.isType(PngChunk.TEXT))
                .map(c -> new String(c.data(), 0, indexOfNul(c.data()), StandardCharsets.ISO_8859_1))
                .toList();
    }

    private static int indexOfNul(byte[] data) {
        for (int i = 0; i < data.length; i++) {
            if (data[i] == 0) return i;
        }
        return data.length;
    }

    @Test
    void shouldExposeUriHelpers() {
        assertThat(codec.parseUri("ccdefault:").scheme()).isEqualTo(UriScheme.CCDEFAULT);
        assertThat(codec.isUriSafe("http://x", UriSafetyOptions.strict())).isFalse();
    }

    @Test
    void shouldRoundTripThroughCharx() throws Exception {
        CardDocument card = TestCards.v3WithAssets("Archive");

        var built = codec.buildCharx(card, TestCards.localAssets());
        var contents = codec.readCharx(built.archive());

        assertThat(codec.validateCharxBuild(card, TestCards.localAssets()).isValid()).isTrue();
        assertThat(codec.validateCharx(contents).valid()).isTrue();
        assertThat(contents.card().name()).isEqualTo("Archive");
    }
}
