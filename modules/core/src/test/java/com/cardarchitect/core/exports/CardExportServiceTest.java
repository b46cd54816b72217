package com.cardarchitect.core.exports;

import com.cardarchitect.core.assets.AssetResolutionService;
import com.cardarchitect.core.assets.CardAssetRecord;
import com.cardarchitect.core.storage.FilesystemAssetStorage;
import com.cardarchitect.formats.CardCodec;
import com.cardarchitect.formats.api.MalformedContainerException;
import com.cardarchitect.formats.api.MissingTerminalChunkException;
import com.cardarchitect.formats.card.CardDocument;
import com.cardarchitect.formats.card.ExtractedCard;
import com.cardarchitect.formats.charx.CharxBuildResult;
import com.cardarchitect.formats.charx.CharxContents;
import com.cardarchitect.formats.charx.SkippedAsset;
import com.cardarchitect.types.AssetType;
import com.cardarchitect.types.CardSpec;
import com.cardarchitect.util.Crc32;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CardExportServiceTest {

    private static final String V3_CARD = """
            {"spec":"chara_card_v3","spec_version":"3.0","data":{"name":"Aria","description":"",\
            "assets":[\
            {"type":"icon","name":"main","uri":"/storage/main.png","ext":"png"},\
            {"type":"background","name":"gone","uri":"/storage/gone.webp","ext":"webp"}\
            ]}}""";

    @TempDir
    Path root;

    private CardExportService service;

    @BeforeEach
    void setUp() {
        FilesystemAssetStorage storage = new FilesystemAssetStorage();
        storage.root = root.toString();
        AssetResolutionService resolution = new AssetResolutionService();
        resolution.storage = storage;

        service = new CardExportService();
        service.codec = new CardCodec();
        service.assetResolution = resolution;
        service.maxPngSizeMb = 4;
        service.warnPngSizeMb = 2;
    }

    @Test
    void pngExportEmbedsUnderGenerationKeyword() throws Exception {
        CardDocument card = CardDocument.parse(V3_CARD);

        PngExportResult result = service.exportPng(card, minimalPng());

        assertThat(result.spec()).isEqualTo(CardSpec.V3);
        assertThat(result.warnings()).isEmpty();
        assertThat(new String(result.png(), StandardCharsets.ISO_8859_1)).contains("ccv3\0");

        ExtractedCard extracted = service.codec.extractCard(result.png()).orElseThrow();
        assertThat(extracted.card()).isEqualTo(card);
        assertThat(extracted.spec()).isEqualTo(CardSpec.V3);
    }

    @Test
    void pngExportIntoPreviouslyImportedImageReplacesItsCard() throws Exception {
        byte[] imported = service.exportPng(CardDocument.parse(V3_CARD), minimalPng()).png();
        CardDocument v2 = CardDocument.parse("""
                {"spec":"chara_card_v2","spec_version":"2.0","data":{"name":"Downgraded","description":""}}""");

        PngExportResult result = service.exportPng(v2, imported);

        ExtractedCard extracted = service.codec.extractCard(result.png()).orElseThrow();
        assertThat(extracted.spec()).isEqualTo(CardSpec.V2);
        assertThat(extracted.card()).isEqualTo(v2);
        assertThat(new String(result.png(), StandardCharsets.ISO_8859_1)).doesNotContain("ccv3\0");
    }

    @Test
    void pngExportWarnsAboutLargeOutput() throws Exception {
        service.warnPngSizeMb = 0;

        PngExportResult result = service.exportPng(CardDocument.parse(V3_CARD), minimalPng());

        assertThat(result.warnings()).singleElement().asString().contains("is large");
    }

    @Test
    void pngExportRejectsImageWithoutIend() {
        byte[] png = minimalPng();
        byte[] truncated = Arrays.copyOf(png, png.length - 12);

        assertThatThrownBy(() -> service.exportPng(CardDocument.parse(V3_CARD), truncated))
                .isInstanceOf(MissingTerminalChunkException.class);
    }

    @Test
    void pngExportRejectsNonPng() {
        assertThatThrownBy(() -> service.exportPng(CardDocument.parse(V3_CARD), "GIF89a".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(MalformedContainerException.class);
    }

    @Test
    void charxExportPackagesStoredAssetsAndSkipsMissingOnes() throws Exception {
        Files.writeString(root.resolve("main.png"), "icon-bytes");
        CardDocument card = CardDocument.parse(V3_CARD);

        CharxBuildResult result = service.exportCharx(card, List.of(
                new CardAssetRecord(AssetType.ICON, "main", "png", 0, true, "/storage/main.png", "image/png"),
                new CardAssetRecord(AssetType.BACKGROUND, "gone", "webp", 0, false, "/storage/gone.webp", "image/webp")
        )).await().indefinitely();

        assertThat(result.assetCount()).isEqualTo(1);
        assertThat(result.entryPaths()).containsExactly("card.json", "assets/icon/png/0.png");
        assertThat(result.skipped()).singleElement()
                .extracting(SkippedAsset::reason).isEqualTo(SkippedAsset.Reason.MISSING_FILE);

        CharxContents contents = service.codec.readCharx(result.archive());
        assertThat(contents.assets()).singleElement().satisfies(a ->
                assertThat(a.bytes()).isEqualTo("icon-bytes".getBytes(StandardCharsets.UTF_8)));
        assertThat(contents.card().assets().get(0).uri()).isEqualTo("embeded://assets/icon/png/0.png");
        assertThat(contents.card().assets().get(1).uri()).isEqualTo("/storage/gone.webp");
    }

    @Test
    void jsonExportIsPrettyUtf8() {
        byte[] json = service.exportJson(CardDocument.parse(V3_CARD));

        String text = new String(json, StandardCharsets.UTF_8);
        assertThat(text).startsWith("{\n  \"spec\": \"chara_card_v3\"");
        assertThat(CardDocument.parse(text)).isEqualTo(CardDocument.parse(V3_CARD));
    }

    private static byte[] minimalPng() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(new byte[]{(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'});
        out.writeBytes(chunk("IHDR", ByteBuffer.allocate(13).putInt(1).putInt(1).put((byte) 8).array()));
        out.writeBytes(chunk("IEND", new byte[0]));
        return out.toByteArray();
    }

    private static byte[] chunk(String type, byte[] data) {
        byte[] typeBytes = type.getBytes(StandardCharsets.US_ASCII);
        return ByteBuffer.allocate(12 + data.length)
                .putInt(data.length)
                .put(typeBytes)
                .put(data)
                .putInt((int) Crc32.compute(typeBytes, data))
                .array();
    }
}
