package com.cardarchitect.formats.charx;

import com.cardarchitect.formats.api.MalformedContainerException;
import com.cardarchitect.formats.card.AssetDescriptor;
import com.cardarchitect.formats.card.CardDocument;
import com.cardarchitect.formats.card.CardJson;
import com.cardarchitect.formats.card.SpecDetector;
import com.cardarchitect.formats.uri.ParsedUri;
import com.cardarchitect.formats.uri.UriSchemeResolver;
import com.cardarchitect.types.AssetType;
import com.cardarchitect.types.CardSpec;
import com.cardarchitect.types.UriScheme;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads CHARX archives back into a card, its asset files and auxiliary metadata.
 */
public class CharxArchiveReader {

    private static final Logger log = Logger.getLogger(CharxArchiveReader.class);

    private static final String ASSETS_DIR = "assets/";
    private static final String MODULE_RISUM = "module.risum";
    private static final Pattern META_ENTRY = Pattern.compile("^x_meta/(\\d+)\\.json$");

    private final SpecDetector specDetector;
    private final UriSchemeResolver uris;

    public CharxArchiveReader() {
        this(new SpecDetector(), new UriSchemeResolver());
    }

    public CharxArchiveReader(SpecDetector specDetector, UriSchemeResolver uris) {
        this.specDetector = specDetector;
        this.uris = uris;
    }

    /**
     * Reads an archive held in memory.
     *
     * @throws MalformedContainerException if the bytes are not a readable ZIP, or {@code card.json}
     *                                     is missing or not a JSON object
     */
    public CharxContents read(byte[] archive) throws MalformedContainerException {
        Map<String, byte[]> files = readEntries(archive);

        byte[] cardBytes = files.get(CharxArchiveBuilder.CARD_ENTRY);
        if (cardBytes == null) {
            throw new MalformedContainerException("CHARX archive has no " + CharxArchiveBuilder.CARD_ENTRY, -1);
        }
        ObjectNode cardJson = CardJson.parseObject(new String(cardBytes, StandardCharsets.UTF_8))
                .orElseThrow(() -> new MalformedContainerException(
                        CharxArchiveBuilder.CARD_ENTRY + " is not a JSON object", -1));
        CardDocument card = CardDocument.of(cardJson);
        Optional<CardSpec> spec = specDetector.detect(cardJson);

        Map<String, AssetDescriptor> descriptorsByPath = new HashMap<>();
        for (AssetDescriptor descriptor : card.assets()) {
            ParsedUri parsed = uris.parse(descriptor.uri());
            if (parsed.scheme() == UriScheme.EMBEDED) {
                descriptorsByPath.putIfAbsent(parsed.path(), descriptor);
            }
        }

        List<CharxAsset> assets = new ArrayList<>();
        Map<Integer, ObjectNode> metadata = new TreeMap<>();
        for (Map.Entry<String, byte[]> file : files.entrySet()) {
            String path = file.getKey();
            if (path.startsWith(ASSETS_DIR)) {
                assets.add(new CharxAsset(path, file.getValue(), Optional.ofNullable(descriptorsByPath.get(path))));
                continue;
            }
            Matcher meta = META_ENTRY.matcher(path);
            if (meta.matches()) {
                OptionalInt index = metadataIndex(meta.group(1));
                Optional<ObjectNode> json = CardJson.parseObject(new String(file.getValue(), StandardCharsets.UTF_8));
                if (index.isEmpty()) {
                    log.debugf("Ignoring metadata entry %s with out-of-range index", path);
                } else if (json.isPresent()) {
                    metadata.put(index.getAsInt(), json.get());
                } else {
                    log.debugf("Ignoring unparseable metadata entry %s", path);
                }
            }
        }

        log.debugf("Read CHARX '%s': %d assets, %d metadata entries", card.name(), assets.size(), metadata.size());
        return new CharxContents(card, spec, assets, metadata, Optional.ofNullable(files.get(MODULE_RISUM)));
    }

    private static OptionalInt metadataIndex(String digits) {
        try {
            return OptionalInt.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * Checks that every {@code embeded://} descriptor resolves to an archive entry, that the card
     * has an icon, and that it is v3.
     */
    public CharxArchiveValidation validate(CharxContents contents) {
        List<String> problems = new ArrayList<>();

        if (contents.spec().filter(s -> s == CardSpec.V3).isEmpty()) {
            problems.add("CHARX card.json must be a CCv3 card");
        }

        Set<String> present = contents.assets().stream()
                .map(CharxAsset::path)
                .collect(Collectors.toSet());
        List<String> missing = new ArrayList<>();
        for (AssetDescriptor descriptor : contents.card().assets()) {
            ParsedUri parsed = uris.parse(descriptor.uri());
            if (parsed.scheme() == UriScheme.EMBEDED && !present.contains(parsed.path())) {
                missing.add(descriptor.uri());
            }
        }
        if (!missing.isEmpty()) {
            problems.add("Missing " + missing.size() + " embedded asset(s): " + String.join(", ", missing));
        }

        // The first icon stands in when none is named "main".
        boolean hasMainIcon = contents.card().assets().stream()
                .anyMatch(d -> d.type() == AssetType.ICON);
        if (!hasMainIcon) {
            problems.add("CHARX has no main icon asset");
        }

        long totalSize = contents.assets().stream().mapToLong(a -> a.bytes().length).sum();

        return new CharxArchiveValidation(problems.isEmpty(), problems, hasMainIcon,
                contents.assets().size(), totalSize, missing);
    }

    private static Map<String, byte[]> readEntries(byte[] archive) throws MalformedContainerException {
        Map<String, byte[]> files = new LinkedHashMap<>();
        try (ZipFile zipFile = ZipFile.builder()
                .setSeekableByteChannel(new SeekableInMemoryByteChannel(archive))
                .get()) {
            Enumeration<ZipArchiveEntry> entries = zipFile.getEntriesInPhysicalOrder();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                if (entry.isDirectory()) {
                    continue;
                }
                String name = entry.getName().replace('\\', '/');
                try (InputStream in = zipFile.getInputStream(entry)) {
                    files.put(name, in.readAllBytes());
                }
            }
        } catch (IOException e) {
            throw new MalformedContainerException("Not a readable CHARX archive: " + e.getMessage(), e);
        }
        return files;
    }
}
