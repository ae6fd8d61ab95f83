package io.xaio.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.xaio.config.XaioConfig;
import io.xaio.model.ArtifactRef;
import io.xaio.model.Stage;
import io.xaio.util.CanonicalJson;
import io.xaio.util.Hashing;
import io.xaio.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Content-addressed JSON blobs under {@code artifacts/blobs/<hh>/<hash>.json}. Blobs are written once through a
 * temp file and an atomic rename, so concurrent writers of the same content need no lock.
 */
public final class ArtifactStore {
    private static final Logger LOG = LoggerFactory.getLogger(ArtifactStore.class);
    private static final Pattern HASH = Pattern.compile("[0-9a-f]{64}");

    private final XaioConfig config;
    private final AtomicLong writes = new AtomicLong();

    public ArtifactStore(XaioConfig config) {
        this.config = config;
    }

    public ArtifactRef put(JsonNode document) {
        if (document == null || document.isMissingNode()) {
            throw new IllegalArgumentException("artifact document must not be null");
        }
        byte[] bytes = CanonicalJson.bytes(document);
        String hash = Hashing.sha256Hex(bytes);
        Path blob = blobPath(hash);
        if (Files.isRegularFile(blob)) {
            return new ArtifactRef(hash, bytes.length, blob, false);
        }
        try {
            writeAtomically(blob, bytes);
        } catch (IOException e) {
            throw new InfrastructureException("Failed to write artifact " + hash, e);
        }
        writes.incrementAndGet();
        LOG.debug("stored artifact {} ({} bytes)", hash, bytes.length);
        return new ArtifactRef(hash, bytes.length, blob, true);
    }

    public JsonNode get(String hash) {
        Path blob = blobPath(hash);
        if (!Files.isRegularFile(blob)) {
            throw new InfrastructureException("Artifact not found: " + hash);
        }
        try {
            byte[] raw = Files.readAllBytes(blob);
            String actual = Hashing.sha256Hex(raw);
            if (!actual.equals(hash)) {
                throw new InfrastructureException("Artifact content does not match its hash: " + hash);
            }
            return Jsons.parse(raw);
        } catch (IOException e) {
            throw new InfrastructureException("Failed to read artifact " + hash, e);
        }
    }

    public boolean exists(String hash) {
        return Files.isRegularFile(blobPath(hash));
    }

    public Path blobPath(String hash) {
        if (hash == null || !HASH.matcher(hash).matches()) {
            throw new IllegalArgumentException("Invalid artifact hash: " + hash);
        }
        return config.blobRoot().resolve(hash.substring(0, 2)).resolve(hash + ".json");
    }

    public Path viewPath(Stage stage, String itemId) {
        return config.stageViewDir(stage).resolve(itemId + "." + stage.wireName() + ".json");
    }

    /**
     * Refreshes the human-readable copy of an item's stage output. The file is left alone when its bytes
     * already match.
     */
    public boolean writeView(Stage stage, String itemId, String hash) {
        Path view = viewPath(stage, itemId);
        byte[] pretty = (Jsons.toJson(get(hash)) + "\n").getBytes(StandardCharsets.UTF_8);
        try {
            if (Files.isRegularFile(view) && Arrays.equals(Files.readAllBytes(view), pretty)) {
                return false;
            }
            writeAtomically(view, pretty);
        } catch (IOException e) {
            throw new InfrastructureException("Failed to write artifact view " + view, e);
        }
        writes.incrementAndGet();
        return true;
    }

    /**
     * Number of files this instance has written since it was created.
     */
    public long writes() {
        return writes.get();
    }

    private static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), ".tmp-", ".json");
        try {
            Files.write(tmp, bytes);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
