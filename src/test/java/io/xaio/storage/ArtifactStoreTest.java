package io.xaio.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.xaio.config.XaioConfig;
import io.xaio.model.ArtifactRef;
import io.xaio.model.Stage;
import io.xaio.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class ArtifactStoreTest {

    @Test
    void identicalDocumentsShareOneBlob() throws Exception {
        Path root = Files.createTempDirectory("xaio-test-artifacts-dedup-");
        try {
            ArtifactStore store = new ArtifactStore(XaioConfig.fromRoot(root.toString()));
            ObjectNode a = Jsons.object().put("title", "x").put("n", 1);
            ObjectNode b = Jsons.object().put("n", 1).put("title", "x");

            ArtifactRef first = store.put(a);
            ArtifactRef second = store.put(b);
            Assertions.assertTrue(first.created());
            Assertions.assertFalse(second.created());
            Assertions.assertEquals(first.hash(), second.hash());
            Assertions.assertEquals(1L, store.writes());
            Assertions.assertEquals(a, store.get(first.hash()));
            Assertions.assertTrue(first.blobPath().startsWith(root.resolve("artifacts").resolve("blobs")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tamperedOrMissingBlobIsInfrastructureError() throws Exception {
        Path root = Files.createTempDirectory("xaio-test-artifacts-verify-");
        try {
            ArtifactStore store = new ArtifactStore(XaioConfig.fromRoot(root.toString()));
            ArtifactRef ref = store.put(Jsons.object().put("k", "v"));
            Files.writeString(ref.blobPath(), "{\"k\":\"w\"}", StandardCharsets.UTF_8);
            Assertions.assertThrows(InfrastructureException.class, () -> store.get(ref.hash()));
            Assertions.assertThrows(InfrastructureException.class, () -> store.get("0".repeat(64)));
            Assertions.assertThrows(IllegalArgumentException.class, () -> store.blobPath("../../etc/passwd"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void viewIsRewrittenOnlyWhenContentChanges() throws Exception {
        Path root = Files.createTempDirectory("xaio-test-artifacts-view-");
        try {
            ArtifactStore store = new ArtifactStore(XaioConfig.fromRoot(root.toString()));
            ArtifactRef v1 = store.put(Jsons.object().put("rev", 1));
            ArtifactRef v2 = store.put(Jsons.object().put("rev", 2));

            Assertions.assertTrue(store.writeView(Stage.META, "abc", v1.hash()));
            Assertions.assertFalse(store.writeView(Stage.META, "abc", v1.hash()));
            Assertions.assertTrue(store.writeView(Stage.META, "abc", v2.hash()));

            Path view = store.viewPath(Stage.META, "abc");
            Assertions.assertEquals(root.resolve("artifacts").resolve("meta").resolve("abc.meta.json"), view);
            JsonNode shown = Jsons.parse(Files.readAllBytes(view));
            Assertions.assertEquals(2, shown.path("rev").asInt());
            Assertions.assertEquals(4L, store.writes());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
