package com.eainde.labaudit.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FileSnapshotAuditCacheTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @Test
        @DisplayName("entries survive a restart")
        void survivesRestart() {
            Path file = tempDir.resolve("cache.json");
            FileSnapshotAuditCache first = new FileSnapshotAuditCache(file, objectMapper);
            first.put("vision_a", "description");
            first.put("audit_a_b", "{\"summary\":\"ok\"}");

            FileSnapshotAuditCache restarted = new FileSnapshotAuditCache(file, objectMapper);

            assertThat(restarted.size()).isEqualTo(2);
            assertThat(restarted.get("vision_a")).contains("description");
            assertThat(restarted.get("audit_a_b")).contains("{\"summary\":\"ok\"}");
        }

        @Test
        @DisplayName("snapshot is a flat JSON object and leaves no temp file behind")
        void writesFlatJsonObject() throws Exception {
            Path file = tempDir.resolve("cache.json");
            FileSnapshotAuditCache cache = new FileSnapshotAuditCache(file, objectMapper);
            cache.put("z_key", "last");
            cache.put("a_key", "first");

            Map<String, String> snapshot = objectMapper.readValue(file.toFile(), new TypeReference<Map<String, String>>() {});

            assertThat(snapshot).containsExactlyInAnyOrderEntriesOf(Map.of("a_key", "first", "z_key", "last"));
            assertThat(tempDir.resolve("cache.json.tmp")).doesNotExist();
        }

        @Test
        @DisplayName("invalidate removes the entry from the file as well")
        void invalidatePersists() {
            Path file = tempDir.resolve("cache.json");
            FileSnapshotAuditCache cache = new FileSnapshotAuditCache(file, objectMapper);
            cache.put("vision_a", "description");
            cache.invalidate("vision_a");

            assertThat(new FileSnapshotAuditCache(file, objectMapper).get("vision_a")).isEmpty();
        }

        @Test
        @DisplayName("creates missing parent directories")
        void createsParentDirectories() {
            Path file = tempDir.resolve("nested/dir/cache.json");
            new FileSnapshotAuditCache(file, objectMapper).put("k", "v");

            assertThat(file).exists();
        }
    }

    @Nested
    @DisplayName("Damaged snapshots")
    class DamagedSnapshots {

        @Test
        @DisplayName("missing file starts empty")
        void missingFileStartsEmpty() {
            FileSnapshotAuditCache cache = new FileSnapshotAuditCache(tempDir.resolve("absent.json"), objectMapper);

            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("corrupt file starts empty and is replaced on the next write")
        void corruptFileStartsEmpty() throws Exception {
            Path file = tempDir.resolve("cache.json");
            Files.writeString(file, "{not valid json", StandardCharsets.UTF_8);

            FileSnapshotAuditCache cache = new FileSnapshotAuditCache(file, objectMapper);
            assertThat(cache.size()).isZero();

            cache.put("vision_a", "description");
            assertThat(new FileSnapshotAuditCache(file, objectMapper).get("vision_a")).contains("description");
        }
    }
}
