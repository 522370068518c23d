package github.sarthakdev143.uniq_publisher.storage;

import github.sarthakdev143.uniq_publisher.config.UniqPublisherProperties;
import github.sarthakdev143.uniq_publisher.model.AccountTarget;
import github.sarthakdev143.uniq_publisher.model.AccountType;
import github.sarthakdev143.uniq_publisher.model.EncoderBackend;
import github.sarthakdev143.uniq_publisher.model.Platform;
import github.sarthakdev143.uniq_publisher.model.StoredMedia;
import github.sarthakdev143.uniq_publisher.model.TransformSpec;
import github.sarthakdev143.uniq_publisher.model.Variant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalVariantStorageTest {

    @TempDir
    Path tempDir;

    private LocalVariantStorage storage;

    @BeforeEach
    void setUp() {
        UniqPublisherProperties properties = new UniqPublisherProperties();
        properties.getStorage().setBaseDir(tempDir.resolve("public"));
        properties.getStorage().setPublicBaseUrl("https://cdn.test/media");
        storage = new LocalVariantStorage(properties);
    }

    @Test
    void storeCopiesVariantAndBuildsPublicUrl() throws Exception {
        Path file = tempDir.resolve("work.mp4");
        Files.writeString(file, "encoded");

        StoredMedia stored = storage.store("batch-1", variant(file, "club/42"));

        assertThat(stored.handle()).isEqualTo("batch-1/vk_club_42_0123456789ab.mp4");
        assertThat(stored.url()).isEqualTo("https://cdn.test/media/batch-1/vk_club_42_0123456789ab.mp4");
        assertThat(tempDir.resolve("public").resolve(stored.handle())).hasContent("encoded");
        assertThat(file).exists();
    }

    @Test
    void safeResolveRejectsKeysOutsideBaseDir() {
        assertThatThrownBy(() -> storage.safeResolve("../escape.mp4"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("path traversal");
    }

    @Test
    void storeFailsWhenVariantFileIsGone() {
        assertThatThrownBy(() -> storage.store("batch-1", variant(tempDir.resolve("missing.mp4"), "42")))
                .isInstanceOf(IOException.class);
    }

    private Variant variant(Path file, String accountId) {
        return new Variant(
                new AccountTarget(accountId, Platform.VK, AccountType.GROUP),
                file,
                new TransformSpec(1L, "vk:" + accountId, 0, 0, 0, 1, 1, 0, 0, 1, 1, 1, 1),
                EncoderBackend.NVENC,
                7,
                "0123456789abcdef0123456789abcdef");
    }
}
