package github.sarthakdev143.uniq_publisher.storage;

import github.sarthakdev143.uniq_publisher.config.UniqPublisherProperties;
import github.sarthakdev143.uniq_publisher.model.StoredMedia;
import github.sarthakdev143.uniq_publisher.model.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Copies variants under a base directory that a web server exposes at {@code public-base-url}.
 */
@Component
public class LocalVariantStorage implements VariantStorage {

    private static final Logger logger = LoggerFactory.getLogger(LocalVariantStorage.class);
    private static final int CHECKSUM_PREFIX_LENGTH = 12;

    private final Path baseDir;
    private final String publicBaseUrl;

    public LocalVariantStorage(UniqPublisherProperties properties) {
        this.baseDir = properties.getStorage().getBaseDir().toAbsolutePath().normalize();
        String baseUrl = properties.getStorage().getPublicBaseUrl();
        this.publicBaseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }

    @Override
    public StoredMedia store(String batchId, Variant variant) throws IOException {
        String objectKey = objectKey(batchId, variant);
        Path target = safeResolve(objectKey);
        Files.createDirectories(target.getParent());
        Files.copy(variant.file(), target, REPLACE_EXISTING);
        logger.info("Stored variant account={} key={}", variant.target().key(), objectKey);
        return new StoredMedia(objectKey, publicBaseUrl + objectKey);
    }

    String objectKey(String batchId, Variant variant) {
        String checksum = variant.checksum();
        String checksumPrefix = checksum.length() > CHECKSUM_PREFIX_LENGTH
                ? checksum.substring(0, CHECKSUM_PREFIX_LENGTH)
                : checksum;
        return sanitize(batchId) + "/"
                + variant.target().platform().code() + "_"
                + sanitize(variant.target().accountId()) + "_"
                + checksumPrefix + ".mp4";
    }

    Path safeResolve(String objectKey) throws IOException {
        Path resolved = baseDir.resolve(objectKey).normalize();
        if (!resolved.startsWith(baseDir)) {
            throw new IOException("Invalid object key (path traversal?): " + objectKey);
        }
        return resolved;
    }

    private String sanitize(String value) {
        return value.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
