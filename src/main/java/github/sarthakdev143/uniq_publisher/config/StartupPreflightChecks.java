package github.sarthakdev143.uniq_publisher.config;

import github.sarthakdev143.uniq_publisher.integration.video.CommandResult;
import github.sarthakdev143.uniq_publisher.integration.video.EncoderCapability;
import github.sarthakdev143.uniq_publisher.integration.video.FfmpegCommandRunner;
import github.sarthakdev143.uniq_publisher.model.EncoderBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@ConditionalOnProperty(name = "uniq-publisher.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final Duration CHECK_TIMEOUT = Duration.ofSeconds(10);

    private final FfmpegCommandRunner commandRunner;
    private final EncoderCapability encoderCapability;
    private final UniqPublisherProperties properties;

    public StartupPreflightChecks(
            FfmpegCommandRunner commandRunner,
            EncoderCapability encoderCapability,
            UniqPublisherProperties properties) {
        this.commandRunner = commandRunner;
        this.encoderCapability = encoderCapability;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkBinary(properties.getEncoder().getFfmpegPath(), "FFmpeg", "FFMPEG_PATH");
        checkBinary(properties.getEncoder().getFfprobePath(), "FFprobe", "FFPROBE_PATH");
        checkEncoderBackend();
        checkSmmboxConfiguration();
    }

    private void checkBinary(String binary, String label, String envName) {
        try {
            CommandResult result = commandRunner.run(List.of(binary, "-version"), CHECK_TIMEOUT, label + " version check");
            if (!result.isSuccess()) {
                throw new IllegalStateException(
                        label + " is not usable at " + binary + ". Install it or set " + envName + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    label + " is not available at " + binary + ". Install it or set " + envName + ".",
                    e);
        }
    }

    private void checkEncoderBackend() {
        EncoderBackend backend = encoderCapability.backend();
        logger.info(
                "Encoder backend {} ({}), hardware={}",
                backend,
                backend.encoderName(),
                backend.isHardwareAccelerated());
    }

    private void checkSmmboxConfiguration() {
        String token = properties.getSmmbox().getApiToken();
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("SmmBox API token is not set. Set SMMBOX_API_TOKEN.");
        }
        logger.info("SmmBox API {} token={}", properties.getSmmbox().getApiUrl(), mask(token));
    }

    static String mask(String token) {
        String trimmed = token.strip();
        if (trimmed.length() <= 8) {
            return "****";
        }
        return trimmed.substring(0, 4) + "****" + trimmed.substring(trimmed.length() - 2);
    }
}
