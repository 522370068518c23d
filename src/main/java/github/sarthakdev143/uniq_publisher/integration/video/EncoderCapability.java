package github.sarthakdev143.uniq_publisher.integration.video;

import github.sarthakdev143.uniq_publisher.config.UniqPublisherProperties;
import github.sarthakdev143.uniq_publisher.exception.NoEncoderAvailableException;
import github.sarthakdev143.uniq_publisher.model.EncoderBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Semaphore;

/**
 * Knows which ffmpeg video encoder this host can use and guards access to it.
 *
 * <p>The encoder list is probed once, on first use, and the outcome (including a failed probe) is kept
 * for the lifetime of the process. Every encode runs inside {@link #withSession}, which limits how
 * many encoder sessions are open at the same time.
 */
@Component
public class EncoderCapability {

    private static final Logger logger = LoggerFactory.getLogger(EncoderCapability.class);

    private final FfmpegCommandRunner commandRunner;
    private final UniqPublisherProperties.Encoder settings;
    private final Semaphore sessions;
    private final Object probeLock = new Object();
    private volatile ProbeOutcome outcome;

    public EncoderCapability(FfmpegCommandRunner commandRunner, UniqPublisherProperties properties) {
        this.commandRunner = commandRunner;
        this.settings = properties.getEncoder();
        if (settings.getMaxConcurrentSessions() < 1) {
            throw new IllegalArgumentException("uniq-publisher.encoder.max-concurrent-sessions must be at least 1.");
        }
        this.sessions = new Semaphore(settings.getMaxConcurrentSessions(), true);
    }

    /**
     * Backend every encode of this process uses.
     *
     * @throws NoEncoderAvailableException when the probe failed or found no acceptable encoder
     */
    public EncoderBackend backend() {
        ProbeOutcome probed = probe();
        if (probed.backend() == null) {
            throw new NoEncoderAvailableException(probed.failure());
        }
        return probed.backend();
    }

    /**
     * Whether libx264 can take over after a hardware encode failed.
     */
    public boolean softwareFallbackAvailable() {
        return probe().encoders().contains(EncoderBackend.SOFTWARE.encoderName());
    }

    public <T> T withSession(SessionWork<T> work) throws IOException, InterruptedException {
        sessions.acquire();
        try {
            return work.run();
        } finally {
            sessions.release();
        }
    }

    List<String> buildProbeCommand() {
        return List.of(settings.getFfmpegPath(), "-hide_banner", "-encoders");
    }

    private ProbeOutcome probe() {
        ProbeOutcome current = outcome;
        if (current != null) {
            return current;
        }

        synchronized (probeLock) {
            if (outcome == null) {
                outcome = runProbe();
            }
            return outcome;
        }
    }

    private ProbeOutcome runProbe() {
        CommandResult result;
        try {
            result = commandRunner.run(buildProbeCommand(), settings.getProbeTimeout(), "probe encoders");
        } catch (IOException e) {
            logger.error("Encoder probe could not start ffmpeg at {}", settings.getFfmpegPath(), e);
            return ProbeOutcome.failed("Encoder probe failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NoEncoderAvailableException("Encoder probe was interrupted.", e);
        }

        if (!result.isSuccess()) {
            String reason = result.timedOut()
                    ? "Encoder probe timed out."
                    : "Encoder probe exited with code " + result.exitCode() + ". " + result.errorTail();
            logger.error(reason);
            return ProbeOutcome.failed(reason);
        }

        Set<String> encoders = parseEncoderNames(result.output());
        List<EncoderBackend> candidates = new ArrayList<>(settings.getPreference());
        if (settings.isAllowSoftwareFallback() && !candidates.contains(EncoderBackend.SOFTWARE)) {
            candidates.add(EncoderBackend.SOFTWARE);
        }

        for (EncoderBackend candidate : candidates) {
            if (candidate == EncoderBackend.SOFTWARE && !settings.isAllowSoftwareFallback()) {
                continue;
            }
            if (encoders.contains(candidate.encoderName())) {
                logger.info("Selected encoder backend {} ({})", candidate, candidate.encoderName());
                return new ProbeOutcome(candidate, encoders, null);
            }
        }

        String reason = "No usable video encoder found. Tried " + candidates
                + (settings.isAllowSoftwareFallback() ? "." : "; software fallback is disabled.");
        logger.error(reason);
        return new ProbeOutcome(null, encoders, reason);
    }

    static Set<String> parseEncoderNames(String output) {
        Set<String> names = new HashSet<>();
        if (output == null) {
            return names;
        }
        for (String line : output.split("\\R")) {
            String[] tokens = line.trim().split("\\s+");
            // " V....D h264_nvenc   NVIDIA NVENC H.264 encoder"
            if (tokens.length >= 2 && tokens[0].length() == 6 && tokens[0].charAt(0) == 'V') {
                names.add(tokens[1]);
            }
        }
        return names;
    }

    @FunctionalInterface
    public interface SessionWork<T> {
        T run() throws IOException, InterruptedException;
    }

    private record ProbeOutcome(EncoderBackend backend, Set<String> encoders, String failure) {

        private ProbeOutcome {
            encoders = Collections.unmodifiableSet(encoders);
        }

        static ProbeOutcome failed(String failure) {
            return new ProbeOutcome(null, Set.of(), failure);
        }
    }
}
