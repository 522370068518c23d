package github.sarthakdev143.uniq_publisher.integration.video;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs ffmpeg and ffprobe. Both streams go to temp files so a chatty process never blocks on a full
 * pipe while we wait for it.
 */
@Component
public class FfmpegCommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegCommandRunner.class);

    public CommandResult run(List<String> command, Duration timeout, String stage)
            throws IOException, InterruptedException {
        logger.info("Running FFmpeg command for stage {}: {}", stage, String.join(" ", command));
        Path stdout = Files.createTempFile("uniq-publisher-stdout-", ".log");
        Path stderr = Files.createTempFile("uniq-publisher-stderr-", ".log");

        try {
            Process process = new ProcessBuilder(command)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile())
                    .start();

            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }

            if (!finished) {
                process.destroyForcibly();
                logger.warn("FFmpeg timed out during stage {} after {}", stage, timeout);
                return new CommandResult(-1, read(stdout), read(stderr), true);
            }
            return new CommandResult(process.exitValue(), read(stdout), read(stderr), false);
        } finally {
            deleteIfExists(stdout);
            deleteIfExists(stderr);
        }
    }

    private String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
