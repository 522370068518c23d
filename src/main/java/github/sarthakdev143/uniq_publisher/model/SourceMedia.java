package github.sarthakdev143.uniq_publisher.model;

import java.nio.file.Path;

/**
 * Read-only handle to the caller's source video. Shared by every encode of a batch.
 */
public record SourceMedia(
        Path path,
        String format,
        double durationSeconds,
        int width,
        int height,
        Integer audioSampleRate,
        long sizeBytes,
        String checksum) {

    public boolean hasAudio() {
        return audioSampleRate != null && audioSampleRate > 0;
    }

    /**
     * Average bitrate of the whole file in kbit/s, or 0 when the duration is unknown.
     */
    public long averageBitrateKbps() {
        if (durationSeconds <= 0) {
            return 0;
        }
        return Math.round(sizeBytes * 8 / 1000.0 / durationSeconds);
    }
}
