package github.sarthakdev143.uniq_publisher.model;

public record MediaInfo(
        String format,
        double durationSeconds,
        int width,
        int height,
        Integer audioSampleRate) {
}
