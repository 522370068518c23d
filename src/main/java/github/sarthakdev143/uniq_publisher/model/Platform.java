package github.sarthakdev143.uniq_publisher.model;

import java.util.Locale;

/**
 * Social networks reachable through the publishing provider, keyed by the provider's social code.
 */
public enum Platform {
    VK("vk"),
    INSTAGRAM("io"),
    YOUTUBE("gg"),
    PINTEREST("pi");

    private final String code;

    Platform(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Platform fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("platform is required.");
        }

        String normalized = input.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform.code.equals(normalized) || platform.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("platform must be one of vk, io, gg, pi.");
    }
}
