package github.sarthakdev143.uniq_publisher.config;

import github.sarthakdev143.uniq_publisher.model.EncoderBackend;
import github.sarthakdev143.uniq_publisher.transform.KnobRange;
import github.sarthakdev143.uniq_publisher.transform.TransformBounds;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for encoding, transform ranges, publishing and storage, bound from {@code uniq-publisher.*}.
 */
@ConfigurationProperties(prefix = "uniq-publisher")
public class UniqPublisherProperties {

    private Encoder encoder = new Encoder();
    private Transform transform = new Transform();
    private Publish publish = new Publish();
    private Smmbox smmbox = new Smmbox();
    private Storage storage = new Storage();
    private Schedule schedule = new Schedule();
    private Batch batch = new Batch();

    public Encoder getEncoder() {
        return encoder;
    }

    public void setEncoder(Encoder encoder) {
        this.encoder = encoder;
    }

    public Transform getTransform() {
        return transform;
    }

    public void setTransform(Transform transform) {
        this.transform = transform;
    }

    public Publish getPublish() {
        return publish;
    }

    public void setPublish(Publish publish) {
        this.publish = publish;
    }

    public Smmbox getSmmbox() {
        return smmbox;
    }

    public void setSmmbox(Smmbox smmbox) {
        this.smmbox = smmbox;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public static class Encoder {
        private String ffmpegPath = "ffmpeg";
        private String ffprobePath = "ffprobe";
        private List<EncoderBackend> preference = new ArrayList<>(List.of(
                EncoderBackend.NVENC,
                EncoderBackend.QSV,
                EncoderBackend.AMF,
                EncoderBackend.VIDEOTOOLBOX));
        private boolean allowSoftwareFallback = false;
        private int maxConcurrentSessions = 1;
        private Duration timeout = Duration.ofMinutes(10);
        private Duration probeTimeout = Duration.ofSeconds(30);
        private double durationToleranceSeconds = 0.5;

        public String getFfmpegPath() {
            return ffmpegPath;
        }

        public void setFfmpegPath(String ffmpegPath) {
            this.ffmpegPath = ffmpegPath;
        }

        public String getFfprobePath() {
            return ffprobePath;
        }

        public void setFfprobePath(String ffprobePath) {
            this.ffprobePath = ffprobePath;
        }

        public List<EncoderBackend> getPreference() {
            return preference;
        }

        public void setPreference(List<EncoderBackend> preference) {
            this.preference = preference;
        }

        public boolean isAllowSoftwareFallback() {
            return allowSoftwareFallback;
        }

        public void setAllowSoftwareFallback(boolean allowSoftwareFallback) {
            this.allowSoftwareFallback = allowSoftwareFallback;
        }

        public int getMaxConcurrentSessions() {
            return maxConcurrentSessions;
        }

        public void setMaxConcurrentSessions(int maxConcurrentSessions) {
            this.maxConcurrentSessions = maxConcurrentSessions;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getProbeTimeout() {
            return probeTimeout;
        }

        public void setProbeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
        }

        public double getDurationToleranceSeconds() {
            return durationToleranceSeconds;
        }

        public void setDurationToleranceSeconds(double durationToleranceSeconds) {
            this.durationToleranceSeconds = durationToleranceSeconds;
        }
    }

    public static class Transform {
        private Range cropPx = new Range(0, 4);
        private Range scaleDelta = new Range(-0.01, 0.01);
        private Range hueShiftDeg = new Range(-2, 2);
        private Range noiseLevel = new Range(1, 3);
        private Range speedFactor = new Range(0.98, 1.02);
        private Range audioPitchSemitones = new Range(-0.3, 0.3);
        private Range brightness = new Range(-0.03, 0.03);
        private Range contrast = new Range(0.98, 1.02);
        private Range saturation = new Range(0.98, 1.02);
        private Range gamma = new Range(0.98, 1.02);
        private Range bitrateFactor = new Range(0.95, 1.05);

        /**
         * Converts the bound ranges to {@link TransformBounds}, rejecting inverted or out-of-domain ranges.
         */
        public TransformBounds toBounds() {
            return new TransformBounds(
                    cropPx.toKnobRange("crop-px"),
                    scaleDelta.toKnobRange("scale-delta"),
                    hueShiftDeg.toKnobRange("hue-shift-deg"),
                    noiseLevel.toKnobRange("noise-level"),
                    speedFactor.toKnobRange("speed-factor"),
                    audioPitchSemitones.toKnobRange("audio-pitch-semitones"),
                    brightness.toKnobRange("brightness"),
                    contrast.toKnobRange("contrast"),
                    saturation.toKnobRange("saturation"),
                    gamma.toKnobRange("gamma"),
                    bitrateFactor.toKnobRange("bitrate-factor"));
        }

        public Range getCropPx() {
            return cropPx;
        }

        public void setCropPx(Range cropPx) {
            this.cropPx = cropPx;
        }

        public Range getScaleDelta() {
            return scaleDelta;
        }

        public void setScaleDelta(Range scaleDelta) {
            this.scaleDelta = scaleDelta;
        }

        public Range getHueShiftDeg() {
            return hueShiftDeg;
        }

        public void setHueShiftDeg(Range hueShiftDeg) {
            this.hueShiftDeg = hueShiftDeg;
        }

        public Range getNoiseLevel() {
            return noiseLevel;
        }

        public void setNoiseLevel(Range noiseLevel) {
            this.noiseLevel = noiseLevel;
        }

        public Range getSpeedFactor() {
            return speedFactor;
        }

        public void setSpeedFactor(Range speedFactor) {
            this.speedFactor = speedFactor;
        }

        public Range getAudioPitchSemitones() {
            return audioPitchSemitones;
        }

        public void setAudioPitchSemitones(Range audioPitchSemitones) {
            this.audioPitchSemitones = audioPitchSemitones;
        }

        public Range getBrightness() {
            return brightness;
        }

        public void setBrightness(Range brightness) {
            this.brightness = brightness;
        }

        public Range getContrast() {
            return contrast;
        }

        public void setContrast(Range contrast) {
            this.contrast = contrast;
        }

        public Range getSaturation() {
            return saturation;
        }

        public void setSaturation(Range saturation) {
            this.saturation = saturation;
        }

        public Range getGamma() {
            return gamma;
        }

        public void setGamma(Range gamma) {
            this.gamma = gamma;
        }

        public Range getBitrateFactor() {
            return bitrateFactor;
        }

        public void setBitrateFactor(Range bitrateFactor) {
            this.bitrateFactor = bitrateFactor;
        }
    }

    public static class Range {
        private double min;
        private double max;

        public Range() {
        }

        public Range(double min, double max) {
            this.min = min;
            this.max = max;
        }

        KnobRange toKnobRange(String knob) {
            try {
                return new KnobRange(min, max);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid uniq-publisher.transform." + knob + ": " + e.getMessage(), e);
            }
        }

        public double getMin() {
            return min;
        }

        public void setMin(double min) {
            this.min = min;
        }

        public double getMax() {
            return max;
        }

        public void setMax(double max) {
            this.max = max;
        }
    }

    public static class Publish {
        private int maxConcurrency = 4;
        private int maxAttempts = 3;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);

        /**
         * Delay before the given retry, where {@code retry} 1 is the first resend.
         */
        public Duration backoffFor(int retry) {
            double factor = Math.pow(backoffMultiplier, Math.max(0, retry - 1));
            long millis = (long) Math.min(initialBackoff.toMillis() * factor, (double) maxBackoff.toMillis());
            return Duration.ofMillis(millis);
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static class Smmbox {
        private String apiUrl = "https://smmbox.com/api/";
        private String apiToken;

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getApiToken() {
            return apiToken;
        }

        public void setApiToken(String apiToken) {
            this.apiToken = apiToken;
        }
    }

    public static class Storage {
        private Path baseDir = Path.of("storage");
        private String publicBaseUrl = "http://localhost:8080/media/";

        public Path getBaseDir() {
            return baseDir;
        }

        public void setBaseDir(Path baseDir) {
            this.baseDir = baseDir;
        }

        public String getPublicBaseUrl() {
            return publicBaseUrl;
        }

        public void setPublicBaseUrl(String publicBaseUrl) {
            this.publicBaseUrl = publicBaseUrl;
        }
    }

    public static class Schedule {
        private String zone = "Europe/Moscow";

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class Batch {
        private int executorThreads = 2;
        private int executorQueueCapacity = 20;
        private int maxCaptionLength = 5000;
        private Duration statusRetention = Duration.ofHours(24);

        public int getExecutorThreads() {
            return executorThreads;
        }

        public void setExecutorThreads(int executorThreads) {
            this.executorThreads = executorThreads;
        }

        public int getExecutorQueueCapacity() {
            return executorQueueCapacity;
        }

        public void setExecutorQueueCapacity(int executorQueueCapacity) {
            this.executorQueueCapacity = executorQueueCapacity;
        }

        public int getMaxCaptionLength() {
            return maxCaptionLength;
        }

        public void setMaxCaptionLength(int maxCaptionLength) {
            this.maxCaptionLength = maxCaptionLength;
        }

        public Duration getStatusRetention() {
            return statusRetention;
        }

        public void setStatusRetention(Duration statusRetention) {
            this.statusRetention = statusRetention;
        }
    }
}
