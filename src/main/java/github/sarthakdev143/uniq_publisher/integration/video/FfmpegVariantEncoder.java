package github.sarthakdev143.uniq_publisher.integration.video;

import github.sarthakdev143.uniq_publisher.config.UniqPublisherProperties;
import github.sarthakdev143.uniq_publisher.exception.EncodeException;
import github.sarthakdev143.uniq_publisher.exception.EncodeProcessFailedException;
import github.sarthakdev143.uniq_publisher.exception.OutputValidationFailedException;
import github.sarthakdev143.uniq_publisher.model.AccountTarget;
import github.sarthakdev143.uniq_publisher.model.EncoderBackend;
import github.sarthakdev143.uniq_publisher.model.MediaInfo;
import github.sarthakdev143.uniq_publisher.model.SourceMedia;
import github.sarthakdev143.uniq_publisher.model.TransformSpec;
import github.sarthakdev143.uniq_publisher.model.Variant;
import github.sarthakdev143.uniq_publisher.service.MediaProbe;
import github.sarthakdev143.uniq_publisher.service.VariantEncoder;
import github.sarthakdev143.uniq_publisher.transform.TransformBounds;
import github.sarthakdev143.uniq_publisher.util.Checksums;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class FfmpegVariantEncoder implements VariantEncoder {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegVariantEncoder.class);
    private static final long MIN_BITRATE_KBPS = 1000;
    private static final double MIN_ATEMPO = 0.5;
    private static final double MAX_ATEMPO = 2.0;
    private static final double EPSILON = 1e-9;

    private final EncoderCapability capability;
    private final FfmpegCommandRunner commandRunner;
    private final MediaProbe mediaProbe;
    private final TransformBounds bounds;
    private final UniqPublisherProperties.Encoder settings;

    public FfmpegVariantEncoder(
            EncoderCapability capability,
            FfmpegCommandRunner commandRunner,
            MediaProbe mediaProbe,
            TransformBounds bounds,
            UniqPublisherProperties properties) {
        this.capability = capability;
        this.commandRunner = commandRunner;
        this.mediaProbe = mediaProbe;
        this.bounds = bounds;
        this.settings = properties.getEncoder();
    }

    @Override
    public Variant encode(
            SourceMedia source,
            TransformSpec spec,
            AccountTarget target,
            EncoderBackend backend,
            Path output) throws EncodeException, InterruptedException {
        bounds.verify(spec);

        List<String> command = buildEncodeCommand(source, spec, backend, output);
        String stage = "encode " + target.key() + " on " + backend;
        CommandResult result;
        try {
            result = capability.withSession(() -> commandRunner.run(command, settings.getTimeout(), stage));
        } catch (IOException e) {
            deleteIfExists(output);
            throw new EncodeProcessFailedException(backend, "FFmpeg could not be started for " + stage, e);
        }

        if (result.timedOut()) {
            deleteIfExists(output);
            throw new EncodeProcessFailedException(
                    backend,
                    "FFmpeg timed out after " + settings.getTimeout() + " during " + stage);
        }
        if (result.exitCode() != 0) {
            deleteIfExists(output);
            throw new EncodeProcessFailedException(
                    backend,
                    "FFmpeg failed during " + stage + " with exit code " + result.exitCode() + ". Output: "
                            + result.errorTail());
        }

        try {
            return validateOutput(source, spec, target, backend, output);
        } catch (OutputValidationFailedException e) {
            deleteIfExists(output);
            throw e;
        }
    }

    List<String> buildEncodeCommand(SourceMedia source, TransformSpec spec, EncoderBackend backend, Path output) {
        List<String> command = new ArrayList<>();
        command.add(settings.getFfmpegPath());
        command.add("-hide_banner");
        command.add("-y");
        command.add("-i");
        command.add(source.path().toString());
        command.add("-map");
        command.add("0:v:0");
        if (source.hasAudio()) {
            command.add("-map");
            command.add("0:a:0");
        }
        command.add("-vf");
        command.add(buildVideoFilter(source, spec));
        if (source.hasAudio()) {
            command.add("-af");
            command.add(buildAudioFilter(source, spec));
        }
        command.add("-c:v");
        command.add(backend.encoderName());
        command.addAll(backend.rateControlArguments(targetBitrateKbps(source, spec)));
        command.add("-pix_fmt");
        command.add("yuv420p");
        if (source.hasAudio()) {
            command.add("-c:a");
            command.add("aac");
            command.add("-b:a");
            command.add("128k");
        } else {
            command.add("-an");
        }
        command.add("-map_metadata");
        command.add("-1");
        command.add("-map_metadata:s:v");
        command.add("-1");
        command.add("-map_metadata:s:a");
        command.add("-1");
        command.add("-map_chapters");
        command.add("-1");
        command.add("-metadata");
        command.add("creation_time=");
        command.add("-fflags");
        command.add("+bitexact");
        command.add("-flags:v");
        command.add("+bitexact");
        command.add("-flags:a");
        command.add("+bitexact");
        command.add("-movflags");
        command.add("+faststart");
        command.add(output.toString());
        return command;
    }

    String buildVideoFilter(SourceMedia source, TransformSpec spec) {
        List<String> filters = new ArrayList<>();
        if (spec.cropPx() > 0) {
            filters.add("crop=iw-" + (2 * spec.cropPx()) + ":ih-" + (2 * spec.cropPx()));
        }
        if (Math.abs(spec.scaleDelta()) > EPSILON) {
            int scaledWidth = even(source.width() * (1 + spec.scaleDelta()));
            int scaledHeight = even(source.height() * (1 + spec.scaleDelta()));
            filters.add("scale=" + scaledWidth + ":" + scaledHeight);
        }
        // Back to the exact source size, whatever crop and scale did.
        filters.add("scale=" + source.width() + ":" + source.height());
        if (Math.abs(spec.hueShiftDeg()) > EPSILON) {
            filters.add("hue=h=" + formatDecimal(spec.hueShiftDeg()));
        }
        if (spec.noiseLevel() > 0) {
            filters.add("noise=alls=" + spec.noiseLevel() + ":allf=t+u");
        }
        filters.add(String.format(
                Locale.ROOT,
                "eq=brightness=%.4f:contrast=%.4f:saturation=%.4f:gamma=%.4f",
                spec.brightness(),
                spec.contrast(),
                spec.saturation(),
                spec.gamma()));
        if (Math.abs(spec.speedFactor() - 1.0) > EPSILON) {
            filters.add(String.format(Locale.ROOT, "setpts=PTS/%.4f", spec.speedFactor()));
        }
        filters.add("format=yuv420p");
        return String.join(",", filters);
    }

    String buildAudioFilter(SourceMedia source, TransformSpec spec) {
        List<String> filters = new ArrayList<>();
        int sampleRate = source.audioSampleRate();
        double pitchRatio = Math.pow(2.0, spec.audioPitchSemitones() / 12.0);
        if (Math.abs(pitchRatio - 1.0) > EPSILON) {
            filters.add("asetrate=" + Math.round(sampleRate * pitchRatio));
            filters.add("aresample=" + sampleRate);
        }

        // asetrate changes tempo along with pitch; atempo undoes that and applies the speed change.
        double tempo = spec.speedFactor() / pitchRatio;
        while (tempo > MAX_ATEMPO + EPSILON) {
            filters.add("atempo=" + formatDecimal(MAX_ATEMPO));
            tempo /= MAX_ATEMPO;
        }
        while (tempo < MIN_ATEMPO - EPSILON) {
            filters.add("atempo=" + formatDecimal(MIN_ATEMPO));
            tempo /= MIN_ATEMPO;
        }
        if (Math.abs(tempo - 1.0) > EPSILON) {
            filters.add(String.format(Locale.ROOT, "atempo=%.6f", tempo));
        }
        if (filters.isEmpty()) {
            filters.add("anull");
        }
        return String.join(",", filters);
    }

    long targetBitrateKbps(SourceMedia source, TransformSpec spec) {
        long base = Math.max(MIN_BITRATE_KBPS, source.averageBitrateKbps());
        return Math.round(base * spec.bitrateFactor());
    }

    Variant validateOutput(
            SourceMedia source,
            TransformSpec spec,
            AccountTarget target,
            EncoderBackend backend,
            Path output) throws OutputValidationFailedException, InterruptedException {
        long sizeBytes;
        try {
            sizeBytes = Files.isRegularFile(output) ? Files.size(output) : 0;
        } catch (IOException e) {
            throw new OutputValidationFailedException("Cannot read encoded output " + output, e);
        }
        if (sizeBytes == 0) {
            throw new OutputValidationFailedException("Encoded output for " + target.key() + " is missing or empty.");
        }

        MediaInfo info;
        try {
            info = mediaProbe.probe(output);
        } catch (IOException e) {
            throw new OutputValidationFailedException(
                    "Encoded output for " + target.key() + " is not decodable: " + e.getMessage(),
                    e);
        }

        double expectedDuration = source.durationSeconds() / spec.speedFactor();
        if (Math.abs(info.durationSeconds() - expectedDuration) > settings.getDurationToleranceSeconds()) {
            throw new OutputValidationFailedException(String.format(
                    Locale.ROOT,
                    "Encoded output for %s lasts %.3fs, expected %.3fs.",
                    target.key(),
                    info.durationSeconds(),
                    expectedDuration));
        }
        if (info.width() != source.width() || info.height() != source.height()) {
            throw new OutputValidationFailedException(
                    "Encoded output for " + target.key() + " is " + info.width() + "x" + info.height()
                            + ", expected " + source.width() + "x" + source.height() + ".");
        }

        String checksum;
        try {
            checksum = Checksums.sha256(output);
        } catch (IOException e) {
            throw new OutputValidationFailedException("Cannot checksum encoded output " + output, e);
        }
        if (checksum.equals(source.checksum())) {
            throw new OutputValidationFailedException(
                    "Encoded output for " + target.key() + " is byte-identical to the source.");
        }

        logger.info(
                "Encoded variant account={} backend={} sizeBytes={} checksum={}",
                target.key(),
                backend,
                sizeBytes,
                checksum);
        return new Variant(target, output, spec, backend, sizeBytes, checksum);
    }

    private int even(double value) {
        int rounded = (int) Math.round(value);
        return rounded % 2 == 0 ? rounded : rounded + 1;
    }

    private String formatDecimal(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
