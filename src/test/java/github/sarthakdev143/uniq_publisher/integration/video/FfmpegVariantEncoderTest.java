package github.sarthakdev143.uniq_publisher.integration.video;

import github.sarthakdev143.uniq_publisher.config.UniqPublisherProperties;
import github.sarthakdev143.uniq_publisher.exception.EncodeProcessFailedException;
import github.sarthakdev143.uniq_publisher.exception.OutputValidationFailedException;
import github.sarthakdev143.uniq_publisher.exception.TransformOutOfBoundsException;
import github.sarthakdev143.uniq_publisher.model.AccountTarget;
import github.sarthakdev143.uniq_publisher.model.AccountType;
import github.sarthakdev143.uniq_publisher.model.EncoderBackend;
import github.sarthakdev143.uniq_publisher.model.MediaInfo;
import github.sarthakdev143.uniq_publisher.model.Platform;
import github.sarthakdev143.uniq_publisher.model.SourceMedia;
import github.sarthakdev143.uniq_publisher.model.TransformSpec;
import github.sarthakdev143.uniq_publisher.model.Variant;
import github.sarthakdev143.uniq_publisher.service.MediaProbe;
import github.sarthakdev143.uniq_publisher.transform.TransformBounds;
import github.sarthakdev143.uniq_publisher.util.Checksums;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FfmpegVariantEncoderTest {

    private static final AccountTarget TARGET = new AccountTarget("12345", Platform.VK, AccountType.GROUP);

    @Mock
    private FfmpegCommandRunner commandRunner;

    @Mock
    private MediaProbe mediaProbe;

    @TempDir
    Path tempDir;

    private FfmpegVariantEncoder encoder;
    private SourceMedia source;

    @BeforeEach
    void setUp() {
        UniqPublisherProperties properties = new UniqPublisherProperties();
        EncoderCapability capability = new EncoderCapability(commandRunner, properties);
        encoder = new FfmpegVariantEncoder(
                capability,
                commandRunner,
                mediaProbe,
                TransformBounds.defaults(),
                properties);
        source = new SourceMedia(
                tempDir.resolve("source.mp4"),
                "mp4",
                10.0,
                1920,
                1080,
                44100,
                5_000_000,
                "source-checksum");
    }

    @Test
    void buildEncodeCommandStripsMetadataAndUsesBackendEncoder() {
        List<String> command = encoder.buildEncodeCommand(source, spec(2, 1.0, 0.0), EncoderBackend.NVENC, out());

        assertThat(command.get(0)).isEqualTo("ffmpeg");
        assertThat(valueAfter(command, "-c:v")).isEqualTo("h264_nvenc");
        assertThat(valueAfter(command, "-rc")).isEqualTo("vbr");
        assertThat(valueAfter(command, "-map_metadata")).isEqualTo("-1");
        assertThat(valueAfter(command, "-map_metadata:s:v")).isEqualTo("-1");
        assertThat(valueAfter(command, "-map_chapters")).isEqualTo("-1");
        assertThat(valueAfter(command, "-metadata")).isEqualTo("creation_time=");
        assertThat(valueAfter(command, "-fflags")).isEqualTo("+bitexact");
        assertThat(valueAfter(command, "-c:a")).isEqualTo("aac");
        assertThat(command.get(command.size() - 1)).isEqualTo(out().toString());
    }

    @Test
    void buildEncodeCommandScalesBitrateByFactor() {
        // 5 MB over 10 s is 4000 kbps; factor 1.05 gives 4200k.
        List<String> command = encoder.buildEncodeCommand(source, spec(0, 1.0, 0.0), EncoderBackend.AMF, out());

        assertThat(valueAfter(command, "-b:v")).isEqualTo("4200k");
        assertThat(valueAfter(command, "-quality")).isEqualTo("balanced");
    }

    @Test
    void buildEncodeCommandDropsAudioForSilentSource() {
        SourceMedia silent = new SourceMedia(source.path(), "mp4", 10.0, 1920, 1080, null, 5_000_000, "x");

        List<String> command = encoder.buildEncodeCommand(silent, spec(0, 1.0, 0.0), EncoderBackend.SOFTWARE, out());

        assertThat(command).contains("-an").doesNotContain("-af", "0:a:0");
        assertThat(valueAfter(command, "-c:v")).isEqualTo("libx264");
        assertThat(valueAfter(command, "-crf")).isEqualTo("23");
    }

    @Test
    void buildVideoFilterAppliesEveryKnobAndRestoresSourceSize() {
        String filter = encoder.buildVideoFilter(source, spec(2, 1.01, 0.0));

        assertThat(filter).contains("crop=iw-4:ih-4");
        assertThat(filter).contains("scale=1940:1092");
        assertThat(filter).contains("scale=1920:1080");
        assertThat(filter).contains("hue=h=1.500");
        assertThat(filter).contains("noise=alls=2:allf=t+u");
        assertThat(filter).contains("eq=brightness=0.0100:contrast=1.0100:saturation=0.9900:gamma=1.0000");
        assertThat(filter).contains("setpts=PTS/1.0100");
        assertThat(filter.indexOf("scale=1920:1080")).isGreaterThan(filter.indexOf("crop="));
    }

    @Test
    void buildAudioFilterIsPassThroughWithoutPitchOrSpeedChange() {
        assertThat(encoder.buildAudioFilter(source, spec(0, 1.0, 0.0))).isEqualTo("anull");
    }

    @Test
    void buildAudioFilterShiftsPitchAndKeepsTempo() {
        String filter = encoder.buildAudioFilter(source, spec(0, 1.0, 0.2));

        assertThat(filter).startsWith("asetrate=");
        assertThat(filter).contains("aresample=44100");
        assertThat(filter).contains("atempo=");
    }

    @Test
    void encodeRejectsSpecOutsideBoundsWithoutRunningFfmpeg() {
        TransformSpec drifted = spec(50, 1.0, 0.0);

        assertThatThrownBy(() -> encoder.encode(source, drifted, TARGET, EncoderBackend.NVENC, out()))
                .isInstanceOf(TransformOutOfBoundsException.class);
        verifyNoInteractions(commandRunner, mediaProbe);
    }

    @Test
    void encodeFailsWhenFfmpegExitsNonZero() throws Exception {
        when(commandRunner.run(anyList(), any(Duration.class), anyString()))
                .thenReturn(new CommandResult(1, "", "Cannot load nvcuda.dll", false));

        assertThatThrownBy(() -> encoder.encode(source, spec(1, 1.0, 0.0), TARGET, EncoderBackend.NVENC, out()))
                .isInstanceOf(EncodeProcessFailedException.class)
                .hasMessageContaining("nvcuda")
                .satisfies(error -> assertThat(((EncodeProcessFailedException) error).backend())
                        .isEqualTo(EncoderBackend.NVENC));
    }

    @Test
    void encodeFailsWhenFfmpegTimesOut() throws Exception {
        when(commandRunner.run(anyList(), any(Duration.class), anyString()))
                .thenReturn(new CommandResult(-1, "", "", true));

        assertThatThrownBy(() -> encoder.encode(source, spec(1, 1.0, 0.0), TARGET, EncoderBackend.QSV, out()))
                .isInstanceOf(EncodeProcessFailedException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void encodeReturnsValidatedVariant() throws Exception {
        stubSuccessfulEncode("variant-bytes");
        when(mediaProbe.probe(out())).thenReturn(new MediaInfo("mp4", 10.0, 1920, 1080, 44100));

        Variant variant = encoder.encode(source, spec(1, 1.0, 0.0), TARGET, EncoderBackend.NVENC, out());

        assertThat(variant.target()).isEqualTo(TARGET);
        assertThat(variant.backend()).isEqualTo(EncoderBackend.NVENC);
        assertThat(variant.sizeBytes()).isEqualTo("variant-bytes".length());
        assertThat(variant.checksum()).isEqualTo(Checksums.sha256(out()));
    }

    @Test
    void encodeExpectsDurationScaledBySpeed() throws Exception {
        stubSuccessfulEncode("faster");
        when(mediaProbe.probe(out())).thenReturn(new MediaInfo("mp4", 10.0 / 1.02, 1920, 1080, 44100));

        Variant variant = encoder.encode(source, spec(1, 1.02, 0.0), TARGET, EncoderBackend.NVENC, out());

        assertThat(variant.spec().speedFactor()).isEqualTo(1.02);
    }

    @Test
    void encodeRejectsOutputWithWrongDurationAndDeletesIt() throws Exception {
        stubSuccessfulEncode("truncated");
        when(mediaProbe.probe(out())).thenReturn(new MediaInfo("mp4", 4.0, 1920, 1080, 44100));

        assertThatThrownBy(() -> encoder.encode(source, spec(1, 1.0, 0.0), TARGET, EncoderBackend.NVENC, out()))
                .isInstanceOf(OutputValidationFailedException.class)
                .hasMessageContaining("expected 10.000s");
        assertThat(out()).doesNotExist();
    }

    @Test
    void encodeRejectsOutputWithChangedDimensions() throws Exception {
        stubSuccessfulEncode("resized");
        when(mediaProbe.probe(out())).thenReturn(new MediaInfo("mp4", 10.0, 1916, 1076, 44100));

        assertThatThrownBy(() -> encoder.encode(source, spec(2, 1.0, 0.0), TARGET, EncoderBackend.NVENC, out()))
                .isInstanceOf(OutputValidationFailedException.class)
                .hasMessageContaining("1916x1076");
    }

    @Test
    void encodeRejectsOutputIdenticalToSource() throws Exception {
        Path sourceFile = tempDir.resolve("source.mp4");
        Files.writeString(sourceFile, "same-bytes");
        SourceMedia realSource = new SourceMedia(
                sourceFile, "mp4", 10.0, 1920, 1080, 44100, 10, Checksums.sha256(sourceFile));
        stubSuccessfulEncode("same-bytes");
        when(mediaProbe.probe(out())).thenReturn(new MediaInfo("mp4", 10.0, 1920, 1080, 44100));

        assertThatThrownBy(() -> encoder.encode(realSource, spec(1, 1.0, 0.0), TARGET, EncoderBackend.NVENC, out()))
                .isInstanceOf(OutputValidationFailedException.class)
                .hasMessageContaining("byte-identical");
    }

    @Test
    void encodeRejectsMissingOutput() throws Exception {
        when(commandRunner.run(anyList(), any(Duration.class), anyString()))
                .thenReturn(new CommandResult(0, "", "", false));

        assertThatThrownBy(() -> encoder.encode(source, spec(1, 1.0, 0.0), TARGET, EncoderBackend.NVENC, out()))
                .isInstanceOf(OutputValidationFailedException.class)
                .hasMessageContaining("missing or empty");
        verifyNoInteractions(mediaProbe);
    }

    private void stubSuccessfulEncode(String content) throws Exception {
        when(commandRunner.run(anyList(), any(Duration.class), anyString())).thenAnswer(invocation -> {
            Files.write(out(), content.getBytes(StandardCharsets.UTF_8));
            return new CommandResult(0, "", "", false);
        });
    }

    private Path out() {
        return tempDir.resolve("variant.mp4");
    }

    private TransformSpec spec(int cropPx, double speedFactor, double pitch) {
        return new TransformSpec(
                7L,
                "vk:12345",
                cropPx,
                0.01,
                1.5,
                2,
                speedFactor,
                pitch,
                0.01,
                1.01,
                0.99,
                1.0,
                1.05);
    }

    private String valueAfter(List<String> values, String flag) {
        int index = values.indexOf(flag);
        return values.get(index + 1);
    }
}
