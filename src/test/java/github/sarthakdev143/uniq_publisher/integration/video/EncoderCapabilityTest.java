package github.sarthakdev143.uniq_publisher.integration.video;

import github.sarthakdev143.uniq_publisher.config.UniqPublisherProperties;
import github.sarthakdev143.uniq_publisher.exception.NoEncoderAvailableException;
import github.sarthakdev143.uniq_publisher.model.EncoderBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EncoderCapabilityTest {

    private static final String ENCODERS_HEADER = """
            Encoders:
             V..... = Video
             A..... = Audio
             ------
            """;

    @Mock
    private FfmpegCommandRunner commandRunner;

    private UniqPublisherProperties properties;

    @BeforeEach
    void setUp() {
        properties = new UniqPublisherProperties();
    }

    @Test
    void backendPicksFirstPreferredEncoderFromProbe() throws Exception {
        stubProbe(ENCODERS_HEADER
                + " V....D libx264              libx264 H.264 / AVC / MPEG-4 AVC\n"
                + " V....D h264_amf             AMD AMF H.264 Encoder\n"
                + " V....D h264_qsv             H.264 / AVC (Intel Quick Sync Video acceleration)\n"
                + " A....D aac                  AAC (Advanced Audio Coding)\n");

        EncoderCapability capability = new EncoderCapability(commandRunner, properties);

        assertThat(capability.backend()).isEqualTo(EncoderBackend.QSV);
        assertThat(capability.softwareFallbackAvailable()).isTrue();
    }

    @Test
    void probeRunsOnlyOnce() throws Exception {
        stubProbe(ENCODERS_HEADER + " V....D h264_nvenc           NVIDIA NVENC H.264 encoder\n");
        EncoderCapability capability = new EncoderCapability(commandRunner, properties);

        capability.backend();
        capability.backend();
        capability.softwareFallbackAvailable();

        verify(commandRunner, times(1)).run(anyList(), any(Duration.class), anyString());
    }

    @Test
    void noHardwareAndSoftwareDisabledFailsAndStaysFailed() throws Exception {
        stubProbe(ENCODERS_HEADER + " V....D libx264              libx264 H.264 / AVC / MPEG-4 AVC\n");
        EncoderCapability capability = new EncoderCapability(commandRunner, properties);

        assertThatThrownBy(capability::backend)
                .isInstanceOf(NoEncoderAvailableException.class)
                .hasMessageContaining("software fallback is disabled");
        assertThatThrownBy(capability::backend).isInstanceOf(NoEncoderAvailableException.class);
        verify(commandRunner, times(1)).run(anyList(), any(Duration.class), anyString());
    }

    @Test
    void softwareIsChosenWhenFallbackAllowed() throws Exception {
        properties.getEncoder().setAllowSoftwareFallback(true);
        stubProbe(ENCODERS_HEADER + " V....D libx264              libx264 H.264 / AVC / MPEG-4 AVC\n");

        EncoderCapability capability = new EncoderCapability(commandRunner, properties);

        assertThat(capability.backend()).isEqualTo(EncoderBackend.SOFTWARE);
    }

    @Test
    void failedProbeMeansNoEncoder() throws Exception {
        when(commandRunner.run(anyList(), any(Duration.class), anyString()))
                .thenReturn(new CommandResult(1, "", "ffmpeg: not found", false));

        EncoderCapability capability = new EncoderCapability(commandRunner, properties);

        assertThatThrownBy(capability::backend)
                .isInstanceOf(NoEncoderAvailableException.class)
                .hasMessageContaining("exit");
        assertThat(capability.softwareFallbackAvailable()).isFalse();
    }

    @Test
    void unstartableFfmpegMeansNoEncoder() throws Exception {
        when(commandRunner.run(anyList(), any(Duration.class), anyString()))
                .thenThrow(new IOException("No such file"));

        EncoderCapability capability = new EncoderCapability(commandRunner, properties);

        assertThatThrownBy(capability::backend)
                .isInstanceOf(NoEncoderAvailableException.class)
                .hasMessageContaining("No such file");
    }

    @Test
    void sessionPermitIsReleasedWhenWorkFails() throws Exception {
        EncoderCapability capability = new EncoderCapability(commandRunner, properties);

        assertThatThrownBy(() -> capability.withSession(() -> {
            throw new IOException("encode crashed");
        })).isInstanceOf(IOException.class);

        assertThat(capability.withSession(() -> "second")).isEqualTo("second");
    }

    @Test
    void parseEncoderNamesReadsSecondColumnOfVideoLines() {
        assertThat(EncoderCapability.parseEncoderNames(
                " V....D h264_videotoolbox    VideoToolbox H.264 Encoder\n A....D aac   AAC\n"))
                .contains("h264_videotoolbox")
                .doesNotContain("aac");
    }

    private void stubProbe(String output) throws Exception {
        when(commandRunner.run(anyList(), any(Duration.class), anyString()))
                .thenReturn(new CommandResult(0, output, "", false));
    }
}
