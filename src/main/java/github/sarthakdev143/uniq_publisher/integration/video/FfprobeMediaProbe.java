package github.sarthakdev143.uniq_publisher.integration.video;

import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import github.sarthakdev143.uniq_publisher.config.UniqPublisherProperties;
import github.sarthakdev143.uniq_publisher.model.MediaInfo;
import github.sarthakdev143.uniq_publisher.service.MediaProbe;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
public class FfprobeMediaProbe implements MediaProbe {

    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();

    private final FfmpegCommandRunner commandRunner;
    private final UniqPublisherProperties.Encoder settings;

    public FfprobeMediaProbe(FfmpegCommandRunner commandRunner, UniqPublisherProperties properties) {
        this.commandRunner = commandRunner;
        this.settings = properties.getEncoder();
    }

    @Override
    public MediaInfo probe(Path file) throws IOException, InterruptedException {
        CommandResult result = commandRunner.run(
                buildProbeCommand(file),
                settings.getProbeTimeout(),
                "probe " + file.getFileName());
        if (!result.isSuccess()) {
            throw new IOException(result.timedOut()
                    ? "ffprobe timed out on " + file
                    : "ffprobe failed on " + file + " with exit code " + result.exitCode() + ". " + result.errorTail());
        }
        return parse(result.output(), file);
    }

    List<String> buildProbeCommand(Path file) {
        return List.of(
                settings.getFfprobePath(),
                "-v", "error",
                "-print_format", "json",
                "-show_format",
                "-show_streams",
                file.toString());
    }

    MediaInfo parse(String json, Path file) throws IOException {
        FfprobeOutput output;
        try {
            output = JSON_FACTORY.fromString(json, FfprobeOutput.class);
        } catch (IllegalArgumentException e) {
            throw new IOException("Unreadable ffprobe output for " + file, e);
        }

        FfprobeOutput.Stream video = null;
        FfprobeOutput.Stream audio = null;
        if (output.getStreams() != null) {
            for (FfprobeOutput.Stream stream : output.getStreams()) {
                if (video == null && "video".equals(stream.getCodecType())) {
                    video = stream;
                } else if (audio == null && "audio".equals(stream.getCodecType())) {
                    audio = stream;
                }
            }
        }

        if (video == null || video.getWidth() == null || video.getHeight() == null) {
            throw new IOException("No decodable video stream in " + file);
        }

        FfprobeOutput.Format format = output.getFormat();
        Double duration = parseDouble(format == null ? null : format.getDuration());
        if (duration == null) {
            duration = parseDouble(video.getDuration());
        }
        if (duration == null || duration <= 0) {
            throw new IOException("Unknown duration for " + file);
        }

        Double sampleRate = audio == null ? null : parseDouble(audio.getSampleRate());
        return new MediaInfo(
                format == null ? null : format.getFormatName(),
                duration,
                video.getWidth(),
                video.getHeight(),
                sampleRate == null ? null : sampleRate.intValue());
    }

    private Double parseDouble(String value) {
        if (value == null || value.isBlank() || "N/A".equals(value)) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
