package github.sarthakdev143.uniq_publisher.integration.video;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;

import java.util.List;

/**
 * Subset of {@code ffprobe -print_format json -show_format -show_streams}.
 */
public class FfprobeOutput extends GenericJson {

    @Key
    private List<Stream> streams;

    @Key
    private Format format;

    public List<Stream> getStreams() {
        return streams;
    }

    public Format getFormat() {
        return format;
    }

    public static class Stream extends GenericJson {

        @Key("codec_type")
        private String codecType;

        @Key
        private Integer width;

        @Key
        private Integer height;

        @Key("sample_rate")
        private String sampleRate;

        @Key
        private String duration;

        public String getCodecType() {
            return codecType;
        }

        public Integer getWidth() {
            return width;
        }

        public Integer getHeight() {
            return height;
        }

        public String getSampleRate() {
            return sampleRate;
        }

        public String getDuration() {
            return duration;
        }
    }

    public static class Format extends GenericJson {

        @Key("format_name")
        private String formatName;

        @Key
        private String duration;

        public String getFormatName() {
            return formatName;
        }

        public String getDuration() {
            return duration;
        }
    }
}
