package github.sarthakdev143.uniq_publisher.model;

import java.util.List;

/**
 * FFmpeg video encoders in probe preference order. Each carries the rate-control arguments that
 * encoder understands.
 */
public enum EncoderBackend {
    NVENC("h264_nvenc", true),
    QSV("h264_qsv", true),
    AMF("h264_amf", true),
    VIDEOTOOLBOX("h264_videotoolbox", true),
    SOFTWARE("libx264", false);

    private final String encoderName;
    private final boolean hardwareAccelerated;

    EncoderBackend(String encoderName, boolean hardwareAccelerated) {
        this.encoderName = encoderName;
        this.hardwareAccelerated = hardwareAccelerated;
    }

    public String encoderName() {
        return encoderName;
    }

    public boolean isHardwareAccelerated() {
        return hardwareAccelerated;
    }

    public List<String> rateControlArguments(long bitrateKbps) {
        String bitrate = bitrateKbps + "k";
        return switch (this) {
            case NVENC -> List.of(
                    "-preset", "p4",
                    "-rc", "vbr",
                    "-b:v", bitrate,
                    "-maxrate", Math.round(bitrateKbps * 1.5) + "k",
                    "-bufsize", bitrateKbps * 2 + "k",
                    "-spatial-aq", "1",
                    "-temporal-aq", "1");
            case QSV -> List.of(
                    "-global_quality", "23",
                    "-preset", "balanced");
            case AMF -> List.of(
                    "-quality", "balanced",
                    "-rc", "vbr_peak",
                    "-b:v", bitrate);
            case VIDEOTOOLBOX -> List.of(
                    "-b:v", bitrate,
                    "-allow_sw", "1",
                    "-realtime", "1");
            case SOFTWARE -> List.of(
                    "-preset", "veryfast",
                    "-crf", "23",
                    "-maxrate", bitrate,
                    "-bufsize", bitrateKbps * 2 + "k");
        };
    }
}
