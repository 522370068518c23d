package github.sarthakdev143.uniq_publisher.service;

import github.sarthakdev143.uniq_publisher.model.MediaInfo;

import java.io.IOException;
import java.nio.file.Path;

public interface MediaProbe {

    /**
     * Reads container and stream properties of a media file.
     *
     * @throws IOException when the file cannot be read or decoded
     */
    MediaInfo probe(Path file) throws IOException, InterruptedException;
}
