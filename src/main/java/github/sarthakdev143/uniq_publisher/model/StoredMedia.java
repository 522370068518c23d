package github.sarthakdev143.uniq_publisher.model;

/**
 * A variant copied to storage the publishing provider can fetch from.
 */
public record StoredMedia(String handle, String url) {
}
