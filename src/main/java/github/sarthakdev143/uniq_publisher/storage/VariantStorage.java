package github.sarthakdev143.uniq_publisher.storage;

import github.sarthakdev143.uniq_publisher.model.StoredMedia;
import github.sarthakdev143.uniq_publisher.model.Variant;

import java.io.IOException;

/**
 * Makes encoded variants reachable by URL so the publishing provider can fetch them.
 */
public interface VariantStorage {

    StoredMedia store(String batchId, Variant variant) throws IOException;
}
