package github.sarthakdev143.uniq_publisher.service;

import github.sarthakdev143.uniq_publisher.exception.PublishException;
import github.sarthakdev143.uniq_publisher.model.PublishReceipt;
import github.sarthakdev143.uniq_publisher.model.PublishRequest;

/**
 * Third-party service that schedules a post on a social account.
 */
public interface PublishingProvider {

    /**
     * Sends one scheduling request. Implementations must not retry internally; a single call results in
     * at most one request reaching the provider.
     *
     * @throws github.sarthakdev143.uniq_publisher.exception.PublishTransientException when the request
     *         may succeed if sent again later
     * @throws github.sarthakdev143.uniq_publisher.exception.PublishRejectedException when the provider
     *         refused the post
     */
    PublishReceipt publish(PublishRequest request) throws PublishException;
}
