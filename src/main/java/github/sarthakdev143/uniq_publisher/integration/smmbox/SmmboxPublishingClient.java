package github.sarthakdev143.uniq_publisher.integration.smmbox;

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.json.JsonHttpContent;
import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.JsonObjectParser;
import com.google.api.client.json.gson.GsonFactory;
import github.sarthakdev143.uniq_publisher.config.UniqPublisherProperties;
import github.sarthakdev143.uniq_publisher.exception.PublishException;
import github.sarthakdev143.uniq_publisher.exception.PublishRejectedException;
import github.sarthakdev143.uniq_publisher.exception.PublishTransientException;
import github.sarthakdev143.uniq_publisher.model.PublishReceipt;
import github.sarthakdev143.uniq_publisher.model.PublishRequest;
import github.sarthakdev143.uniq_publisher.service.PublishingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Schedules posts through the SmmBox {@code v1/posts/postpone} endpoint, one post per call.
 */
@Component
public class SmmboxPublishingClient implements PublishingProvider {

    private static final Logger logger = LoggerFactory.getLogger(SmmboxPublishingClient.class);
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String POSTPONE_PATH = "v1/posts/postpone";
    private static final int MAX_ERROR_BODY_CHARS = 200;

    private final HttpRequestFactory requestFactory;
    private final UniqPublisherProperties.Smmbox settings;

    public SmmboxPublishingClient(HttpTransport httpTransport, UniqPublisherProperties properties) {
        this.settings = properties.getSmmbox();
        int timeoutMillis = Math.toIntExact(properties.getPublish().getRequestTimeout().toMillis());
        this.requestFactory = httpTransport.createRequestFactory(request -> {
            request.setParser(new JsonObjectParser(JSON_FACTORY));
            request.setConnectTimeout(timeoutMillis);
            request.setReadTimeout(timeoutMillis);
            // Resending is the orchestrator's decision, never the transport's.
            request.setNumberOfRetries(0);
        });
    }

    @Override
    public PublishReceipt publish(PublishRequest request) throws PublishException {
        String token = resolveToken();
        if (token == null) {
            throw new PublishRejectedException("SmmBox API token is not configured. Set SMMBOX_API_TOKEN.", null);
        }

        SmmboxPostponeRequest body = buildPostponeRequest(request);
        String account = request.target().key();
        logger.info(
                "Scheduling SmmBox post account={} date={} hasCaption={}",
                account,
                request.scheduledAt().getEpochSecond(),
                request.caption() != null);

        HttpResponse response;
        try {
            HttpRequest httpRequest = requestFactory.buildPostRequest(
                    new GenericUrl(postponeUrl()),
                    new JsonHttpContent(JSON_FACTORY, body));
            httpRequest.getHeaders().setAuthorization("Bearer " + token);
            response = httpRequest.execute();
        } catch (HttpResponseException e) {
            throw mapStatus(account, e);
        } catch (IOException e) {
            throw new PublishTransientException(
                    "SmmBox request for " + account + " failed: " + e.getMessage(),
                    null,
                    e);
        }

        try {
            SmmboxPostponeResponse parsed = parseResponse(account, response);
            if (!parsed.isSuccess()) {
                throw new PublishRejectedException(
                        "SmmBox rejected post for " + account + ": " + parsed.errorMessage(),
                        response.getStatusCode());
            }

            String postId = parsed.firstPostId();
            if (postId == null) {
                logger.warn("SmmBox accepted post for account={} without returning a post id", account);
                return new PublishReceipt(null, "Provider did not return a post id.");
            }
            return new PublishReceipt(postId);
        } finally {
            disconnect(response);
        }
    }

    SmmboxPostponeRequest buildPostponeRequest(PublishRequest request) {
        List<SmmboxAttachment> attachments = new ArrayList<>();
        if (request.caption() != null) {
            attachments.add(SmmboxAttachment.text(request.caption()));
        }
        attachments.add(SmmboxAttachment.video(request.mediaUrl()));

        SmmboxPost post = new SmmboxPost()
                .setGroup(new SmmboxGroup()
                        .setId(request.target().accountId())
                        .setSocial(request.target().platform().code())
                        .setType(request.target().type().toApiValue()))
                .setAttachments(attachments)
                .setDate(request.scheduledAt().getEpochSecond());
        return new SmmboxPostponeRequest().setPosts(List.of(post));
    }

    String postponeUrl() {
        String base = settings.getApiUrl();
        return (base.endsWith("/") ? base : base + "/") + POSTPONE_PATH;
    }

    /**
     * A 2xx body that cannot be read is treated as a rejection: the post may exist, and sending it
     * again could duplicate it.
     */
    private SmmboxPostponeResponse parseResponse(String account, HttpResponse response) throws PublishRejectedException {
        try {
            return response.parseAs(SmmboxPostponeResponse.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new PublishRejectedException(
                    "Unreadable SmmBox response for " + account + ": " + e.getMessage(),
                    response.getStatusCode(),
                    e);
        }
    }

    private PublishException mapStatus(String account, HttpResponseException e) {
        int status = e.getStatusCode();
        String message = "SmmBox HTTP " + status + " for " + account + ": " + extractErrorMessage(e.getContent());
        if (isTransientStatus(status)) {
            return new PublishTransientException(message, status, e);
        }
        return new PublishRejectedException(message, status, e);
    }

    static boolean isTransientStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    private String extractErrorMessage(String content) {
        if (content == null || content.isBlank()) {
            return "no response body";
        }
        try {
            GenericJson body = JSON_FACTORY.fromString(content, GenericJson.class);
            Object error = body.get("error");
            if (error != null) {
                return SmmboxPostponeResponse.describeError(error);
            }
        } catch (IOException | IllegalArgumentException notJson) {
            logger.debug("SmmBox error body is not JSON");
        }
        return content.length() <= MAX_ERROR_BODY_CHARS ? content : content.substring(0, MAX_ERROR_BODY_CHARS);
    }

    private String resolveToken() {
        String token = settings.getApiToken();
        if (token == null) {
            return null;
        }
        String cleaned = token.strip();
        if (cleaned.length() >= 2
                && (cleaned.startsWith("\"") && cleaned.endsWith("\"")
                || cleaned.startsWith("'") && cleaned.endsWith("'"))) {
            cleaned = cleaned.substring(1, cleaned.length() - 1).strip();
        }
        return cleaned.isEmpty() ? null : cleaned;
    }

    private void disconnect(HttpResponse response) {
        try {
            response.disconnect();
        } catch (IOException e) {
            logger.debug("Failed to release SmmBox response", e);
        }
    }
}
