package github.sarthakdev143.uniq_publisher.cli;

import github.sarthakdev143.uniq_publisher.model.AccountTarget;
import github.sarthakdev143.uniq_publisher.model.BatchFailure;
import github.sarthakdev143.uniq_publisher.model.BatchRequest;
import github.sarthakdev143.uniq_publisher.model.BatchResult;
import github.sarthakdev143.uniq_publisher.service.PublishBatchService;
import github.sarthakdev143.uniq_publisher.service.impl.ScheduledTimeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a single batch from command-line options, for example:
 *
 * <pre>
 * --source=clip.mp4 --target=vk:123456:group --target=io:98765 --schedule=2026-01-31T18:00 --caption="Hi"
 * </pre>
 *
 * Targets are {@code social:accountId[:type]}. Nothing happens when {@code --source} is absent.
 */
@Component
public class BatchCommandLineRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(BatchCommandLineRunner.class);

    private final PublishBatchService publishBatchService;
    private final ScheduledTimeParser scheduledTimeParser;

    public BatchCommandLineRunner(PublishBatchService publishBatchService, ScheduledTimeParser scheduledTimeParser) {
        this.publishBatchService = publishBatchService;
        this.scheduledTimeParser = scheduledTimeParser;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (!args.containsOption("source")) {
            return;
        }

        BatchRequest request = toRequest(args);
        BatchResult result = publishBatchService.publish(request);
        logger.info(
                "Batch finished accounts={} videos={} published={}",
                result.totalAccounts(),
                result.totalVideos(),
                result.published());
        for (BatchFailure failure : result.failures()) {
            logger.warn(
                    "Account {}:{} failed reason={} message={}",
                    failure.platform().code(),
                    failure.accountId(),
                    failure.reason(),
                    failure.message());
        }
    }

    BatchRequest toRequest(ApplicationArguments args) {
        Path source = Path.of(single(args, "source"));
        Instant scheduledAt = scheduledTimeParser.parse(single(args, "schedule"));
        String caption = args.containsOption("caption") ? single(args, "caption") : null;
        Long seed = args.containsOption("seed") ? Long.valueOf(single(args, "seed")) : null;

        List<AccountTarget> targets = new ArrayList<>();
        List<String> targetValues = args.getOptionValues("target");
        if (targetValues != null) {
            for (String value : targetValues) {
                targets.add(parseTarget(value));
            }
        }
        return new BatchRequest(source, targets, scheduledAt, caption, seed);
    }

    static AccountTarget parseTarget(String value) {
        String[] parts = value.split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("Target must be social:accountId[:type], got " + value);
        }
        return AccountTarget.of(parts[1], parts[0], parts.length == 3 ? parts[2] : null);
    }

    private String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new IllegalArgumentException("--" + name + " requires a value.");
        }
        return values.get(values.size() - 1);
    }
}
