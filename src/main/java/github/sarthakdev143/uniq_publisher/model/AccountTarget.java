package github.sarthakdev143.uniq_publisher.model;

/**
 * One destination account selected by the caller. Validated on construction and treated as
 * trusted everywhere downstream.
 */
public record AccountTarget(
        String accountId,
        Platform platform,
        AccountType type,
        String name) {

    public AccountTarget {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId is required.");
        }
        if (platform == null) {
            throw new IllegalArgumentException("platform is required for account " + accountId + ".");
        }
        accountId = accountId.trim();
        type = type == null ? AccountType.USER : type;
        name = name == null || name.isBlank() ? null : name;
    }

    public AccountTarget(String accountId, Platform platform, AccountType type) {
        this(accountId, platform, type, null);
    }

    /**
     * Builds a target from the provider's wire representation, e.g. {@code ("123", "vk", "group")}.
     */
    public static AccountTarget of(String accountId, String social, String type) {
        return new AccountTarget(accountId, Platform.fromInput(social), AccountType.fromInput(type), null);
    }

    public String key() {
        return platform.code() + ":" + accountId;
    }
}
