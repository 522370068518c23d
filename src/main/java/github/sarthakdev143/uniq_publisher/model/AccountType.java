package github.sarthakdev143.uniq_publisher.model;

import java.util.Locale;

public enum AccountType {
    USER,
    GROUP,
    PAGE;

    public static AccountType fromInput(String input) {
        if (input == null || input.isBlank()) {
            return USER;
        }

        try {
            return AccountType.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("account type must be one of user, group, page.");
        }
    }

    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
