package github.sarthakdev143.uniq_publisher.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccountTargetTest {

    @Test
    void ofParsesProviderRepresentation() {
        AccountTarget target = AccountTarget.of(" 123 ", "VK", "group");

        assertThat(target.accountId()).isEqualTo("123");
        assertThat(target.platform()).isEqualTo(Platform.VK);
        assertThat(target.type()).isEqualTo(AccountType.GROUP);
        assertThat(target.key()).isEqualTo("vk:123");
    }

    @Test
    void typeDefaultsToUser() {
        assertThat(AccountTarget.of("1", "io", null).type()).isEqualTo(AccountType.USER);
        assertThat(AccountType.GROUP.toApiValue()).isEqualTo("group");
    }

    @Test
    void requiredFieldsAreEnforced() {
        assertThatThrownBy(() -> new AccountTarget(" ", Platform.VK, AccountType.USER))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("accountId is required.");
        assertThatThrownBy(() -> new AccountTarget("1", null, AccountType.USER))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AccountTarget.of("1", "vk", "channel"))
                .hasMessageContaining("account type must be one of");
    }

    @Test
    void platformAcceptsCodeOrName() {
        assertThat(Platform.fromInput("gg")).isEqualTo(Platform.YOUTUBE);
        assertThat(Platform.fromInput(" Pinterest ")).isEqualTo(Platform.PINTEREST);
        assertThatThrownBy(() -> Platform.fromInput("tiktok")).isInstanceOf(IllegalArgumentException.class);
    }
}
