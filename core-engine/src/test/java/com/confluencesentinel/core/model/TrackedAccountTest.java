package com.confluencesentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TrackedAccount}.
 */
class TrackedAccountTest {

    @Test
    @DisplayName("Should normalise the address to lower case")
    void shouldNormaliseAddress() {
        TrackedAccount account = new TrackedAccount(
                " 0xDFC24B077BC1425AD1DEA75BCB6F8158E10DF303 ", "HLP", AccountKind.VAULT, true);

        assertThat(account.getAddress()).isEqualTo("0xdfc24b077bc1425ad1dea75bcb6f8158e10df303");
        assertThat(account.shortAddress()).isEqualTo("0xdfc24b07...");
    }

    @Test
    @DisplayName("Should reject malformed addresses and blank names")
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> new TrackedAccount("0x123", "Short", AccountKind.WALLET, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid account address");
        assertThatThrownBy(() -> new TrackedAccount(
                "0xdfc24b077bc1425ad1dea75bcb6f8158e10df303", " ", AccountKind.WALLET, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should keep identity when toggling the active flag")
    void shouldKeepIdentityWhenDeactivated() {
        TrackedAccount active = new TrackedAccount(
                "0xdfc24b077bc1425ad1dea75bcb6f8158e10df303", "HLP", AccountKind.VAULT, true);

        TrackedAccount inactive = active.withActive(false);

        assertThat(inactive.isActive()).isFalse();
        assertThat(inactive).isEqualTo(active);
        assertThat(active.withActive(true)).isSameAs(active);
    }
}
