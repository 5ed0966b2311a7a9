package com.confluencesentinel.monitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the tracked-accounts YAML.
 *
 * <pre>
 * accounts:
 *   - address: "0x1234...abcd"
 *     name: "Alpha Vault"
 *     kind: vault
 *     active: true
 * </pre>
 *
 * <p>
 * Quote addresses: unquoted {@code 0x...} scalars are hex integers in YAML.
 * {@code kind} defaults to {@code wallet}, {@code active} to {@code true}.
 * </p>
 */
public class AccountsConfig {

    private List<AccountEntry> accounts = new ArrayList<>();

    public List<AccountEntry> getAccounts() {
        return accounts;
    }

    public void setAccounts(List<AccountEntry> accounts) {
        this.accounts = accounts;
    }

    /** One tracked account as written in YAML. */
    public static class AccountEntry {
        private String address;
        private String name;
        private String kind = "wallet";
        private boolean active = true;

        public String getAddress() {
            return address;
        }

        public void setAddress(String address) {
            this.address = address;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getKind() {
            return kind;
        }

        public void setKind(String kind) {
            this.kind = kind;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }
    }
}
