package com.confluencesentinel.monitor;

import com.confluencesentinel.core.model.AccountKind;
import com.confluencesentinel.core.model.TrackedAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Loads the tracked accounts from YAML.
 *
 * <p>
 * Every entry is checked; all problems are collected and reported together
 * so an operator can fix the file in one pass.
 * </p>
 *
 * @since 1.0.0
 */
public final class AccountsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AccountsLoader.class);

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "accounts.yml";

    private AccountsLoader() {
    }

    /**
     * @param path path to the YAML file
     * @return accounts in file order
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static List<TrackedAccount> fromFile(String path) {
        Objects.requireNonNull(path, "Accounts file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Accounts file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read accounts file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return accounts in file order
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static List<TrackedAccount> fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AccountsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static List<TrackedAccount> parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AccountsConfig.class, options));
        AccountsConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed accounts file " + source + ": " + e.getMessage(), e);
        }
        if (config == null || config.getAccounts() == null || config.getAccounts().isEmpty()) {
            LOG.warn("Accounts file {} lists no accounts; nothing will be polled", source);
            return List.of();
        }

        List<TrackedAccount> accounts = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<AccountsConfig.AccountEntry> entries = config.getAccounts();
        for (int i = 0; i < entries.size(); i++) {
            AccountsConfig.AccountEntry entry = entries.get(i);
            if (entry == null) {
                errors.add("account #" + i + " is empty");
                continue;
            }
            if (entry.getAddress() == null) {
                errors.add("account #" + i + " has no address");
                continue;
            }
            try {
                TrackedAccount account = new TrackedAccount(
                        entry.getAddress(), entry.getName(), parseKind(entry.getKind()), entry.isActive());
                if (!seen.add(account.getAddress())) {
                    errors.add("account #" + i + " duplicates " + account.getAddress());
                    continue;
                }
                accounts.add(account);
            } catch (IllegalArgumentException e) {
                errors.add("account #" + i + ": " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Accounts file " + source + " validation failed: " + String.join("; ", errors));
        }

        LOG.info("Loaded {} tracked account(s) from {}", accounts.size(), source);
        return List.copyOf(accounts);
    }

    private static AccountKind parseKind(String kind) {
        if (kind == null || kind.isBlank()) {
            return AccountKind.WALLET;
        }
        try {
            return AccountKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("kind must be 'vault' or 'wallet', got: '" + kind + "'", e);
        }
    }
}
