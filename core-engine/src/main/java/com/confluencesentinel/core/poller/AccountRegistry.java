package com.confluencesentinel.core.poller;

import com.confluencesentinel.core.model.TrackedAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * The set of accounts being watched, keyed by normalised address.
 *
 * <p>
 * Accounts are never removed, only deactivated, so their display names stay
 * resolvable for alerts that mention them.
 * </p>
 *
 * @since 1.0.0
 */
public class AccountRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(AccountRegistry.class);

    private final ConcurrentMap<String, TrackedAccount> accounts = new ConcurrentSkipListMap<>();

    public AccountRegistry() {
    }

    public AccountRegistry(Collection<TrackedAccount> initial) {
        initial.forEach(this::add);
    }

    /**
     * @return {@code true} if the account was new, {@code false} if an account
     *         with the same address was already registered (it is left as is)
     */
    public boolean add(TrackedAccount account) {
        Objects.requireNonNull(account, "account must not be null");
        TrackedAccount existing = accounts.putIfAbsent(account.getAddress(), account);
        if (existing != null) {
            LOG.warn("Account {} already tracked as '{}'", account.shortAddress(), existing.getDisplayName());
            return false;
        }
        LOG.info("Tracking {} '{}' ({})", account.getKind(), account.getDisplayName(), account.shortAddress());
        return true;
    }

    /**
     * @return {@code true} if the account exists and was active
     */
    public boolean deactivate(String address) {
        return setActive(address, false);
    }

    /**
     * @return {@code true} if the account exists and was inactive
     */
    public boolean activate(String address) {
        return setActive(address, true);
    }

    private boolean setActive(String address, boolean active) {
        String key = normalise(address);
        TrackedAccount current = accounts.get(key);
        if (current == null || current.isActive() == active) {
            return false;
        }
        boolean changed = accounts.replace(key, current, current.withActive(active));
        if (changed) {
            LOG.info("Account '{}' {}", current.getDisplayName(), active ? "activated" : "deactivated");
        }
        return changed;
    }

    public Optional<TrackedAccount> find(String address) {
        return Optional.ofNullable(accounts.get(normalise(address)));
    }

    /**
     * @return display name of the account, or {@code null} if unknown
     */
    public String displayNameOf(String address) {
        TrackedAccount account = accounts.get(normalise(address));
        return account == null ? null : account.getDisplayName();
    }

    /**
     * @return active accounts ordered by address
     */
    public List<TrackedAccount> active() {
        List<TrackedAccount> result = new ArrayList<>();
        for (TrackedAccount account : accounts.values()) {
            if (account.isActive()) {
                result.add(account);
            }
        }
        return result;
    }

    public List<TrackedAccount> all() {
        return new ArrayList<>(accounts.values());
    }

    public int size() {
        return accounts.size();
    }

    private static String normalise(String address) {
        return Objects.requireNonNull(address, "address must not be null").trim().toLowerCase(Locale.ROOT);
    }
}
