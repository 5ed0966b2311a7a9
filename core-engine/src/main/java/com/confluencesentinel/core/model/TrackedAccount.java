package com.confluencesentinel.core.model;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An exchange account whose positions are watched for confluence.
 *
 * <p>
 * The address is the identity of the account and never changes. Addresses are
 * normalised to lowercase at construction so lookups are case-insensitive.
 * Deactivating an account produces a new instance via {@link #withActive(boolean)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrackedAccount implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

    private final String address;
    private final String displayName;
    private final AccountKind kind;
    private final boolean active;

    /**
     * @param address     exchange address ({@code 0x} followed by 40 hex characters)
     * @param displayName human-readable label used in alerts
     * @param kind        vault or wallet
     * @param active      whether the account is polled
     * @throws IllegalArgumentException if the address is malformed or the name is blank
     */
    public TrackedAccount(String address, String displayName, AccountKind kind, boolean active) {
        Objects.requireNonNull(address, "address must not be null");
        String normalised = address.trim().toLowerCase(Locale.ROOT);
        if (!ADDRESS.matcher(normalised).matches()) {
            throw new IllegalArgumentException("Invalid account address: '" + address + "'");
        }
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName must not be blank for " + normalised);
        }
        this.address = normalised;
        this.displayName = displayName.trim();
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.active = active;
    }

    public String getAddress() {
        return address;
    }

    public String getDisplayName() {
        return displayName;
    }

    public AccountKind getKind() {
        return kind;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * @param active new active flag
     * @return a copy of this account with the given flag
     */
    public TrackedAccount withActive(boolean active) {
        return active == this.active ? this : new TrackedAccount(address, displayName, kind, active);
    }

    /**
     * Shortened address for display, e.g. {@code 0x56498e5f...}.
     *
     * @return first ten characters of the address followed by an ellipsis
     */
    public String shortAddress() {
        return shorten(address);
    }

    /**
     * @param address any address string
     * @return the first ten characters followed by {@code ...}, or the input if shorter
     */
    public static String shorten(String address) {
        if (address == null || address.length() <= 10) {
            return address;
        }
        return address.substring(0, 10) + "...";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrackedAccount that))
            return false;
        return address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }

    @Override
    public String toString() {
        return "TrackedAccount{" +
                "address='" + address + '\'' +
                ", displayName='" + displayName + '\'' +
                ", kind=" + kind +
                ", active=" + active +
                '}';
    }
}
