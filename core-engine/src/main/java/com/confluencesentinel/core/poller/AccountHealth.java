package com.confluencesentinel.core.poller;

import java.time.Instant;
import java.util.Optional;

/**
 * Poll outcome bookkeeping for one account.
 *
 * <p>
 * Thread-safe; read by the health endpoint while pollers write.
 * </p>
 *
 * @since 1.0.0
 */
public class AccountHealth {

    private final String accountId;

    private Instant lastSuccess;
    private Instant lastFailure;
    private String lastError;
    private int consecutiveFailures;
    private long totalPolls;
    private long totalFailures;
    private long totalEvents;

    public AccountHealth(String accountId) {
        this.accountId = accountId;
    }

    synchronized void recordSuccess(Instant at, int events) {
        lastSuccess = at;
        consecutiveFailures = 0;
        totalPolls++;
        totalEvents += events;
    }

    /**
     * @return consecutive failures including this one
     */
    synchronized int recordFailure(Instant at, String reason) {
        lastFailure = at;
        lastError = reason;
        consecutiveFailures++;
        totalPolls++;
        totalFailures++;
        return consecutiveFailures;
    }

    public String getAccountId() {
        return accountId;
    }

    public synchronized Optional<Instant> getLastSuccess() {
        return Optional.ofNullable(lastSuccess);
    }

    public synchronized Optional<Instant> getLastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    public synchronized Optional<String> getLastError() {
        return Optional.ofNullable(lastError);
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized long getTotalPolls() {
        return totalPolls;
    }

    public synchronized long getTotalFailures() {
        return totalFailures;
    }

    public synchronized long getTotalEvents() {
        return totalEvents;
    }

    @Override
    public synchronized String toString() {
        return "AccountHealth{" +
                "accountId='" + accountId + '\'' +
                ", lastSuccess=" + lastSuccess +
                ", consecutiveFailures=" + consecutiveFailures +
                ", totalFailures=" + totalFailures +
                '}';
    }
}
