package com.confluencesentinel.core.alert;

import com.confluencesentinel.core.classify.InstrumentClassifier;
import com.confluencesentinel.core.model.CorrelationGroup;
import com.confluencesentinel.core.model.ScopeType;
import com.confluencesentinel.core.model.TrackedAccount;
import com.confluencesentinel.core.model.TradeAction;
import com.confluencesentinel.core.model.TradeEvent;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Turns a {@link CorrelationGroup} into an {@link AlertPayload}.
 *
 * <p>
 * Pure: the output depends only on the group, the account names and the
 * category icons. Participants are listed by resulting value, largest first.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertFormatter {

    private static final String TARGET = "🎯";
    private static final String GREEN = "🟢";
    private static final String RED = "🔴";
    private static final String CHART = "📈";

    private static final Comparator<TradeEvent> BY_VALUE_DESC = Comparator
            .comparing(TradeEvent::getResultingValue, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(TradeEvent::getAccountId);

    private final Function<String, String> displayNames;
    private final InstrumentClassifier classifier;

    /**
     * Formatter that shows shortened addresses only.
     */
    public AlertFormatter(InstrumentClassifier classifier) {
        this(id -> null, classifier);
    }

    /**
     * @param displayNames account id to display name, may return {@code null} for unknown accounts
     * @param classifier   source of category icons
     */
    public AlertFormatter(Function<String, String> displayNames, InstrumentClassifier classifier) {
        this.displayNames = Objects.requireNonNull(displayNames, "displayNames must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    public AlertPayload format(CorrelationGroup group) {
        Objects.requireNonNull(group, "group must not be null");

        boolean theme = group.getScopeType() == ScopeType.CATEGORY;
        AlertType type = AlertType.of(group.getScopeType());
        TradeEvent trigger = group.getTrigger();
        String icon = theme ? classifier.icon(group.getScopeKey()).orElse(TARGET) : TARGET;

        List<TradeEvent> participants = new ArrayList<>(group.getContributions());
        participants.sort(BY_VALUE_DESC);

        StringBuilder msg = new StringBuilder();
        if (theme) {
            msg.append(icon).append(" **THEME CONFLUENCE DETECTED** ").append(icon).append("\n\n");
            msg.append("**Theme:** ").append(group.getScopeKey()).append('\n');
        } else {
            msg.append(actionIcon(trigger.getAction())).append(" **CONFLUENCE DETECTED** ").append(TARGET)
                    .append("\n\n");
            msg.append("**Instrument:** ").append(group.getScopeKey()).append('\n');
        }
        msg.append("**Accounts:** ").append(group.getParticipantCount())
                .append(" within ").append(describe(group.getWindow()))
                .append(" (threshold ").append(group.getRequiredCount()).append(")\n");
        if (theme) {
            msg.append("**Instruments:** ").append(String.join(", ", group.getInstruments())).append('\n');
        }
        msg.append("**Total value:** ").append(money(group.getTotalValue())).append("\n\n");

        msg.append("**Trigger:**\n");
        msg.append("• Account: ").append(label(trigger.getAccountId())).append('\n');
        if (theme) {
            msg.append("• Instrument: ").append(trigger.getInstrumentId()).append('\n');
        }
        msg.append("• Action: ").append(actionText(trigger)).append('\n');
        if (trigger.getSizeDelta() != null) {
            msg.append("• Size change: ").append(signed(trigger.getSizeDelta())).append('\n');
        }

        msg.append("\n**Participants:**\n");
        int i = 1;
        for (TradeEvent e : participants) {
            msg.append(i++).append(". ").append(label(e.getAccountId())).append(": ");
            if (theme) {
                msg.append(e.getInstrumentId()).append(' ');
            }
            msg.append(actionText(e)).append(", ").append(money(e.getResultingValue()))
                    .append(", ").append(timing(e, trigger)).append('\n');
        }

        String title = (theme ? "THEME CONFLUENCE: " : "CONFLUENCE: ") + group.getScopeKey();
        AlertPayload.Builder payload = AlertPayload.builder()
                .type(type)
                .scopeKey(group.getScopeKey())
                .timestamp(trigger.getTimestamp())
                .title(title)
                .message(msg.toString().stripTrailing())
                .attribute("scopeType", group.getScopeType().name())
                .attribute("participantCount", group.getParticipantCount())
                .attribute("requiredCount", group.getRequiredCount())
                .attribute("totalValue", group.getTotalValue().toPlainString())
                .attribute("windowSeconds", group.getWindow().getSeconds())
                .attribute("windowStart", group.getWindowStart().toString())
                .attribute("windowEnd", group.getWindowEnd().toString())
                .attribute("accounts", List.copyOf(group.getAccountIds()))
                .attribute("instruments", List.copyOf(group.getInstruments()))
                .attribute("triggerAccount", trigger.getAccountId())
                .attribute("triggerInstrument", trigger.getInstrumentId())
                .attribute("triggerAction", trigger.getAction().name());
        if (theme) {
            payload.attribute("categoryIcon", icon);
        }
        return payload.build();
    }

    // ---------------------------------------------------------------
    // Text helpers
    // ---------------------------------------------------------------

    private String label(String accountId) {
        String name = displayNames.apply(accountId);
        String shortId = TrackedAccount.shorten(accountId);
        return name == null || name.isBlank() ? shortId : name + " (" + shortId + ")";
    }

    private static String actionIcon(TradeAction action) {
        switch (action) {
            case OPEN:
                return GREEN;
            case CLOSE:
                return RED;
            default:
                return CHART;
        }
    }

    private static String actionText(TradeEvent e) {
        return e.getSide() == null ? e.getAction().name() : e.getAction() + " " + e.getSide();
    }

    static String money(BigDecimal value) {
        return value == null ? "n/a" : String.format(Locale.ROOT, "$%,.2f", value);
    }

    static String signed(BigDecimal value) {
        String plain = value.stripTrailingZeros().toPlainString();
        return value.signum() > 0 ? "+" + plain : plain;
    }

    static String describe(Duration window) {
        long seconds = window.getSeconds();
        return seconds % 60 == 0 ? (seconds / 60) + "min" : seconds + "s";
    }

    private static String timing(TradeEvent e, TradeEvent trigger) {
        long minutes = Duration.between(e.getTimestamp(), trigger.getTimestamp()).toMinutes();
        return minutes < 1 ? "just now" : minutes + "m ago";
    }
}
