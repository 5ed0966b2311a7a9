package com.confluencesentinel.core.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Maps instruments to at most one thematic category.
 *
 * <p>
 * Backed by a validated {@link CategoryTable}. {@link #reload(CategoryTable)}
 * swaps the table atomically; lookups in flight finish against the table
 * they started with.
 * </p>
 *
 * @since 1.0.0
 */
public class InstrumentClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(InstrumentClassifier.class);

    private final AtomicReference<CategoryTable> table;

    /**
     * @param table validated category table
     */
    public InstrumentClassifier(CategoryTable table) {
        this.table = new AtomicReference<>(Objects.requireNonNull(table, "table must not be null"));
    }

    /**
     * @param instrumentId instrument id
     * @return category id, or empty for unknown instruments
     */
    public Optional<String> classify(String instrumentId) {
        return table.get().categoryOf(instrumentId);
    }

    /**
     * @param categoryId category id
     * @return icon configured for the category, if any
     */
    public Optional<String> icon(String categoryId) {
        return table.get().iconOf(categoryId);
    }

    /**
     * Replace the active table.
     *
     * @param newTable validated table
     */
    public void reload(CategoryTable newTable) {
        Objects.requireNonNull(newTable, "table must not be null");
        CategoryTable old = table.getAndSet(newTable);
        LOG.info("Category table reloaded: version {} -> {} ({} instruments)",
                old.getVersion(), newTable.getVersion(), newTable.instrumentCount());
    }

    /**
     * @return version string of the active table
     */
    public String version() {
        return table.get().getVersion();
    }
}
