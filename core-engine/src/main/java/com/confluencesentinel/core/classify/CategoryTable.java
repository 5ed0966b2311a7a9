package com.confluencesentinel.core.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Versioned mapping of instruments to thematic categories.
 *
 * <p>
 * Deserialized from YAML by {@link CategoryTableLoader}. After
 * {@link #validate()} succeeds the table is indexed and can be queried with
 * {@link #categoryOf(String)}; lookups are case-insensitive.
 * </p>
 *
 * @since 1.0.0
 */
public class CategoryTable {

    private String version = "unversioned";
    private List<CategoryDefinition> categories = new ArrayList<>();

    private Map<String, String> instrumentIndex = Map.of();
    private Map<String, CategoryDefinition> categoryIndex = Map.of();

    /**
     * Validate the table and build the lookup indexes.
     *
     * <p>
     * Every category needs a non-blank id and every instrument may belong to
     * at most one category. All problems are collected and reported together.
     * </p>
     *
     * @return this table, for chaining
     * @throws IllegalStateException if the table is invalid
     */
    public CategoryTable validate() {
        List<String> errors = new ArrayList<>();
        Map<String, String> instruments = new LinkedHashMap<>();
        Map<String, CategoryDefinition> byId = new LinkedHashMap<>();

        for (int i = 0; i < categories.size(); i++) {
            CategoryDefinition def = categories.get(i);
            if (def == null || def.getId() == null || def.getId().isBlank()) {
                errors.add("Category at index " + i + " has no 'id'");
                continue;
            }
            String categoryId = def.getId().trim().toUpperCase(Locale.ROOT);
            if (byId.putIfAbsent(categoryId, def) != null) {
                errors.add("Category '" + categoryId + "' is defined twice");
                continue;
            }
            for (String instrument : def.getInstruments()) {
                if (instrument == null || instrument.isBlank()) {
                    errors.add("Category '" + categoryId + "' lists a blank instrument");
                    continue;
                }
                String key = normalise(instrument);
                String previous = instruments.putIfAbsent(key, categoryId);
                if (previous == null) {
                    continue;
                }
                if (previous.equals(categoryId)) {
                    errors.add("Instrument '" + key + "' is listed twice in '" + categoryId + "'");
                } else {
                    errors.add("Instrument '" + key + "' is listed in both '" + previous
                            + "' and '" + categoryId + "'");
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Category table validation failed:\n  - " + String.join("\n  - ", errors));
        }
        this.instrumentIndex = Collections.unmodifiableMap(instruments);
        this.categoryIndex = Collections.unmodifiableMap(byId);
        return this;
    }

    /**
     * @param instrumentId instrument id, any case
     * @return category id, or empty if the instrument is not classified
     */
    public Optional<String> categoryOf(String instrumentId) {
        if (instrumentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(instrumentIndex.get(normalise(instrumentId)));
    }

    /**
     * @param categoryId category id
     * @return display icon, or empty if none is configured
     */
    public Optional<String> iconOf(String categoryId) {
        if (categoryId == null) {
            return Optional.empty();
        }
        CategoryDefinition def = categoryIndex.get(categoryId.toUpperCase(Locale.ROOT));
        return def == null ? Optional.empty() : Optional.ofNullable(def.getIcon());
    }

    /**
     * @return number of classified instruments
     */
    public int instrumentCount() {
        return instrumentIndex.size();
    }

    /**
     * @return category ids in declaration order
     */
    public List<String> categoryIds() {
        return List.copyOf(categoryIndex.keySet());
    }

    private static String normalise(String instrumentId) {
        return instrumentId.trim().toUpperCase(Locale.ROOT);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public List<CategoryDefinition> getCategories() {
        return Collections.unmodifiableList(categories);
    }

    public void setCategories(List<CategoryDefinition> categories) {
        this.categories = categories != null ? new ArrayList<>(categories) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "CategoryTable{version='" + version + "', categories=" + categoryIndex.size()
                + ", instruments=" + instrumentIndex.size() + '}';
    }
}
