package com.confluencesentinel.core.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One category entry of the category table YAML.
 *
 * <pre>
 * - id: AI
 *   icon: "🤖"
 *   instruments: [ARKM, FET, RNDR]
 * </pre>
 *
 * @since 1.0.0
 */
public class CategoryDefinition {

    private String id;
    private String icon;
    private List<String> instruments = new ArrayList<>();

    public CategoryDefinition() {
    }

    public CategoryDefinition(String id, String icon, List<String> instruments) {
        this.id = id;
        this.icon = icon;
        setInstruments(instruments);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getIcon() {
        return icon;
    }

    public void setIcon(String icon) {
        this.icon = icon;
    }

    public List<String> getInstruments() {
        return Collections.unmodifiableList(instruments);
    }

    public void setInstruments(List<String> instruments) {
        this.instruments = instruments != null ? new ArrayList<>(instruments) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "CategoryDefinition{" + id + " " + instruments.size() + " instruments}";
    }
}
