package com.confluencesentinel.core.alert;

import com.confluencesentinel.core.model.ScopeType;

/**
 * Kind of confluence an alert reports.
 *
 * @since 1.0.0
 */
public enum AlertType {

    /** Several accounts traded the same instrument. */
    CONFLUENCE,

    /** Several accounts traded instruments of the same category. */
    THEME_CONFLUENCE;

    public static AlertType of(ScopeType scopeType) {
        return scopeType == ScopeType.CATEGORY ? THEME_CONFLUENCE : CONFLUENCE;
    }
}
