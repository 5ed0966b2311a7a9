package com.confluencesentinel.core.model;

/**
 * What a correlation scope key refers to.
 *
 * @since 1.0.0
 */
public enum ScopeType {

    /** Scope key is an instrument id, e.g. {@code ETH}. */
    INSTRUMENT,

    /** Scope key is a thematic category id, e.g. {@code AI}. */
    CATEGORY
}
