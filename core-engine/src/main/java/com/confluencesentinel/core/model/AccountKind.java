package com.confluencesentinel.core.model;

/**
 * Kind of tracked exchange account.
 *
 * @since 1.0.0
 */
public enum AccountKind {

    /** A managed vault with its own address. */
    VAULT,

    /** A plain trader wallet. */
    WALLET
}
