/**
 * Scheduling of snapshot polls and per-account bookkeeping.
 *
 * @since 1.0.0
 */
package com.confluencesentinel.core.poller;
