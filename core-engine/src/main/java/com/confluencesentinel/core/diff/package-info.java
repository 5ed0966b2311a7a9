/**
 * Snapshot diffing: from position snapshots to normalised trade events.
 *
 * @since 1.0.0
 */
package com.confluencesentinel.core.diff;
