/**
 * Instrument to theme classification backed by a YAML category table.
 *
 * @since 1.0.0
 */
package com.confluencesentinel.core.classify;
