/**
 * Pipeline glue between the differ output, the detectors and alert dispatch.
 *
 * @since 1.0.0
 */
package com.confluencesentinel.core.engine;
