/**
 * Alert formatting and asynchronous delivery.
 *
 * @since 1.0.0
 */
package com.confluencesentinel.core.alert;
