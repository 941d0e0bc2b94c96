/**
 * Internal utilities.
 */
package io.govlog.util;
