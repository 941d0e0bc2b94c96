/**
 * Per-database event table dialects, discovered through {@link java.util.ServiceLoader}.
 */
package io.govlog.jdbc.store;
