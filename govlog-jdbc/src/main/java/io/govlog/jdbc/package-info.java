/**
 * JDBC-backed {@link io.govlog.spi.EventLog}: connection handling, SQL error translation
 * and the durable {@link io.govlog.jdbc.JdbcEventLog}.
 */
package io.govlog.jdbc;
