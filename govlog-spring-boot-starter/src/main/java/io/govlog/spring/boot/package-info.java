/**
 * Spring Boot auto-configuration for the governance event store.
 *
 * <p>Add the starter and a {@link javax.sql.DataSource}; an
 * {@link io.govlog.store.EventStore} bean is created from {@code govlog.*} properties.
 */
package io.govlog.spring.boot;
