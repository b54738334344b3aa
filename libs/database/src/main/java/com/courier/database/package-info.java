/**
 * Relational storage for the event log.
 *
 * <p>{@link com.courier.database.JdbcEventLog} writes to the {@code domain_events} table created by
 * the Flyway migrations under {@code db/migration}. The classes here use plain {@code JdbcTemplate}
 * and carry no Spring annotations; the service wires them.
 */
package com.courier.database;
