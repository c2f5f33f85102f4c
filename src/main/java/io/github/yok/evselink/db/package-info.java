/**
 * Destination database access.
 *
 * <p>
 * Opens the JDBC connection and configures the DBUnit connection wrapped around it for the
 * destination product (MySQL, PostgreSQL or H2).
 * </p>
 */
package io.github.yok.evselink.db;
