/**
 * Configuration model package for EvseLink.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml}: the destination
 * connection, DBUnit settings, localization anchors and language mapping, and import options.
 * </p>
 */
package io.github.yok.evselink.config;
