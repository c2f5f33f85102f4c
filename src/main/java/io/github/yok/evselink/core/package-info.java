/**
 * Core import logic.
 *
 * <p>
 * Resolves sub-operators from EVSE ids, maps feed records to rows, extracts translations from
 * the packed additional-info field, resolves option names to join rows, and runs the two import
 * phases through {@link io.github.yok.evselink.core.ImportOrchestrator}.
 * </p>
 */
package io.github.yok.evselink.core;
