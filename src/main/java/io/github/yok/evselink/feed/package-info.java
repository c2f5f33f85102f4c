/**
 * Feed model and reader.
 *
 * <p>
 * Classes in this package mirror the published JSON layout of the operator/EVSE feed. They are
 * read once per run and never persisted as-is; {@code core} flattens them into table rows.
 * </p>
 */
package io.github.yok.evselink.feed;
