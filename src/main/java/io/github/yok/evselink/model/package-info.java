/**
 * Rows written to the destination tables, plus {@link io.github.yok.evselink.model.EvseEntry}
 * which carries a feed record through operator resolution.
 */
package io.github.yok.evselink.model;
