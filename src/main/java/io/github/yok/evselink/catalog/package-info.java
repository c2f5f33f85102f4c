/**
 * Enumerated option catalogs (accessibility, plugs, payment options and so on) and their
 * process-wide snapshot.
 */
package io.github.yok.evselink.catalog;
