/**
 * Country-to-language lookup used when building translation rows.
 */
package io.github.yok.evselink.lookup;
