/**
 * Process-level helpers shared by the command-line entry point.
 */
package io.github.yok.evselink.util;
