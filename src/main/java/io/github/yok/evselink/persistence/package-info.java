/**
 * Table layouts, persistence plans and their transactional execution through DBUnit.
 */
package io.github.yok.evselink.persistence;
