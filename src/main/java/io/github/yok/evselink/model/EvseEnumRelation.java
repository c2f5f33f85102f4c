package io.github.yok.evselink.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of one of the EVSE-to-enum join tables, e.g. {@code EVSEPlug(evseId, plugId)}.
 *
 * <p>
 * The table and the name of the enum column are given by the
 * {@link io.github.yok.evselink.catalog.EnumCategory} the row was resolved for.
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EvseEnumRelation {

    private String evseId;

    private Integer enumId;
}
