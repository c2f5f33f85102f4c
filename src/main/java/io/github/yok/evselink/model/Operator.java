package io.github.yok.evselink.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the {@code Operator} table.
 *
 * <p>
 * Operators declared in the feed have a name and no parent. Sub-operators derived from EVSE ids
 * have no name and point at the operator that published the EVSE.
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Operator {

    private String id;

    private String name;

    private String parentId;

    /**
     * Creates a sub-operator row.
     *
     * @param id derived operator id
     * @param parentId id of the declaring operator
     * @return sub-operator row without name
     */
    public static Operator subOperator(String id, String parentId) {
        return new Operator(id, null, parentId);
    }
}
