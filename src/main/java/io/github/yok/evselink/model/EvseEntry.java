package io.github.yok.evselink.model;

import io.github.yok.evselink.feed.EvseDataRecord;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A feed record together with the operator it is attached to.
 *
 * <p>
 * Starts with the id of the operator block that published it and is rewritten to a sub-operator
 * id when the EVSE id says so.
 * </p>
 */
@Data
@AllArgsConstructor
public class EvseEntry {

    private final String operatorId;

    private final EvseDataRecord record;

    /**
     * Returns a copy attached to another operator.
     *
     * @param newOperatorId operator id to attach to
     * @return new entry sharing the same record
     */
    public EvseEntry withOperatorId(String newOperatorId) {
        return new EvseEntry(newOperatorId, record);
    }

    /**
     * Shortcut for {@code getRecord().getEvseId()}.
     *
     * @return EVSE id
     */
    public String evseId() {
        return record.getEvseId();
    }
}
