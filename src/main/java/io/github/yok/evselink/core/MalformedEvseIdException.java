package io.github.yok.evselink.core;

import lombok.Getter;

/**
 * Thrown when an EVSE id does not contain an operator id prefix.
 *
 * <p>
 * Without the prefix the EVSE cannot be attached to an operator, so the station phase is aborted.
 * </p>
 */
@Getter
public class MalformedEvseIdException extends ImportException {

    private static final long serialVersionUID = 1L;

    private final String evseId;

    /**
     * Creates an exception for the given EVSE id.
     *
     * @param evseId offending EVSE id (may be {@code null})
     */
    public MalformedEvseIdException(String evseId) {
        super("EVSE id does not contain an operator id: " + evseId);
        this.evseId = evseId;
    }
}
