package io.github.yok.evselink.core;

import io.github.yok.evselink.model.EvseEntry;
import io.github.yok.evselink.model.Operator;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of {@link OperatorResolver#resolve}.
 */
@Getter
@AllArgsConstructor
public class OperatorResolution {

    // One row per redirected EVSE; repeated ids collapse on insert-or-update
    private final List<Operator> subOperators;

    // Input entries in input order, operator ids corrected
    private final List<EvseEntry> entries;
}
