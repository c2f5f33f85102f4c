package io.github.yok.evselink.core;

import io.github.yok.evselink.catalog.EnumCategory;
import io.github.yok.evselink.model.EvseEnumRelation;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Join rows of one category plus the option names that matched no catalog entry.
 */
@Getter
@AllArgsConstructor
public class EnumResolution {

    private final EnumCategory category;

    private final List<EvseEnumRelation> rows;

    // option name -> occurrences
    private final Map<String, Integer> unresolved;

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
