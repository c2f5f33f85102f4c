package io.github.yok.evselink.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Outcome of one import run: rows written per table and option names that could not be
 * resolved.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ImportSummary {

    // table -> rows written (insert-or-update calls, duplicates included)
    private final Map<String, Integer> writtenRows = new LinkedHashMap<>();

    // join table -> (option name -> occurrences)
    private final Map<String, Map<String, Integer>> unresolvedOptions = new LinkedHashMap<>();

    void addWritten(String table, int rows) {
        writtenRows.merge(table, rows, Integer::sum);
    }

    void addUnresolved(String table, Map<String, Integer> names) {
        if (!names.isEmpty()) {
            unresolvedOptions.computeIfAbsent(table, k -> new LinkedHashMap<>()).putAll(names);
        }
    }

    public Map<String, Integer> getWrittenRows() {
        return Collections.unmodifiableMap(writtenRows);
    }

    public Map<String, Map<String, Integer>> getUnresolvedOptions() {
        return Collections.unmodifiableMap(unresolvedOptions);
    }

    /**
     * Number of rows written to a table.
     *
     * @param table table name
     * @return row count, {@code 0} if nothing was written
     */
    public int written(String table) {
        return writtenRows.getOrDefault(table, 0);
    }

    /**
     * Total number of unresolved option occurrences over all categories.
     *
     * @return occurrence count
     */
    public int unresolvedCount() {
        return unresolvedOptions.values().stream().flatMap(m -> m.values().stream())
                .mapToInt(Integer::intValue).sum();
    }

    /**
     * Writes the summary to the log.
     */
    public void log() {
        log.info("===== Summary =====");
        int maxNameLen = writtenRows.keySet().stream().mapToInt(String::length).max().orElse(0);
        int maxCountDigits = writtenRows.values().stream().map(cnt -> String.valueOf(cnt).length())
                .mapToInt(Integer::intValue).max().orElse(0);
        String fmt = "  Table[%-" + maxNameLen + "s] Written=%" + maxCountDigits + "d";
        writtenRows.forEach((table, cnt) -> log.info(String.format(fmt, table, cnt)));
        unresolvedOptions.forEach((table, names) -> log
                .warn("  Table[{}] Unresolved options (dropped): {}", table, names));
        log.info("== Import has completed ==");
    }
}
