package io.github.yok.evselink.feed;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * Wrapped list of free-text option names, e.g.
 * {@code "Plugs": {"Plug": ["Type 2 Outlet", "Type F Schuko"]}}.
 *
 * <p>
 * The name of the inner element differs per category, so every inner list is collected.
 * </p>
 */
@Getter
public class OptionNames {

    private final List<String> names = new ArrayList<>();

    /**
     * Creates an empty list.
     */
    public OptionNames() {
    }

    /**
     * Creates a list holding the given names.
     *
     * @param names option names
     */
    public OptionNames(List<String> names) {
        this.names.addAll(names);
    }

    @JsonAnySetter
    void addInner(String element, List<String> values) {
        if (values != null) {
            names.addAll(values);
        }
    }
}
