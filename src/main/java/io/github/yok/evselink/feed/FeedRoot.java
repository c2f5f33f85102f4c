package io.github.yok.evselink.feed;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Root object of an EVSE data feed.
 *
 * <pre>
 * { "EvseData": { "OperatorEvseData": [ ... ] } }
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class FeedRoot {

    @JsonProperty("EvseData")
    private EvseData evseData;

    /**
     * Returns the operator blocks of this feed, never {@code null}.
     *
     * @return operator blocks in feed order
     */
    public List<OperatorEvseData> operatorBlocks() {
        if (evseData == null || evseData.getOperatorEvseData() == null) {
            return new ArrayList<>();
        }
        return evseData.getOperatorEvseData();
    }

    /**
     * Container of the operator blocks.
     */
    @Data
    public static class EvseData {
        @JsonProperty("OperatorEvseData")
        private List<OperatorEvseData> operatorEvseData;
    }
}
