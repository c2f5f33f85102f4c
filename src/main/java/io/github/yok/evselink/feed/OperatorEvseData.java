package io.github.yok.evselink.feed;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Data;

/**
 * One operator block of the feed: the declared operator and the EVSE records it publishes.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class OperatorEvseData {

    @JsonProperty("OperatorID")
    private String operatorId;

    @JsonProperty("OperatorName")
    private String operatorName;

    @JsonProperty("EvseDataRecord")
    private List<EvseDataRecord> evseDataRecords;
}
