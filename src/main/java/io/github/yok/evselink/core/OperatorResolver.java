package io.github.yok.evselink.core;

import io.github.yok.evselink.model.EvseEntry;
import io.github.yok.evselink.model.Operator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Detects EVSEs that belong to an operator not declared in the feed.
 *
 * <p>
 * An EVSE id starts with the id of its operator, e.g. {@code DE*TBA*E1234} belongs to
 * {@code DE*TBA}. When the feed lists such an EVSE under a different operator block, the EVSE is
 * attached to the operator named by its id instead, and a sub-operator row with the block's
 * operator as parent is emitted.
 * </p>
 *
 * <p>
 * Recognized operator ids:
 * </p>
 * <ul>
 * <li>two letters, optional {@code *}, three alphanumerics ({@code DE*TBA}, {@code DETBA})</li>
 * <li>optional {@code +}, one to three digits, {@code *}, three digits ({@code +49*822})</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class OperatorResolver {

    static final Pattern OPERATOR_ID_PATTERN =
            Pattern.compile("([A-Za-z]{2}\\*?[A-Za-z0-9]{3})|(\\+?[0-9]{1,3}\\*[0-9]{3})");

    /**
     * Returns the operator id embedded in an EVSE id (first match).
     *
     * @param evseId EVSE id
     * @return operator id prefix
     * @throws MalformedEvseIdException if {@code evseId} is {@code null} or has no operator id
     */
    public static String candidateOperatorId(String evseId) {
        if (evseId == null) {
            throw new MalformedEvseIdException(null);
        }
        Matcher m = OPERATOR_ID_PATTERN.matcher(evseId);
        if (!m.find()) {
            throw new MalformedEvseIdException(evseId);
        }
        return m.group();
    }

    /**
     * Corrects the operator id of every entry and collects the sub-operators this implies.
     *
     * @param entries EVSE entries carrying the id of the operator block they were listed under
     * @return sub-operators and corrected entries
     * @throws MalformedEvseIdException if any EVSE id has no operator id
     */
    public OperatorResolution resolve(List<EvseEntry> entries) {
        List<Operator> subOperators = new ArrayList<>();
        List<EvseEntry> resolved = new ArrayList<>(entries.size());

        for (EvseEntry entry : entries) {
            String candidate = candidateOperatorId(entry.evseId());
            if (Objects.equals(candidate, entry.getOperatorId())) {
                resolved.add(entry);
                continue;
            }
            log.debug("EVSE[{}] belongs to sub-operator {} (declared under {})", entry.evseId(),
                    candidate, entry.getOperatorId());
            subOperators.add(Operator.subOperator(candidate, entry.getOperatorId()));
            resolved.add(entry.withOperatorId(candidate));
        }

        log.info("Sub-operator resolution: EVSEs={}, redirected={}, distinct sub-operators={}",
                entries.size(), subOperators.size(),
                subOperators.stream().map(Operator::getId).distinct().count());
        return new OperatorResolution(subOperators, resolved);
    }
}
