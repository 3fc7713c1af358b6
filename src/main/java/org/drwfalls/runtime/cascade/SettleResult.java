package org.drwfalls.runtime.cascade;

import org.drwfalls.runtime.model.RowIndex;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link TickCascade#settleElements}.
 *
 * @param settled the positions of the settled elements
 * @param lowestUnsettled the lowest row still holding falling elements, or empty if none are left
 */
public record SettleResult(Settled settled, Optional<RowIndex> lowestUnsettled) {

    public SettleResult {
        Objects.requireNonNull(settled, "settled");
        Objects.requireNonNull(lowestUnsettled, "lowestUnsettled");
    }
}
