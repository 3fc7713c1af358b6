package org.drwfalls.runtime;

import org.drwfalls.runtime.cascade.Eliminated;
import org.drwfalls.runtime.model.Update;

import java.util.List;
import java.util.Objects;

/**
 * Result of a single {@link PlayerField#tick()}.
 *
 * @param tick the number of the tick, starting at 1
 * @param updates the updates for the renderer, to be applied in order
 * @param eliminated the rows eliminated in this tick
 * @param capsuleLanded whether the controlled capsule was settled in this tick
 * @param falling whether elements are still falling after this tick
 */
public record TickOutcome(long tick, List<Update> updates, Eliminated eliminated, boolean capsuleLanded, boolean falling) {

    public TickOutcome {
        updates = List.copyOf(updates);
        Objects.requireNonNull(eliminated, "eliminated");
    }
}
