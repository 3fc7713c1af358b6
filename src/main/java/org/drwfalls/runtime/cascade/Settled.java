package org.drwfalls.runtime.cascade;

import org.drwfalls.runtime.model.Position;

import java.util.Iterator;
import java.util.List;

/**
 * Positions of elements which were just settled, in the order they were settled.
 *
 * @param positions the positions
 */
public record Settled(List<Position> positions) implements Iterable<Position> {

    public Settled {
        positions = List.copyOf(positions);
    }

    public static Settled none() {
        return new Settled(List.of());
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }

    public int size() {
        return positions.size();
    }

    @Override
    public Iterator<Position> iterator() {
        return positions.iterator();
    }
}
