package org.drwfalls.runtime.cascade;

import org.drwfalls.runtime.model.ColouredRun;
import org.drwfalls.runtime.model.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rows of four removed by {@link TickCascade#eliminateElements}.
 * <p>
 * Rows are kept in a set so that a row found from several settled elements is
 * registered only once.
 */
public final class Eliminated {

    private final Set<ColouredRun> rows;
    private final Set<Position> exposed;

    /**
     * Creates a record of eliminated rows.
     *
     * @param rows the eliminated rows
     * @param exposed positions of elements which lost their partner to the elimination
     */
    public Eliminated(Set<ColouredRun> rows, Set<Position> exposed) {
        this.rows = new LinkedHashSet<>(rows);
        this.exposed = new LinkedHashSet<>(exposed);
    }

    public static Eliminated none() {
        return new Eliminated(Set.of(), Set.of());
    }

    /**
     * Retrieves the colour and position of eliminated rows.
     *
     * @return the rows, in the order they were found
     */
    public Set<ColouredRun> rowsOfFour() {
        return Collections.unmodifiableSet(rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Retrieves the positions of eliminated tiles. A tile covered by two crossing rows is listed once.
     *
     * @return the positions
     */
    public List<Position> positions() {
        Set<Position> positions = new LinkedHashSet<>();
        for (ColouredRun row : rows) {
            for (Position position : row.row()) {
                positions.add(position);
            }
        }
        return new ArrayList<>(positions);
    }

    /**
     * Retrieves the positions of surviving capsule elements which were unbound because
     * their partner was eliminated.
     *
     * @return the exposed positions
     */
    public Set<Position> exposedPositions() {
        return Collections.unmodifiableSet(exposed);
    }
}
