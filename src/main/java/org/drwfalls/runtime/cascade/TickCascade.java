package org.drwfalls.runtime.cascade;

import org.drwfalls.runtime.model.CapsuleElement;
import org.drwfalls.runtime.model.ColouredRun;
import org.drwfalls.runtime.model.Direction;
import org.drwfalls.runtime.model.IndexRange;
import org.drwfalls.runtime.model.MovingField;
import org.drwfalls.runtime.model.Position;
import org.drwfalls.runtime.model.RowIndex;
import org.drwfalls.runtime.model.RowOfFour;
import org.drwfalls.runtime.model.StaticField;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * The three steps run once per tick before the moving field advances:
 * settle elements which are about to land, eliminate rows of four formed by them and
 * release elements which lost their support.
 * <p>
 * All steps rely on a bottom-up traversal. When a row is examined, the occupancy of the
 * row below already reflects the current tick, so no second pass is needed.
 */
public final class TickCascade {

    /**
     * Work queue order for unsettling: bottom row first, then rightmost column first.
     */
    static final Comparator<Position> BOTTOM_UP = Comparator
            .comparing(Position::row, Comparator.reverseOrder())
            .thenComparing(Position::column, Comparator.reverseOrder());

    private TickCascade() {
        // Private constructor to prevent instantiation
    }

    /**
     * Settles elements.
     * <p>
     * Every capsule with at least one element which would be moved to an occupied tile
     * with the next tick is transferred to the static field, partner included. Only rows
     * from the top row down to {@code lowest}, inclusive, are processed.
     *
     * @param moving the field of falling elements
     * @param settled the field of settled elements
     * @param lowest the lowest row which may contain falling elements
     * @return the settled positions and the new lowest row still containing falling elements
     */
    public static SettleResult settleElements(MovingField moving, StaticField settled, RowIndex lowest) {
        IndexRange<RowIndex> rows = new IndexRange<>(RowIndex.TOP_ROW, lowest);

        List<Position> positions = new ArrayList<>();
        for (RowIndex row : rows.descending()) {
            for (Position position : Position.completeRow(row)) {
                boolean blocked = position.neighbour(Direction.BELOW).map(settled::isOccupied).orElse(true);
                if (!blocked) {
                    continue;
                }
                Optional<CapsuleElement> element = moving.take(position);
                if (element.isEmpty()) {
                    continue;
                }
                Optional<Position> partner = element.get().partner().flatMap(position::neighbour);
                Optional<CapsuleElement> partnerElement = partner.flatMap(moving::take);

                settled.set(position, element.get());
                positions.add(position);
                if (partnerElement.isPresent()) {
                    settled.set(partner.get(), partnerElement.get());
                    positions.add(partner.get());
                }
            }
        }

        Optional<RowIndex> newLowest = Optional.empty();
        for (RowIndex row : rows.descending()) {
            if (moving.isRowOccupied(row)) {
                newLowest = Optional.of(row);
                break;
            }
        }
        return new SettleResult(new Settled(positions), newLowest);
    }

    /**
     * Eliminates rows of four from the static field.
     * <p>
     * Rows are only searched for at the given settled positions, since a new row can only
     * form through a tile which just changed. Every surviving element whose partner was
     * eliminated is unbound as part of this step.
     *
     * @param settled the field of settled elements
     * @param hints positions of elements settled in this tick
     * @return the eliminated rows and the positions of the unbound survivors
     */
    public static Eliminated eliminateElements(StaticField settled, Settled hints) {
        Set<ColouredRun> rows = new LinkedHashSet<>();
        for (Position hint : hints) {
            RowOfFour.find(settled, hint).ifPresent(rows::add);
        }

        Set<Position> removed = new LinkedHashSet<>();
        Set<Position> exposed = new LinkedHashSet<>();
        for (ColouredRun row : rows) {
            for (Position position : row.row()) {
                removed.add(position);
                settled.take(position).asElement()
                        .flatMap(CapsuleElement::partner)
                        .flatMap(position::neighbour)
                        .ifPresent(partner -> settled.elementAt(partner).ifPresent(survivor -> {
                            survivor.unbind();
                            exposed.add(partner);
                        }));
            }
        }
        exposed.removeAll(removed);
        return new Eliminated(rows, exposed);
    }

    /**
     * Moves elements which lost their support back into the moving field.
     * <p>
     * Candidates are survivors unbound by the elimination and the tiles directly above
     * eliminated ones. Each released element makes the tile above it a candidate too.
     * Candidates are processed bottom row first, rightmost column first.
     *
     * @param moving the field of falling elements
     * @param settled the field of settled elements
     * @param eliminated the outcome of {@link #eliminateElements}
     * @return the lowest row into which elements were released, or empty if none were
     */
    public static Optional<RowIndex> unsettleElements(MovingField moving, StaticField settled, Eliminated eliminated) {
        TreeSet<Position> queue = new TreeSet<>(BOTTOM_UP);
        for (Position position : eliminated.exposedPositions()) {
            if (!isSupported(settled, position, null)) {
                queue.add(position);
            }
        }
        for (Position position : eliminated.positions()) {
            position.neighbour(Direction.ABOVE).ifPresent(queue::add);
        }

        Optional<RowIndex> lowest = Optional.empty();
        while (!queue.isEmpty()) {
            Position position = queue.pollFirst();
            Optional<CapsuleElement> element = settled.elementAt(position);
            if (element.isEmpty()) {
                continue;
            }

            Optional<Position> partner = element.get().partner().map(d -> position.neighbour(d)
                    .orElseThrow(() -> new IllegalStateException("Partner of " + position + " lies outside the field")));
            if (isSupported(settled, position, partner.orElse(null))
                    || partner.map(p -> isSupported(settled, p, position)).orElse(false)) {
                continue;
            }

            List<Position> released = new ArrayList<>(2);
            released.add(position);
            partner.ifPresent(released::add);
            for (Position p : released) {
                CapsuleElement e = settled.take(p).asElement()
                        .orElseThrow(() -> new IllegalStateException("Expected a capsule element at " + p));
                moving.set(p, e);
                if (lowest.isEmpty() || lowest.get().compareTo(p.row()) < 0) {
                    lowest = Optional.of(p.row());
                }
            }
            for (Position p : released) {
                p.neighbour(Direction.ABOVE).ifPresent(queue::add);
            }
        }
        return lowest;
    }

    /**
     * Checks whether the tile below {@code position} is occupied or is the floor.
     * The tile {@code ignored} does not count as support.
     */
    private static boolean isSupported(StaticField settled, Position position, Position ignored) {
        return position.neighbour(Direction.BELOW)
                .map(below -> !below.equals(ignored) && settled.isOccupied(below))
                .orElse(true);
    }
}
