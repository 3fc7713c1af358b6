package org.drwfalls.runtime.capsule;

import org.drwfalls.runtime.Config;
import org.drwfalls.runtime.model.CapsuleElement;
import org.drwfalls.runtime.model.Colour;
import org.drwfalls.runtime.model.ColumnIndex;
import org.drwfalls.runtime.model.Direction;
import org.drwfalls.runtime.model.MovingField;
import org.drwfalls.runtime.model.MovingRowIndex;
import org.drwfalls.runtime.model.Position;
import org.drwfalls.runtime.model.RowIndex;
import org.drwfalls.runtime.model.StaticField;
import org.drwfalls.runtime.model.Update;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Handle for a player controlled capsule.
 * <p>
 * While its elements occupy tiles in the {@link MovingField}, this type provides the means
 * to move and rotate the capsule. The handle tracks the physical row of the capsule's
 * anchor, which is its top-left element, so it does not need to be updated when the field
 * ticks. The anchor's partner always lies to the right or below; the partner's position is
 * derived from the anchor's binding and never stored.
 */
public final class ControlledCapsule {

    private final MovingRowIndex row;
    private ColumnIndex column;

    private ControlledCapsule(MovingRowIndex row, ColumnIndex column) {
        this.row = row;
        this.column = column;
    }

    /**
     * A freshly spawned capsule and the updates drawing it.
     *
     * @param capsule the handle
     * @param updates the two draw updates, left element first
     */
    public record Spawned(ControlledCapsule capsule, List<Update> updates) {}

    /**
     * Spawns a new, horizontal capsule centred in the current top row of the moving field.
     *
     * @param field the moving field
     * @param left colour of the left element
     * @param right colour of the right element
     * @return the handle and the updates reflecting the new elements
     */
    public static Spawned spawn(MovingField field, Colour left, Colour right) {
        ColumnIndex rightColumn = ColumnIndex.of(Config.FIELD_WIDTH / 2);
        ColumnIndex leftColumn = rightColumn.backwardChecked(1)
                .orElseThrow(() -> new IllegalStateException("Failed to compute left position for new capsule"));

        Position leftPosition = new Position(RowIndex.TOP_ROW, leftColumn);
        Position rightPosition = new Position(RowIndex.TOP_ROW, rightColumn);
        field.set(leftPosition, new CapsuleElement(left, Direction.RIGHT));
        field.set(rightPosition, new CapsuleElement(right, Direction.LEFT));

        ControlledCapsule capsule = new ControlledCapsule(field.movingRowIndex(RowIndex.TOP_ROW), leftColumn);
        return new Spawned(capsule, List.of(Update.draw(leftPosition, left), Update.draw(rightPosition, right)));
    }

    public Optional<List<Update>> moveLeft(MovingField moving, StaticField settled) {
        return apply(Movement.LEFT, moving, settled);
    }

    public Optional<List<Update>> moveRight(MovingField moving, StaticField settled) {
        return apply(Movement.RIGHT, moving, settled);
    }

    public Optional<List<Update>> rotateCw(MovingField moving, StaticField settled) {
        return apply(Movement.ROTATE_CW, moving, settled);
    }

    public Optional<List<Update>> rotateCcw(MovingField moving, StaticField settled) {
        return apply(Movement.ROTATE_CCW, moving, settled);
    }

    /**
     * Applies a movement to the capsule.
     * <p>
     * The movement is rejected if any target tile lies outside the field or is occupied,
     * in which case neither the fields nor the handle change. On success, the returned
     * list holds exactly four updates: both old positions are cleared before both new
     * positions are drawn.
     *
     * @param movement the requested movement
     * @param moving the field holding the capsule
     * @param settled the field of settled elements to check for collisions
     * @return the updates, or empty if the movement was rejected
     * @throws IllegalStateException if the capsule's elements are no longer in the moving field
     */
    public Optional<List<Update>> apply(Movement movement, MovingField moving, StaticField settled) {
        Objects.requireNonNull(movement, "movement");
        Position anchor = anchorPosition(moving);
        CapsuleElement anchorElement = elementAt(moving, anchor);
        Direction binding = anchorElement.partner()
                .orElseThrow(() -> new IllegalStateException("Controlled capsule element at " + anchor + " is unbound"));
        Position partner = anchor.neighbour(binding)
                .orElseThrow(() -> new IllegalStateException("Partner of " + anchor + " lies outside the field"));
        CapsuleElement partnerElement = elementAt(moving, partner);

        Optional<Target> target = switch (movement) {
            case LEFT -> translate(anchor, partner, binding, Direction.LEFT);
            case RIGHT -> translate(anchor, partner, binding, Direction.RIGHT);
            case ROTATE_CW -> rotate(anchor, binding.rotatedCw());
            case ROTATE_CCW -> rotate(anchor, binding.rotatedCcw());
        };

        Optional<Target> accepted = target.filter(t -> isFree(t.anchorElement(), moving, settled, anchor, partner)
                && isFree(t.partnerElement(), moving, settled, anchor, partner));
        if (accepted.isEmpty()) {
            return Optional.empty();
        }
        Target t = accepted.get();

        moving.take(anchor);
        moving.take(partner);
        anchorElement.bindTo(t.binding());
        partnerElement.bindTo(t.binding().opposite());
        moving.set(t.anchorElement(), anchorElement);
        moving.set(t.partnerElement(), partnerElement);

        RowIndex trackedRow = anchor.row();
        column = leftmostInRow(trackedRow, t.anchorElement(), t.partnerElement());

        return Optional.of(List.of(
                Update.clear(anchor),
                Update.clear(partner),
                Update.draw(t.anchorElement(), anchorElement.colour()),
                Update.draw(t.partnerElement(), partnerElement.colour())));
    }

    /**
     * Retrieves the row of the capsule's anchor, which is its top row.
     *
     * @return the moving row index
     */
    public MovingRowIndex row() {
        return row;
    }

    public ColumnIndex column() {
        return column;
    }

    /**
     * Returns the current positions of both elements, anchor first.
     *
     * @param moving the field holding the capsule
     * @return the two positions
     */
    public List<Position> positions(MovingField moving) {
        Position anchor = anchorPosition(moving);
        Direction binding = elementAt(moving, anchor).partner()
                .orElseThrow(() -> new IllegalStateException("Controlled capsule element at " + anchor + " is unbound"));
        Position partner = anchor.neighbour(binding)
                .orElseThrow(() -> new IllegalStateException("Partner of " + anchor + " lies outside the field"));
        return List.of(anchor, partner);
    }

    /**
     * Checks whether the capsule is still falling, i.e. has not been settled.
     *
     * @param moving the field holding the capsule
     * @return true if the anchor element is still in the moving field
     */
    public boolean isFalling(MovingField moving) {
        return moving.isOccupied(anchorPosition(moving));
    }

    private Position anchorPosition(MovingField moving) {
        return new Position(moving.rowIndexFromMoving(row), column);
    }

    private static CapsuleElement elementAt(MovingField moving, Position position) {
        return moving.get(position)
                .orElseThrow(() -> new IllegalStateException("No controlled capsule element at " + position));
    }

    private static Optional<Target> translate(Position anchor, Position partner, Direction binding, Direction towards) {
        return anchor.neighbour(towards)
                .flatMap(a -> partner.neighbour(towards).map(p -> new Target(a, p, binding)));
    }

    /**
     * Places the pair relative to the anchor tile according to the anchor element's new binding.
     * The anchor tile always stays occupied, the second tile is to its right or below.
     */
    private static Optional<Target> rotate(Position anchor, Direction binding) {
        boolean horizontal = binding == Direction.LEFT || binding == Direction.RIGHT;
        Optional<Position> second = anchor.neighbour(horizontal ? Direction.RIGHT : Direction.BELOW);
        boolean anchorLeads = binding == Direction.RIGHT || binding == Direction.BELOW;
        return second.map(s -> anchorLeads ? new Target(anchor, s, binding) : new Target(s, anchor, binding));
    }

    private static boolean isFree(Position target, MovingField moving, StaticField settled, Position... own) {
        if (settled.isOccupied(target)) {
            return false;
        }
        for (Position p : own) {
            if (p.equals(target)) {
                return true;
            }
        }
        return !moving.isOccupied(target);
    }

    private static ColumnIndex leftmostInRow(RowIndex row, Position a, Position b) {
        if (a.row().equals(row) && b.row().equals(row)) {
            return a.column().compareTo(b.column()) <= 0 ? a.column() : b.column();
        }
        if (a.row().equals(row)) {
            return a.column();
        }
        if (b.row().equals(row)) {
            return b.column();
        }
        throw new IllegalStateException("Capsule left its tracked " + row);
    }

    /**
     * Target positions of the current anchor element and its partner, and the anchor element's new binding.
     */
    private record Target(Position anchorElement, Position partnerElement, Direction binding) {}
}
