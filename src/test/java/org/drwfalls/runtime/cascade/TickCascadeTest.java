package org.drwfalls.runtime.cascade;

import org.drwfalls.runtime.capsule.ControlledCapsule;
import org.drwfalls.runtime.model.CapsuleElement;
import org.drwfalls.runtime.model.ColouredRun;
import org.drwfalls.runtime.model.Colour;
import org.drwfalls.runtime.model.Direction;
import org.drwfalls.runtime.model.MovingField;
import org.drwfalls.runtime.model.Position;
import org.drwfalls.runtime.model.RowIndex;
import org.drwfalls.runtime.model.RowOfFour;
import org.drwfalls.runtime.model.StaticField;
import org.drwfalls.runtime.model.TileContents;
import org.drwfalls.runtime.model.Virus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the settle, eliminate and unsettle steps of {@link TickCascade}.
 */
@Tag("unit")
class TickCascadeTest {

    private MovingField moving;
    private StaticField settled;

    @BeforeEach
    void setUp() {
        moving = new MovingField();
        settled = new StaticField();
    }

    private void virus(int row, int column, Colour colour) {
        settled.set(Position.of(row, column), new Virus(colour));
    }

    private int totalElements() {
        return moving.elementCount() + settled.occupiedCount();
    }

    @Nested
    class Settling {

        @Test
        void capsuleSettlesOnTheFloor() {
            ControlledCapsule capsule = ControlledCapsule.spawn(moving, Colour.RED, Colour.YELLOW).capsule();
            Optional<RowIndex> lowest = Optional.of(RowIndex.TOP_ROW);

            for (int tick = 0; tick < 15; tick++) {
                SettleResult result = TickCascade.settleElements(moving, settled, lowest.orElseThrow());
                assertThat(result.settled().isEmpty()).isTrue();
                moving.tick();
                lowest = result.lowestUnsettled().flatMap(r -> r.forwardChecked(1));
            }
            assertThat(lowest).contains(RowIndex.BOTTOM_ROW);

            SettleResult result = TickCascade.settleElements(moving, settled, RowIndex.BOTTOM_ROW);

            assertThat(result.settled()).containsExactly(Position.of(15, 3), Position.of(15, 4));
            assertThat(result.lowestUnsettled()).isEmpty();
            assertThat(capsule.isFalling(moving)).isFalse();
            assertThat(settled.elementAt(Position.of(15, 3))).contains(new CapsuleElement(Colour.RED, Direction.RIGHT));
            assertThat(moving.elementCount()).isZero();
        }

        @Test
        void settlingIsIdempotent() {
            moving.set(Position.of(15, 0), CapsuleElement.single(Colour.BLUE));
            TickCascade.settleElements(moving, settled, RowIndex.BOTTOM_ROW);

            SettleResult again = TickCascade.settleElements(moving, settled, RowIndex.BOTTOM_ROW);

            assertThat(again.settled().isEmpty()).isTrue();
            assertThat(again.lowestUnsettled()).isEmpty();
            assertThat(settled.occupiedCount()).isEqualTo(1);
        }

        @Test
        void horizontalCapsuleSettlesWhenOneHalfIsBlocked() {
            virus(9, 5, Colour.BLUE);
            moving.set(Position.of(8, 4), new CapsuleElement(Colour.RED, Direction.RIGHT));
            moving.set(Position.of(8, 5), new CapsuleElement(Colour.RED, Direction.LEFT));

            SettleResult result = TickCascade.settleElements(moving, settled, RowIndex.of(8));

            assertThat(result.settled()).containsExactly(Position.of(8, 5), Position.of(8, 4));
            assertThat(moving.isRowOccupied(RowIndex.of(8))).isFalse();
        }

        @Test
        void stackedElementsSettleInOneTick() {
            virus(12, 2, Colour.YELLOW);
            moving.set(Position.of(11, 2), CapsuleElement.single(Colour.RED));
            moving.set(Position.of(10, 2), CapsuleElement.single(Colour.BLUE));
            moving.set(Position.of(4, 6), CapsuleElement.single(Colour.BLUE));

            SettleResult result = TickCascade.settleElements(moving, settled, RowIndex.of(11));

            assertThat(result.settled()).containsExactly(Position.of(11, 2), Position.of(10, 2));
            assertThat(result.lowestUnsettled()).contains(RowIndex.of(4));
        }

        @Test
        void rowsBelowLowestAreNotInspected() {
            moving.set(Position.of(15, 1), CapsuleElement.single(Colour.RED));

            SettleResult result = TickCascade.settleElements(moving, settled, RowIndex.of(10));

            assertThat(result.settled().isEmpty()).isTrue();
            assertThat(moving.isOccupied(Position.of(15, 1))).isTrue();
        }
    }

    @Nested
    class Eliminating {

        @BeforeEach
        void setUpRow() {
            virus(3, 2, Colour.RED);
            virus(3, 3, Colour.RED);
            settled.set(Position.of(3, 4), new CapsuleElement(Colour.RED, Direction.ABOVE));
            settled.set(Position.of(2, 4), new CapsuleElement(Colour.BLUE, Direction.BELOW));
            settled.set(Position.of(3, 5), CapsuleElement.single(Colour.RED));
        }

        @Test
        void rowOfFourIsRemovedAndPartnerUnbound() {
            List<Position> run = List.of(Position.of(3, 2), Position.of(3, 3), Position.of(3, 4), Position.of(3, 5));
            Position partner = Position.of(2, 4);
            Map<Position, TileContents> before = new HashMap<>();
            for (Position position : Position.completeRows(RowIndex.ROWS)) {
                if (!run.contains(position) && !position.equals(partner)) {
                    before.put(position, settled.get(position));
                }
            }

            Eliminated eliminated = TickCascade.eliminateElements(settled, new Settled(List.of(Position.of(3, 4))));

            assertThat(eliminated.rowCount()).isEqualTo(1);
            assertThat(eliminated.positions()).containsExactly(
                    Position.of(3, 2), Position.of(3, 3), Position.of(3, 4), Position.of(3, 5));
            assertThat(eliminated.exposedPositions()).containsExactly(Position.of(2, 4));
            for (Position position : eliminated.positions()) {
                assertThat(settled.isOccupied(position)).isFalse();
            }
            assertThat(settled.elementAt(partner)).contains(CapsuleElement.single(Colour.BLUE));
            before.forEach((position, contents) ->
                    assertThat(settled.get(position)).as("tile %s", position).isSameAs(contents));
            assertThat(settled.occupiedCount()).isEqualTo(1);
        }

        @Test
        void rowFoundFromSeveralHintsIsRegisteredOnce() {
            Eliminated eliminated = TickCascade.eliminateElements(settled,
                    new Settled(List.of(Position.of(3, 4), Position.of(3, 5))));

            assertThat(eliminated.rowsOfFour()).hasSize(1);
            assertThat(eliminated.rowsOfFour().iterator().next())
                    .extracting(ColouredRun::colour)
                    .isEqualTo(Colour.RED);
        }

        @Test
        void crossingRowsShareTheirCommonTile() {
            settled.set(Position.of(2, 5), CapsuleElement.single(Colour.RED));
            settled.set(Position.of(1, 5), CapsuleElement.single(Colour.RED));
            settled.set(Position.of(0, 5), CapsuleElement.single(Colour.RED));

            Eliminated eliminated = TickCascade.eliminateElements(settled,
                    new Settled(List.of(Position.of(3, 5), Position.of(0, 5))));

            assertThat(eliminated.rowCount()).isEqualTo(2);
            assertThat(eliminated.positions()).hasSize(7).doesNotHaveDuplicates();
            assertThat(eliminated.rowsOfFour()).extracting(ColouredRun::row)
                    .hasAtLeastOneElementOfType(RowOfFour.Vertical.class);
        }

        @Test
        void nothingIsEliminatedWithoutHints() {
            Eliminated eliminated = TickCascade.eliminateElements(settled, Settled.none());

            assertThat(eliminated.isEmpty()).isTrue();
            assertThat(settled.occupiedCount()).isEqualTo(5);
        }
    }

    @Nested
    class Unsettling {

        @Test
        void exposedElementIsReleased() {
            virus(3, 2, Colour.RED);
            virus(3, 3, Colour.RED);
            settled.set(Position.of(3, 4), new CapsuleElement(Colour.RED, Direction.ABOVE));
            settled.set(Position.of(2, 4), new CapsuleElement(Colour.BLUE, Direction.BELOW));
            settled.set(Position.of(3, 5), CapsuleElement.single(Colour.RED));
            int before = totalElements();

            Eliminated eliminated = TickCascade.eliminateElements(settled, new Settled(List.of(Position.of(3, 4))));
            Optional<RowIndex> lowest = TickCascade.unsettleElements(moving, settled, eliminated);

            assertThat(lowest).contains(RowIndex.of(2));
            assertThat(moving.colourAt(Position.of(2, 4))).contains(Colour.BLUE);
            assertThat(settled.isOccupied(Position.of(2, 4))).isFalse();
            assertThat(totalElements()).isEqualTo(before - eliminated.positions().size());
        }

        @Test
        void stackAboveEliminatedTileIsReleasedAsAWhole() {
            for (int column = 0; column < 4; column++) {
                virus(14, column, Colour.YELLOW);
            }
            settled.set(Position.of(13, 1), CapsuleElement.single(Colour.BLUE));
            settled.set(Position.of(12, 1), new CapsuleElement(Colour.RED, Direction.ABOVE));
            settled.set(Position.of(11, 1), new CapsuleElement(Colour.RED, Direction.BELOW));
            int before = totalElements();

            Eliminated eliminated = TickCascade.eliminateElements(settled, new Settled(List.of(Position.of(14, 3))));
            Optional<RowIndex> lowest = TickCascade.unsettleElements(moving, settled, eliminated);

            assertThat(lowest).contains(RowIndex.of(13));
            assertThat(moving.elementCount()).isEqualTo(3);
            assertThat(moving.get(Position.of(12, 1))).contains(new CapsuleElement(Colour.RED, Direction.ABOVE));
            assertThat(settled.occupiedCount()).isZero();
            assertThat(totalElements()).isEqualTo(before - 4);
        }

        @Test
        void horizontalCapsuleWithOneSupportedHalfStays() {
            for (int column = 0; column < 4; column++) {
                virus(14, column, Colour.YELLOW);
            }
            virus(14, 4, Colour.BLUE);
            settled.set(Position.of(13, 3), new CapsuleElement(Colour.RED, Direction.RIGHT));
            settled.set(Position.of(13, 4), new CapsuleElement(Colour.BLUE, Direction.LEFT));

            Eliminated eliminated = TickCascade.eliminateElements(settled, new Settled(List.of(Position.of(14, 0))));
            Optional<RowIndex> lowest = TickCascade.unsettleElements(moving, settled, eliminated);

            assertThat(lowest).isEmpty();
            assertThat(settled.elementAt(Position.of(13, 3))).isPresent();
            assertThat(moving.elementCount()).isZero();
        }

        @Test
        void virusesNeverFall() {
            for (int column = 4; column < 8; column++) {
                virus(15, column, Colour.RED);
            }
            virus(14, 6, Colour.BLUE);

            Eliminated eliminated = TickCascade.eliminateElements(settled, new Settled(List.of(Position.of(15, 7))));
            Optional<RowIndex> lowest = TickCascade.unsettleElements(moving, settled, eliminated);

            assertThat(lowest).isEmpty();
            assertThat(settled.get(Position.of(14, 6)).asVirus()).isPresent();
        }

        @Test
        void workQueueVisitsBottomRowFirstThenRightmostColumn() {
            List<Position> ordered = new ArrayList<>(List.of(
                    Position.of(3, 1), Position.of(9, 0), Position.of(9, 5), Position.of(3, 7)));

            ordered.sort(TickCascade.BOTTOM_UP);

            assertThat(ordered).containsExactly(
                    Position.of(9, 5), Position.of(9, 0), Position.of(3, 7), Position.of(3, 1));
        }
    }
}
