package org.drwfalls.runtime.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RowOfFour#find(IFieldReader, Position)}.
 */
@Tag("unit")
class RowOfFourTest {

    private StaticField field;

    @BeforeEach
    void setUp() {
        field = new StaticField();
    }

    private void virus(int row, int column, Colour colour) {
        field.set(Position.of(row, column), new Virus(colour));
    }

    @Test
    void find_returnsMaximalHorizontalRun() {
        for (int column = 1; column <= 5; column++) {
            virus(10, column, Colour.BLUE);
        }
        virus(10, 6, Colour.RED);

        Optional<ColouredRun> run = RowOfFour.find(field, Position.of(10, 3));

        assertThat(run).isPresent();
        assertThat(run.get().colour()).isEqualTo(Colour.BLUE);
        assertThat(run.get().row()).isEqualTo(
                new RowOfFour.Horizontal(RowIndex.of(10), new IndexRange<>(ColumnIndex.of(1), ColumnIndex.of(5))));
        assertThat(run.get().row().length()).isEqualTo(5);
        assertThat(run.get().row()).containsExactly(
                Position.of(10, 1), Position.of(10, 2), Position.of(10, 3), Position.of(10, 4), Position.of(10, 5));
    }

    @Test
    void find_returnsVerticalRunIfHorizontalIsTooShort() {
        for (int row = 12; row <= 15; row++) {
            virus(row, 0, Colour.YELLOW);
        }
        virus(12, 1, Colour.YELLOW);

        Optional<ColouredRun> run = RowOfFour.find(field, Position.of(12, 0));

        assertThat(run).map(ColouredRun::row).contains(
                new RowOfFour.Vertical(ColumnIndex.of(0), new IndexRange<>(RowIndex.of(12), RowIndex.BOTTOM_ROW)));
        assertThat(run.get().row().covers(Position.of(15, 0))).isTrue();
        assertThat(run.get().row().covers(Position.of(12, 1))).isFalse();
    }

    @Test
    void find_prefersHorizontalRunAtACrossing() {
        for (int column = 2; column <= 5; column++) {
            virus(8, column, Colour.RED);
        }
        for (int row = 5; row <= 8; row++) {
            virus(row, 2, Colour.RED);
        }

        assertThat(RowOfFour.find(field, Position.of(8, 2)))
                .map(ColouredRun::row)
                .containsInstanceOf(RowOfFour.Horizontal.class);
        assertThat(RowOfFour.find(field, Position.of(5, 2)))
                .map(ColouredRun::row)
                .containsInstanceOf(RowOfFour.Vertical.class);
    }

    @Test
    void find_ignoresRunsOfThreeAndOtherColours() {
        virus(15, 0, Colour.RED);
        virus(15, 1, Colour.RED);
        virus(15, 2, Colour.RED);
        virus(15, 3, Colour.BLUE);
        virus(15, 4, Colour.RED);

        assertThat(RowOfFour.find(field, Position.of(15, 1))).isEmpty();
        assertThat(RowOfFour.find(field, Position.of(15, 4))).isEmpty();
    }

    @Test
    void find_isEmptyForUnoccupiedHint() {
        assertThat(RowOfFour.find(field, Position.of(3, 3))).isEmpty();
    }

    @Test
    void find_countsCapsuleElementsAndVirusesAlike() {
        virus(14, 4, Colour.BLUE);
        field.set(Position.of(14, 5), new CapsuleElement(Colour.BLUE, Direction.RIGHT));
        field.set(Position.of(14, 6), new CapsuleElement(Colour.BLUE, Direction.LEFT));
        field.set(Position.of(14, 7), CapsuleElement.single(Colour.BLUE));

        Optional<ColouredRun> fromLeft = RowOfFour.find(field, Position.of(14, 4));
        Optional<ColouredRun> fromRight = RowOfFour.find(field, Position.of(14, 7));

        assertThat(fromLeft).isPresent();
        assertThat(fromLeft).isEqualTo(fromRight);
    }
}
