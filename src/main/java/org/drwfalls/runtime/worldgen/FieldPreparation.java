package org.drwfalls.runtime.worldgen;

import org.drwfalls.runtime.Config;
import org.drwfalls.runtime.model.Colour;
import org.drwfalls.runtime.model.IFieldReader;
import org.drwfalls.runtime.model.IndexRange;
import org.drwfalls.runtime.model.Position;
import org.drwfalls.runtime.model.RowIndex;
import org.drwfalls.runtime.model.RowOfFour;
import org.drwfalls.runtime.model.VirusPlacement;
import org.drwfalls.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Prepares a random distribution of viruses for the start of a round.
 * <p>
 * The resulting placements never contain a horizontal or vertical configuration of four
 * or more viruses of the same colour. If a randomly chosen colour would complete such a
 * row, the colour is rotated. In the rare case that all three colours complete a row
 * through the chosen tile, the tile is left free and another one is drawn.
 */
public final class FieldPreparation {

    private static final Logger LOG = LoggerFactory.getLogger(FieldPreparation.class);

    private final IRandomProvider random;

    /**
     * Creates a preparation drawing from the given random provider.
     * @param random Source of randomness.
     */
    public FieldPreparation(IRandomProvider random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Places viruses in the rows from {@code topRow} down to the bottom row.
     * <p>
     * Positions, colours and their order are random. No position is used twice.
     *
     * @param topRow the highest row which may receive a virus
     * @param virusCount the number of viruses to place
     * @return the placements, in the order they were made
     * @throws IllegalArgumentException if the rows cannot hold {@code virusCount} viruses
     */
    public List<VirusPlacement> prepare(RowIndex topRow, int virusCount) {
        IndexRange<RowIndex> rows = new IndexRange<>(topRow, RowIndex.BOTTOM_ROW);
        int area = rows.size() * Config.FIELD_WIDTH;
        if (virusCount < 0 || virusCount > area) {
            throw new IllegalArgumentException(
                    "Cannot place " + virusCount + " viruses in " + area + " tiles below " + topRow);
        }

        ScratchField field = new ScratchField();
        List<Position> candidates = Position.completeRows(rows);
        List<VirusPlacement> placements = new ArrayList<>(virusCount);
        int blocked = 0;
        while (placements.size() < virusCount) {
            Colour colour = Colour.random(random);
            boolean rotation = random.nextBoolean();

            int unfilled = area - placements.size() - blocked;
            if (unfilled <= 0) {
                throw new IllegalStateException("Ran out of tiles after placing " + placements.size() + " of " + virusCount + " viruses");
            }
            Position position = nthFree(field, candidates, random.nextInt(unfilled));

            Optional<Colour> accepted = Optional.empty();
            for (int tried = 0; tried < Colour.values().length && accepted.isEmpty(); tried++) {
                field.set(position, colour);
                if (RowOfFour.find(field, position).isEmpty()) {
                    accepted = Optional.of(colour);
                } else {
                    colour = colour.rotate(rotation);
                }
            }

            if (accepted.isPresent()) {
                placements.add(new VirusPlacement(position, accepted.get()));
            } else {
                // Every colour completes a row through this tile: keep it free.
                field.block(position);
                blocked++;
                LOG.debug("No colour fits at {}, tile left free", position);
            }
        }

        LOG.debug("Prepared {} viruses below {}", placements.size(), topRow);
        return placements;
    }

    private static Position nthFree(ScratchField field, List<Position> candidates, int n) {
        int remaining = n;
        for (Position candidate : candidates) {
            if (field.isFree(candidate)) {
                if (remaining == 0) {
                    return candidate;
                }
                remaining--;
            }
        }
        throw new IllegalStateException("Fewer than " + (n + 1) + " free tiles left");
    }

    /**
     * Field of colours only, mirroring what has been placed so far. Blocked tiles show no
     * colour but are no longer candidates.
     */
    private static final class ScratchField implements IFieldReader {
        private final Colour[][] colours = new Colour[Config.FIELD_HEIGHT][Config.FIELD_WIDTH];
        private final boolean[][] blocked = new boolean[Config.FIELD_HEIGHT][Config.FIELD_WIDTH];

        void set(Position position, Colour colour) {
            colours[position.row().value()][position.column().value()] = colour;
        }

        void block(Position position) {
            set(position, null);
            blocked[position.row().value()][position.column().value()] = true;
        }

        boolean isFree(Position position) {
            return colourAt(position).isEmpty() && !blocked[position.row().value()][position.column().value()];
        }

        @Override
        public Optional<Colour> colourAt(Position position) {
            return Optional.ofNullable(colours[position.row().value()][position.column().value()]);
        }
    }
}
