package org.drwfalls.runtime;

import org.drwfalls.runtime.capsule.ControlledCapsule;
import org.drwfalls.runtime.capsule.Movement;
import org.drwfalls.runtime.cascade.Eliminated;
import org.drwfalls.runtime.cascade.SettleResult;
import org.drwfalls.runtime.cascade.Settled;
import org.drwfalls.runtime.cascade.TickCascade;
import org.drwfalls.runtime.model.Colour;
import org.drwfalls.runtime.model.ColumnIndex;
import org.drwfalls.runtime.model.MovingField;
import org.drwfalls.runtime.model.Position;
import org.drwfalls.runtime.model.RowIndex;
import org.drwfalls.runtime.model.SingleCapsule;
import org.drwfalls.runtime.model.StaticField;
import org.drwfalls.runtime.model.Update;
import org.drwfalls.runtime.model.Virus;
import org.drwfalls.runtime.model.VirusPlacement;
import org.drwfalls.runtime.spi.IRandomProvider;
import org.drwfalls.runtime.worldgen.FieldPreparation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The playing field of a single player for the duration of a round.
 * <p>
 * Owns the player's pair of fields and composes the field operations into the per-tick
 * pipeline: settle, eliminate, unsettle, then let the moving field fall by one row. It
 * keeps track of the controlled capsule and of the lowest row which may hold falling
 * elements. Instances are not thread-safe; each field is driven by a single task.
 */
public class PlayerField {

    private static final Logger LOG = LoggerFactory.getLogger(PlayerField.class);

    private final FieldSettings settings;
    private final StaticField settled;
    private final MovingField moving;
    private ControlledCapsule capsule;
    private Optional<RowIndex> lowestUnsettled = Optional.empty();
    private long currentTick = 0L;

    /**
     * Creates an empty field.
     * @param settings The round parameters.
     */
    public PlayerField(FieldSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.settled = new StaticField();
        this.moving = new MovingField();
    }

    /**
     * Places the configured number of viruses below the cleared top rows.
     *
     * @param random the source of randomness for positions and colours
     * @return the updates drawing the viruses
     */
    public List<Update> prepare(IRandomProvider random) {
        List<VirusPlacement> placements = new FieldPreparation(random)
                .prepare(settings.virusTopRow(), settings.virusCount());
        List<Update> updates = new ArrayList<>(placements.size());
        for (VirusPlacement placement : placements) {
            settled.set(placement.position(), new Virus(placement.colour()));
            updates.add(placement.toUpdate());
        }
        LOG.info("Prepared field with {} viruses from {} down", placements.size(), settings.virusTopRow());
        return updates;
    }

    /**
     * Spawns a new player controlled capsule at the top of the field.
     *
     * @param left colour of the left element
     * @param right colour of the right element
     * @return the updates drawing the capsule
     * @throws IllegalStateException if a capsule is still controlled or the spawn tiles are occupied
     */
    public List<Update> spawnCapsule(Colour left, Colour right) {
        if (capsule != null) {
            throw new IllegalStateException("A controlled capsule is still falling");
        }
        for (int column : new int[] {Config.FIELD_WIDTH / 2 - 1, Config.FIELD_WIDTH / 2}) {
            requireFreeSpawnTile(Position.of(RowIndex.TOP_ROW.value(), column));
        }
        ControlledCapsule.Spawned spawned = ControlledCapsule.spawn(moving, left, right);
        capsule = spawned.capsule();
        mergeLowest(Optional.of(RowIndex.TOP_ROW));
        return spawned.updates();
    }

    /**
     * Spawns a capsule in random colours.
     *
     * @param random the source of randomness
     * @return the updates drawing the capsule
     */
    public List<Update> spawnRandomCapsule(IRandomProvider random) {
        return spawnCapsule(Colour.random(random), Colour.random(random));
    }

    /**
     * Drops single, unbound elements into the top row, e.g. as a penalty caused by another player.
     *
     * Nothing is spawned unless every target tile is free.
     *
     * @param capsules columns and colours of the elements
     * @return the updates drawing the elements
     * @throws IllegalStateException if a target tile is occupied in either field or named twice
     */
    public List<Update> spawnSingleCapsules(List<SingleCapsule> capsules) {
        if (capsules.isEmpty()) {
            return List.of();
        }
        Set<ColumnIndex> columns = new HashSet<>();
        for (SingleCapsule single : capsules) {
            if (!columns.add(single.column())) {
                throw new IllegalStateException("Column " + single.column() + " is targeted twice");
            }
            requireFreeSpawnTile(new Position(RowIndex.TOP_ROW, single.column()));
        }
        List<Update> updates = moving.spawnSingleCapsules(capsules);
        mergeLowest(Optional.of(RowIndex.TOP_ROW));
        return updates;
    }

    /**
     * Applies a player's movement to the controlled capsule.
     *
     * @param movement the movement
     * @return the updates, or empty if there is no controlled capsule or the movement was rejected
     */
    public Optional<List<Update>> applyMovement(Movement movement) {
        if (capsule == null) {
            return Optional.empty();
        }
        Optional<List<Update>> updates = capsule.apply(movement, moving, settled);
        if (updates.isPresent()) {
            for (Position position : capsule.positions(moving)) {
                mergeLowest(Optional.of(position.row()));
            }
        } else {
            LOG.debug("Tick={} movement {} rejected", currentTick, movement);
        }
        return updates;
    }

    /**
     * Executes a single tick: settles landing elements, eliminates rows of four formed by
     * them, releases elements which lost their support and moves all falling elements
     * down one row.
     *
     * @return the outcome, including the updates for the renderer
     */
    public TickOutcome tick() {
        currentTick++;

        Settled settledNow = Settled.none();
        Optional<RowIndex> lowest = lowestUnsettled;
        if (lowest.isPresent()) {
            SettleResult result = TickCascade.settleElements(moving, settled, lowest.get());
            settledNow = result.settled();
            lowest = result.lowestUnsettled();
        }

        boolean capsuleLanded = capsule != null && !capsule.isFalling(moving);
        if (capsuleLanded) {
            capsule = null;
        }

        Eliminated eliminated = TickCascade.eliminateElements(settled, settledNow);
        Optional<RowIndex> released = TickCascade.unsettleElements(moving, settled, eliminated);
        lowestUnsettled = lowest;
        mergeLowest(released);

        List<Update> updates = new ArrayList<>();
        for (Position position : eliminated.positions()) {
            updates.add(Update.clear(position));
        }
        updates.addAll(moving.tick());
        lowestUnsettled = lowestUnsettled.map(row -> row.forwardChecked(1).orElseThrow(() ->
                new IllegalStateException("Falling elements left in the bottom row after settling")));

        if (!settledNow.isEmpty() || !eliminated.isEmpty()) {
            LOG.debug("Tick={} settled={} eliminatedRows={} released={} lowest={}",
                    currentTick, settledNow.size(), eliminated.rowCount(), released.isPresent(), lowestUnsettled);
        }
        return new TickOutcome(currentTick, updates, eliminated, capsuleLanded, lowestUnsettled.isPresent());
    }

    /**
     * Ticks until no elements are falling any more, but at most
     * {@link FieldSettings#maxCascadeTicks()} times.
     *
     * @return the outcomes of all executed ticks
     */
    public List<TickOutcome> resolveCascade() {
        List<TickOutcome> outcomes = new ArrayList<>();
        while (lowestUnsettled.isPresent() && outcomes.size() < settings.maxCascadeTicks()) {
            outcomes.add(tick());
        }
        if (lowestUnsettled.isPresent()) {
            LOG.warn("Cascade did not come to rest within {} ticks, elements still falling from {}",
                    settings.maxCascadeTicks(), lowestUnsettled.get());
        }
        return outcomes;
    }

    /**
     * Checks whether the player is defeated, i.e. whether the top row holds settled elements.
     *
     * @return true if the player is defeated
     */
    public boolean isDefeated() {
        return settled.isDefeated();
    }

    public boolean hasCapsule() {
        return capsule != null;
    }

    public boolean isFalling() {
        return lowestUnsettled.isPresent();
    }

    public Optional<RowIndex> lowestUnsettledRow() {
        return lowestUnsettled;
    }

    public long getCurrentTick() {
        return currentTick;
    }

    public StaticField getSettledField() {
        return settled;
    }

    public MovingField getMovingField() {
        return moving;
    }

    public FieldSettings getSettings() {
        return settings;
    }

    private void requireFreeSpawnTile(Position position) {
        if (settled.isOccupied(position) || moving.isOccupied(position)) {
            throw new IllegalStateException("Spawn tile " + position + " is occupied");
        }
    }

    private void mergeLowest(Optional<RowIndex> row) {
        if (row.isPresent() && (lowestUnsettled.isEmpty() || lowestUnsettled.get().compareTo(row.get()) < 0)) {
            lowestUnsettled = row;
        }
    }
}
