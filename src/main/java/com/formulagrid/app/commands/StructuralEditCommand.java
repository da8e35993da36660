package com.formulagrid.app.commands;

import com.formulagrid.app.exceptions.InvalidStructuralEditException;
import com.formulagrid.app.models.AddressKeyedStore;
import com.formulagrid.app.models.Grid;
import com.formulagrid.app.references.CellAddress;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for row/column inserts and removals.
 *
 * Every address-keyed store of the grid is re-keyed, not just the cells, so styles and
 * any registered metadata stay attached to the content they describe.
 * Formula text is never rewritten: a reference to a moved cell keeps pointing at the
 * old coordinates.
 */
public abstract class StructuralEditCommand implements GridCommand {

    protected final Grid grid;
    protected final Axis axis;
    protected final int position;
    protected final int count;

    protected StructuralEditCommand(Grid grid, Axis axis, int position, int count) {
        if (count < 1) {
            throw new InvalidStructuralEditException("Count must be at least 1, got " + count);
        }
        this.grid = grid;
        this.axis = axis;
        this.position = position;
        this.count = count;
    }

    public Axis getAxis() {
        return axis;
    }

    public int getPosition() {
        return position;
    }

    public int getCount() {
        return count;
    }

    /**
     * Moves every entry whose index along the axis is >= fromIndex by delta.
     * All target keys are computed before any store changes, so a shift that cannot
     * be done leaves every store as it was.
     */
    protected void shift(int fromIndex, int delta) {
        List<StoreShift<?>> shifts = new ArrayList<>();
        for (AddressKeyedStore<?> store : grid.getAddressKeyedStores()) {
            shifts.add(planShift(store, fromIndex, delta));
        }
        for (StoreShift<?> shift : shifts) {
            shift.apply();
        }
    }

    private <V> StoreShift<V> planShift(AddressKeyedStore<V> store, int fromIndex, int delta) {
        Map<CellAddress, CellAddress> targets = new LinkedHashMap<>();
        for (CellAddress address : store.keys()) {
            int index = axis.indexOf(address);
            if (index >= fromIndex) {
                long shifted = (long) index + delta;
                if (shifted < 0 || shifted > Integer.MAX_VALUE) {
                    throw new InvalidStructuralEditException("Cannot move " + address + " by " + delta
                            + " " + axis.getLabel());
                }
                targets.put(address, axis.withIndex(address, (int) shifted));
            }
        }
        return new StoreShift<>(store, targets);
    }

    /**
     * Old key -> new key for the moving entries of one store.
     */
    private static final class StoreShift<V> {
        private final AddressKeyedStore<V> store;
        private final Map<CellAddress, CellAddress> targets;

        StoreShift(AddressKeyedStore<V> store, Map<CellAddress, CellAddress> targets) {
            this.store = store;
            this.targets = targets;
        }

        void apply() {
            Map<CellAddress, V> moved = new LinkedHashMap<>();
            for (CellAddress address : targets.keySet()) {
                moved.put(address, store.remove(address));
            }
            // Removed first so a shifted key never overwrites one that has not moved yet
            for (Map.Entry<CellAddress, V> entry : moved.entrySet()) {
                store.put(targets.get(entry.getKey()), entry.getValue());
            }
        }
    }

    /**
     * Deletes entries with index in [from, to) from every store and returns them for restoring.
     */
    protected List<CapturedBand<?>> captureBand(int from, int to) {
        List<CapturedBand<?>> bands = new ArrayList<>();
        for (AddressKeyedStore<?> store : grid.getAddressKeyedStores()) {
            bands.add(captureStore(store, from, to));
        }
        return bands;
    }

    private <V> CapturedBand<V> captureStore(AddressKeyedStore<V> store, int from, int to) {
        Map<CellAddress, V> entries = new LinkedHashMap<>();
        for (CellAddress address : store.keys()) {
            int index = axis.indexOf(address);
            if (index >= from && index < to) {
                entries.put(address, store.remove(address));
            }
        }
        return new CapturedBand<>(store, entries);
    }

    /**
     * Entries removed from one store, kept at their original addresses.
     */
    protected static final class CapturedBand<V> {
        private final AddressKeyedStore<V> store;
        private final Map<CellAddress, V> entries;

        CapturedBand(AddressKeyedStore<V> store, Map<CellAddress, V> entries) {
            this.store = store;
            this.entries = entries;
        }

        void restore() {
            for (Map.Entry<CellAddress, V> entry : entries.entrySet()) {
                store.put(entry.getKey(), entry.getValue());
            }
        }

        int size() {
            return entries.size();
        }
    }
}
