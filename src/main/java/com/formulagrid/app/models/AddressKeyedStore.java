package com.formulagrid.app.models;

import com.formulagrid.app.references.CellAddress;

import java.util.Set;

/**
 * Per-cell data keyed by address. Structural edits re-key every store a grid owns,
 * so implementations must allow enumerating and moving their keys.
 */
public interface AddressKeyedStore<V> {

    /** Snapshot of the populated addresses, in row-major order. */
    Set<CellAddress> keys();

    V get(CellAddress address);

    /** Stores the value, returning the previous one. A null value removes the entry. */
    V put(CellAddress address, V value);

    V remove(CellAddress address);

    int size();
}
