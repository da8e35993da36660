package com.formulagrid.app.models;

import com.formulagrid.app.references.CellAddress;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Sparse {@link AddressKeyedStore} backed by a row-major TreeMap.
 * Only populated cells take space, so re-keying costs the number of entries,
 * not the size of the grid.
 */
public class AddressMap<V> implements AddressKeyedStore<V> {

    private final String name;
    private final TreeMap<CellAddress, V> entries = new TreeMap<>();

    public AddressMap(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public Set<CellAddress> keys() {
        return new TreeSet<>(entries.keySet());
    }

    @Override
    public V get(CellAddress address) {
        return entries.get(address);
    }

    @Override
    public V put(CellAddress address, V value) {
        if (value == null) {
            return entries.remove(address);
        }
        return entries.put(address, value);
    }

    @Override
    public V remove(CellAddress address) {
        return entries.remove(address);
    }

    @Override
    public int size() {
        return entries.size();
    }

    /** Read-only ordered view of the entries. */
    public Map<CellAddress, V> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    /** Copy of the entries, for comparisons and snapshots. */
    public Map<CellAddress, V> snapshot() {
        return new LinkedHashMap<>(entries);
    }

    @Override
    public String toString() {
        return name + entries;
    }
}
