package com.formulagrid.app.models;

import com.formulagrid.app.commands.CommandHistory;
import com.formulagrid.app.dispatch.CrossModuleDispatcher;
import com.formulagrid.app.evaluation.EvaluationLimits;
import com.formulagrid.app.evaluation.Evaluator;
import com.formulagrid.app.evaluation.FormulaError;
import com.formulagrid.app.evaluation.GridContext;
import com.formulagrid.app.exceptions.InvalidAddressException;
import com.formulagrid.app.functions.FunctionRegistry;
import com.formulagrid.app.references.CellAddress;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents one spreadsheet document:
 * - a unique ID and its current row/column counts
 * - a sparse map of (row,col) -> Cell, and one of (row,col) -> CellStyle
 * - any extra address-keyed stores registered by callers
 * - the evaluator bound to it, and its undo history
 * - a read/write lock the owner uses to serialize edits and evaluations
 *
 * Dimensions change only through structural edit commands.
 */
public class Grid implements GridContext {

    // Generates unique IDs for newly created grids
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private int rowCount;
    private int columnCount;

    private final AddressMap<Cell> cells = new AddressMap<>("cells");
    private final AddressMap<CellStyle> styles = new AddressMap<>("styles");
    private final List<AddressKeyedStore<?>> extraStores = new ArrayList<>();

    private final Evaluator evaluator;
    private final CommandHistory history = new CommandHistory();

    // The engine has no locking of its own; callers take this lock around every use
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Grid(int rowCount, int columnCount) {
        this(rowCount, columnCount, FunctionRegistry.standard(), new CrossModuleDispatcher(),
                EvaluationLimits.defaults());
    }

    public Grid(int rowCount, int columnCount, FunctionRegistry functions, CrossModuleDispatcher dispatcher,
                EvaluationLimits limits) {
        if (rowCount < 0 || columnCount < 0) {
            throw new IllegalArgumentException("Grid dimensions must not be negative");
        }
        this.id = ID_GENERATOR.getAndIncrement();
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.evaluator = new Evaluator(this, functions, dispatcher, limits);
    }

    public long getId() {
        return id;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    /** Grows (positive) or shrinks (negative) the row count. Used by structural commands. */
    public void adjustRowCount(int delta) {
        if (rowCount + delta < 0) {
            throw new IllegalStateException("Row count would become negative");
        }
        rowCount += delta;
    }

    /** Grows (positive) or shrinks (negative) the column count. Used by structural commands. */
    public void adjustColumnCount(int delta) {
        if (columnCount + delta < 0) {
            throw new IllegalStateException("Column count would become negative");
        }
        columnCount += delta;
    }

    public boolean contains(int row, int col) {
        return row >= 0 && col >= 0 && row < rowCount && col < columnCount;
    }

    public boolean contains(CellAddress address) {
        return contains(address.getRow(), address.getCol());
    }

    // ------------------------
    // Cell content
    // ------------------------

    @Override
    public String getCellRaw(int row, int col) {
        if (!contains(row, col)) {
            return "";
        }
        Cell cell = cells.get(new CellAddress(row, col));
        return cell == null ? "" : cell.getRawValue();
    }

    public String getCellRaw(CellAddress address) {
        return getCellRaw(address.getRow(), address.getCol());
    }

    /**
     * Stores raw text at the address; empty or null text clears the cell.
     * Returns the previous raw text ("" when the cell was empty).
     */
    public String setCellRaw(CellAddress address, String raw) {
        checkBounds(address);
        Cell previous = (raw == null || raw.isEmpty())
                ? cells.remove(address)
                : cells.put(address, new Cell(raw));
        return previous == null ? "" : previous.getRawValue();
    }

    // ------------------------
    // Evaluation
    // ------------------------

    /**
     * Evaluates one cell on the path described by {@code visited}.
     * The address stays in {@code visited} only while its own formula is being evaluated.
     */
    @Override
    public Object evaluateCell(int row, int col, Set<CellAddress> visited) {
        if (!contains(row, col)) {
            return FormulaError.REF.sentinel();
        }
        CellAddress address = new CellAddress(row, col);
        if (!visited.add(address)) {
            return FormulaError.CYCLE.sentinel();
        }
        try {
            Cell cell = cells.get(address);
            if (cell == null) {
                return "";
            }
            return evaluator.evaluate(cell.getRawValue(), visited);
        } finally {
            visited.remove(address);
        }
    }

    /** Top-level evaluation of one cell. */
    public Object evaluateCell(CellAddress address) {
        return evaluateCell(address.getRow(), address.getCol(), new HashSet<>());
    }

    /** Evaluates formula text against this grid without storing it. */
    public Object evaluate(String formula) {
        return evaluator.evaluate(formula);
    }

    // ------------------------
    // Metadata stores
    // ------------------------

    public CellStyle getStyle(CellAddress address) {
        return styles.get(address);
    }

    /** Sets or clears (null) the style, returning the previous one. */
    public CellStyle setStyle(CellAddress address, CellStyle style) {
        checkBounds(address);
        return styles.put(address, style);
    }

    /**
     * Adds a store that structural edits must keep aligned with the cells.
     */
    public void registerStore(AddressKeyedStore<?> store) {
        extraStores.add(store);
    }

    /**
     * Every address-keyed store of this grid: cells, styles, then registered stores.
     */
    public List<AddressKeyedStore<?>> getAddressKeyedStores() {
        List<AddressKeyedStore<?>> stores = new ArrayList<>();
        stores.add(cells);
        stores.add(styles);
        stores.addAll(extraStores);
        return Collections.unmodifiableList(stores);
    }

    public AddressMap<Cell> getCells() {
        return cells;
    }

    public AddressMap<CellStyle> getStyles() {
        return styles;
    }

    public Evaluator getEvaluator() {
        return evaluator;
    }

    public CommandHistory getHistory() {
        return history;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    private void checkBounds(CellAddress address) {
        if (!contains(address)) {
            throw new InvalidAddressException("Address " + address + " is outside the grid ("
                    + rowCount + " rows, " + columnCount + " columns)");
        }
    }
}
