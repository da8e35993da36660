package com.formulagrid.app.services;

import com.formulagrid.app.commands.GridCommand;
import com.formulagrid.app.commands.InsertColumnsCommand;
import com.formulagrid.app.commands.InsertRowsCommand;
import com.formulagrid.app.commands.RemoveColumnsCommand;
import com.formulagrid.app.commands.RemoveRowsCommand;
import com.formulagrid.app.commands.SetCellCommand;
import com.formulagrid.app.commands.SetStyleCommand;
import com.formulagrid.app.config.EngineProperties;
import com.formulagrid.app.dispatch.CrossModuleDispatcher;
import com.formulagrid.app.exceptions.GridNotFoundException;
import com.formulagrid.app.exceptions.HistoryExhaustedException;
import com.formulagrid.app.exceptions.InvalidAddressException;
import com.formulagrid.app.formula.FormulaReferenceShifter;
import com.formulagrid.app.functions.FunctionMetadata;
import com.formulagrid.app.functions.FunctionRegistry;
import com.formulagrid.app.models.Cell;
import com.formulagrid.app.models.CellStyle;
import com.formulagrid.app.models.Grid;
import com.formulagrid.app.models.GridDimensions;
import com.formulagrid.app.references.CellAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main business logic for creating grids, editing cells and styles,
 * evaluating formulas, and applying undoable structural edits.
 *
 * Each grid is guarded by its own read/write lock: anything that evaluates or
 * edits takes the write lock, since evaluation state lives on the grid.
 */
@Service
public class GridService {

    private static final Logger log = LoggerFactory.getLogger(GridService.class);

    // All grids live here in memory; there is no persistence
    private final Map<Long, Grid> grids = new ConcurrentHashMap<>();

    private final EngineProperties properties;
    private final FunctionRegistry functions;
    private final CrossModuleDispatcher dispatcher;

    public GridService() {
        this(new EngineProperties(), FunctionRegistry.standard(), new CrossModuleDispatcher());
    }

    @Autowired
    public GridService(EngineProperties properties, FunctionRegistry functions, CrossModuleDispatcher dispatcher) {
        this.properties = properties;
        this.functions = functions;
        this.dispatcher = dispatcher;
    }

    /**
     * Creates a new Grid and returns its ID. Null dimensions use the configured defaults.
     */
    public long createGrid(Integer rows, Integer columns) {
        int rowCount = rows != null ? rows : properties.getDefaultRows();
        int columnCount = columns != null ? columns : properties.getDefaultColumns();
        if (rowCount < 1 || columnCount < 1) {
            throw new IllegalArgumentException("A grid needs at least one row and one column");
        }
        Grid grid = new Grid(rowCount, columnCount, functions, dispatcher, properties.toLimits());
        grid.getHistory().setUndoLimit(properties.getUndoLimit());
        grids.put(grid.getId(), grid);
        log.info("Created grid {} ({} x {})", grid.getId(), rowCount, columnCount);
        return grid.getId();
    }

    /**
     * Retrieves a Grid by ID. Throws if not found.
     */
    public Grid getGrid(long gridId) {
        Grid grid = grids.get(gridId);
        if (grid == null) {
            throw new GridNotFoundException("Grid not found: " + gridId);
        }
        return grid;
    }

    // ----------------------------------------------------------------
    // Cells
    // ----------------------------------------------------------------

    /**
     * Stores raw text (literal or "=formula") as an undoable edit. Empty text clears the cell.
     * Formula errors are not rejected here; they show up as values on read.
     */
    public void setCellValue(long gridId, String address, String rawValue) {
        Grid grid = getGrid(gridId);
        CellAddress cellAddress = parseAddress(address);
        apply(grid, new SetCellCommand(grid, cellAddress, rawValue));
    }

    /**
     * Returns { "address", "raw", "value" } for one cell.
     */
    public Map<String, Object> getCell(long gridId, String address) {
        Grid grid = getGrid(gridId);
        CellAddress cellAddress = parseAddress(address);

        grid.getLock().writeLock().lock();
        try {
            checkInside(grid, cellAddress);
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("address", cellAddress.toA1());
            result.put("raw", grid.getCellRaw(cellAddress));
            result.put("value", grid.evaluateCell(cellAddress));
            return result;
        } finally {
            grid.getLock().writeLock().unlock();
        }
    }

    /**
     * Returns a map of A1 address -> evaluated value for every populated cell, row-major.
     * Values are computed on each call; nothing is cached between edits.
     */
    public Map<String, Object> getGridData(long gridId) {
        Grid grid = getGrid(gridId);

        grid.getLock().writeLock().lock();
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            for (CellAddress address : grid.getCells().keys()) {
                data.put(address.toA1(), grid.evaluateCell(address));
            }
            return data;
        } finally {
            grid.getLock().writeLock().unlock();
        }
    }

    /**
     * Evaluates formula text against the grid without storing it.
     */
    public Object evaluate(long gridId, String formula) {
        Grid grid = getGrid(gridId);

        grid.getLock().writeLock().lock();
        try {
            return grid.evaluate(formula);
        } finally {
            grid.getLock().writeLock().unlock();
        }
    }

    /**
     * Copies a cell's raw content to another cell, moving its relative references
     * by the distance between the two addresses.
     */
    public void copyCell(long gridId, String source, String target) {
        Grid grid = getGrid(gridId);
        CellAddress from = parseAddress(source);
        CellAddress to = parseAddress(target);

        grid.getLock().writeLock().lock();
        try {
            checkInside(grid, from);
            String raw = grid.getCellRaw(from);
            String adjusted = Cell.isFormula(raw)
                    ? FormulaReferenceShifter.adjust(raw, to.getRow() - from.getRow(), to.getCol() - from.getCol())
                    : raw;
            grid.getHistory().push(new SetCellCommand(grid, to, adjusted));
        } finally {
            grid.getLock().writeLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Styles
    // ----------------------------------------------------------------

    public void setStyle(long gridId, String address, CellStyle style) {
        Grid grid = getGrid(gridId);
        CellAddress cellAddress = parseAddress(address);
        apply(grid, new SetStyleCommand(grid, cellAddress, style));
    }

    public Map<String, CellStyle> getStyles(long gridId) {
        Grid grid = getGrid(gridId);

        grid.getLock().readLock().lock();
        try {
            Map<String, CellStyle> styles = new LinkedHashMap<>();
            for (Map.Entry<CellAddress, CellStyle> entry : grid.getStyles().asMap().entrySet()) {
                styles.put(entry.getKey().toA1(), entry.getValue());
            }
            return styles;
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Structural edits and history
    // ----------------------------------------------------------------

    public void insertRows(long gridId, int position, int count) {
        Grid grid = getGrid(gridId);
        apply(grid, new InsertRowsCommand(grid, position, count));
    }

    public void removeRows(long gridId, int position, int count) {
        Grid grid = getGrid(gridId);
        apply(grid, new RemoveRowsCommand(grid, position, count));
    }

    public void insertColumns(long gridId, int position, int count) {
        Grid grid = getGrid(gridId);
        apply(grid, new InsertColumnsCommand(grid, position, count));
    }

    public void removeColumns(long gridId, int position, int count) {
        Grid grid = getGrid(gridId);
        apply(grid, new RemoveColumnsCommand(grid, position, count));
    }

    public void undo(long gridId) {
        Grid grid = getGrid(gridId);
        grid.getLock().writeLock().lock();
        try {
            if (!grid.getHistory().undo()) {
                throw new HistoryExhaustedException("Nothing to undo in grid " + gridId);
            }
        } finally {
            grid.getLock().writeLock().unlock();
        }
    }

    public void redo(long gridId) {
        Grid grid = getGrid(gridId);
        grid.getLock().writeLock().lock();
        try {
            if (!grid.getHistory().redo()) {
                throw new HistoryExhaustedException("Nothing to redo in grid " + gridId);
            }
        } finally {
            grid.getLock().writeLock().unlock();
        }
    }

    public GridDimensions getDimensions(long gridId) {
        Grid grid = getGrid(gridId);
        grid.getLock().readLock().lock();
        try {
            return new GridDimensions(grid.getRowCount(), grid.getColumnCount());
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    /**
     * Metadata of every registered function, sorted by name.
     */
    public List<FunctionMetadata> getFunctions() {
        return functions.getAllMetadata();
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private void apply(Grid grid, GridCommand command) {
        grid.getLock().writeLock().lock();
        try {
            grid.getHistory().push(command);
        } finally {
            grid.getLock().writeLock().unlock();
        }
    }

    private CellAddress parseAddress(String address) {
        try {
            return CellAddress.parse(address);
        } catch (IllegalArgumentException e) {
            throw new InvalidAddressException(e.getMessage());
        }
    }

    private void checkInside(Grid grid, CellAddress address) {
        if (!grid.contains(address)) {
            throw new InvalidAddressException("Address " + address + " is outside the grid ("
                    + grid.getRowCount() + " rows, " + grid.getColumnCount() + " columns)");
        }
    }
}
