package com.formulagrid.app.controllers;

import com.formulagrid.app.functions.FunctionMetadata;
import com.formulagrid.app.models.CellStyle;
import com.formulagrid.app.models.GridDimensions;
import com.formulagrid.app.services.GridService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for managing Grids.
 * "/grids" is the base path; addresses are A1 notation, positions are zero-based.
 */
@RestController
public class GridController {

    @Autowired
    private GridService gridService;

    /**
     * POST /grids
     * Optional JSON body { "rows", "columns" }; missing values use the configured defaults.
     * Returns the new grid's ID.
     */
    @PostMapping("/grids")
    public ResponseEntity<Long> createGrid(@RequestBody(required = false) GridDimensions request) {
        Integer rows = request != null ? request.getRows() : null;
        Integer columns = request != null ? request.getColumns() : null;
        long gridId = gridService.createGrid(rows, columns);
        return ResponseEntity.ok(gridId);
    }

    /**
     * GET /grids/{gridId}
     * Returns the evaluated value of every populated cell: { "A1": 6.0, "B2": "#CYCLE!", ... }.
     */
    @GetMapping("/grids/{gridId}")
    public ResponseEntity<Map<String, Object>> getGrid(@PathVariable long gridId) {
        return ResponseEntity.ok(gridService.getGridData(gridId));
    }

    /**
     * PUT /grids/{gridId}/cells/{address}
     * Body: raw text, a literal or "=formula". An empty body clears the cell.
     * Formula errors are values, so a bad formula is still stored (200 OK).
     */
    @PutMapping("/grids/{gridId}/cells/{address}")
    public ResponseEntity<Void> setCellValue(
            @PathVariable long gridId,
            @PathVariable String address,
            @RequestBody(required = false) String rawValue
    ) {
        gridService.setCellValue(gridId, address, rawValue);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/grids/{gridId}/cells/{address}")
    public ResponseEntity<Map<String, Object>> getCell(@PathVariable long gridId, @PathVariable String address) {
        return ResponseEntity.ok(gridService.getCell(gridId, address));
    }

    /**
     * POST /grids/{gridId}/cells/{source}/copy/{target}
     * Copies raw content; relative references move with the copy.
     */
    @PostMapping("/grids/{gridId}/cells/{source}/copy/{target}")
    public ResponseEntity<Void> copyCell(
            @PathVariable long gridId,
            @PathVariable String source,
            @PathVariable String target
    ) {
        gridService.copyCell(gridId, source, target);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /grids/{gridId}/evaluate
     * Body: formula text such as "=SUM(A1:A3)". Nothing is stored.
     */
    @PostMapping("/grids/{gridId}/evaluate")
    public ResponseEntity<Object> evaluate(@PathVariable long gridId, @RequestBody String formula) {
        return ResponseEntity.ok(gridService.evaluate(gridId, formula));
    }

    @PutMapping("/grids/{gridId}/styles/{address}")
    public ResponseEntity<Void> setStyle(
            @PathVariable long gridId,
            @PathVariable String address,
            @RequestBody CellStyle style
    ) {
        gridService.setStyle(gridId, address, style);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/grids/{gridId}/styles")
    public ResponseEntity<Map<String, CellStyle>> getStyles(@PathVariable long gridId) {
        return ResponseEntity.ok(gridService.getStyles(gridId));
    }

    /**
     * POST /grids/{gridId}/rows/insert?position=2&count=1
     * Cells and styles at or below the position move down; formula text is left as is.
     */
    @PostMapping("/grids/{gridId}/rows/insert")
    public ResponseEntity<Void> insertRows(
            @PathVariable long gridId,
            @RequestParam int position,
            @RequestParam(defaultValue = "1") int count
    ) {
        gridService.insertRows(gridId, position, count);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/grids/{gridId}/rows/remove")
    public ResponseEntity<Void> removeRows(
            @PathVariable long gridId,
            @RequestParam int position,
            @RequestParam(defaultValue = "1") int count
    ) {
        gridService.removeRows(gridId, position, count);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/grids/{gridId}/columns/insert")
    public ResponseEntity<Void> insertColumns(
            @PathVariable long gridId,
            @RequestParam int position,
            @RequestParam(defaultValue = "1") int count
    ) {
        gridService.insertColumns(gridId, position, count);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/grids/{gridId}/columns/remove")
    public ResponseEntity<Void> removeColumns(
            @PathVariable long gridId,
            @RequestParam int position,
            @RequestParam(defaultValue = "1") int count
    ) {
        gridService.removeColumns(gridId, position, count);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /grids/{gridId}/undo
     * 409 when there is nothing left to undo.
     */
    @PostMapping("/grids/{gridId}/undo")
    public ResponseEntity<Void> undo(@PathVariable long gridId) {
        gridService.undo(gridId);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/grids/{gridId}/redo")
    public ResponseEntity<Void> redo(@PathVariable long gridId) {
        gridService.redo(gridId);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/grids/{gridId}/dimensions")
    public ResponseEntity<GridDimensions> getDimensions(@PathVariable long gridId) {
        return ResponseEntity.ok(gridService.getDimensions(gridId));
    }

    /**
     * GET /functions
     * Metadata of every formula function, sorted by name.
     */
    @GetMapping("/functions")
    public ResponseEntity<List<FunctionMetadata>> getFunctions() {
        return ResponseEntity.ok(gridService.getFunctions());
    }
}
