package com.formulagraph.app.models;

import com.formulagraph.app.exceptions.InvalidWorkbookException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for building a workbook from the loader enumeration.
 */
class WorkbookTest {

    private static WorkbookInput input(List<String> sheets, CellInput... cells) {
        return new WorkbookInput("doc", sheets, Arrays.asList(cells));
    }

    @Test
    void testFromInput() {
        Workbook workbook = Workbook.from(input(Arrays.asList("Design", "Empty"),
                CellInput.literal("Design", "A1", 5),
                CellInput.formula("Design", "B1", "=A1*2"),
                CellInput.literal("Extra", "A1", "label")));

        assertEquals(Arrays.asList("Design", "Empty"), workbook.getSheetNames());
        assertTrue(workbook.hasSheet("Extra"));
        assertEquals(5.0, workbook.getCell(QualifiedAddress.of("Design", "A1")).getValue());
        assertEquals(1, workbook.formulaCells().size());
        assertEquals(3, workbook.allCells().size());
        assertTrue(workbook.getCell(QualifiedAddress.of("Extra", "A1")).isText());
        assertFalse(workbook.contains(QualifiedAddress.of("Empty", "A1")));
    }

    /**
     * A formula cell whose loader put the text in the value slot still counts as a formula;
     * text without the '=' marker never does.
     */
    @Test
    void testFormulaDetection() {
        Workbook workbook = Workbook.from(input(Collections.singletonList("S"),
                new CellInput("S", "A1", "=1+1", null, true),
                new CellInput("S", "A2", null, "1+1", true)));

        assertTrue(workbook.getCell(QualifiedAddress.of("S", "A1")).isFormula());
        assertFalse(workbook.getCell(QualifiedAddress.of("S", "A2")).isFormula());
    }

    @Test
    void testBrokenLoaderContract() {
        assertThrows(InvalidWorkbookException.class, () -> Workbook.from(
                new WorkbookInput(null, Collections.emptyList(), Collections.emptyList())));
        assertThrows(InvalidWorkbookException.class, () -> Workbook.from(input(Collections.singletonList("S"),
                CellInput.literal("S", "A1", 1), CellInput.literal("S", "$A$1", 2))));
        assertThrows(InvalidWorkbookException.class, () -> Workbook.from(input(Collections.singletonList("S"),
                CellInput.literal("S", "not-an-address", 1))));
        assertThrows(InvalidWorkbookException.class, () -> Workbook.from(input(Collections.singletonList("S"),
                CellInput.literal(null, "A1", 1))));
    }

    /**
     * Cells to the left come back nearest first; to the right in column order.
     */
    @Test
    void testNeighbors() {
        Workbook workbook = Workbook.from(input(Collections.singletonList("S"),
                CellInput.literal("S", "E3", 1),
                CellInput.literal("S", "A3", "far"),
                CellInput.literal("S", "B3", "near"),
                CellInput.literal("S", "D3", 2),
                CellInput.literal("S", "C4", 3)));
        Sheet sheet = workbook.getSheet("S");

        List<Cell> left = sheet.cellsLeftOf(CellAddress.parse("C3"));
        assertEquals(Arrays.asList("near", "far"), Arrays.asList(left.get(0).getValue(), left.get(1).getValue()));

        List<Cell> right = sheet.cellsRightOf(CellAddress.parse("C3"));
        assertEquals(2, right.size());
        assertEquals("D3", right.get(0).getAddress().toString());
        assertEquals("E3", right.get(1).getAddress().toString());
    }
}
