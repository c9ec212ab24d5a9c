package com.gridline.app.storage;

import com.gridline.app.exceptions.FormulaParseException;
import com.gridline.app.exceptions.GridFileFormatException;
import com.gridline.app.formula.CellInputParser;
import com.gridline.app.models.Cell;
import com.gridline.app.models.CellRef;
import com.gridline.app.models.CellStore;
import com.gridline.app.models.Value;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Plain-text document format, one cell per line:
 * <pre>
 * # Gridline Spreadsheet
 * A1: 42
 * B1: "Hello"
 * C1: =A1 * 2
 * </pre>
 * Lines starting with '#' and blank lines are ignored. Only user content is written:
 * spill children and cached results are derived again after loading.
 */
public class CellLineFormat {

    public static final String HEADER = "# Gridline Spreadsheet";

    private final CellInputParser inputParser;

    public CellLineFormat(CellInputParser inputParser) {
        this.inputParser = inputParser;
    }

    public String write(CellStore store) {
        StringBuilder out = new StringBuilder(HEADER).append('\n');
        for (Map.Entry<CellRef, Cell> entry : store.snapshot().entrySet()) {
            String value = formatCell(entry.getValue());
            if (value != null) {
                out.append(entry.getKey()).append(": ").append(value).append('\n');
            }
        }
        return out.toString();
    }

    /**
     * @throws GridFileFormatException naming the first line that cannot be read
     */
    public SortedMap<CellRef, Cell> parse(String content) {
        SortedMap<CellRef, Cell> cells = new TreeMap<>();
        String[] lines = content.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon < 0) {
                throw new GridFileFormatException(lineNumber, "Expected 'ADDRESS: VALUE'");
            }
            String address = line.substring(0, colon).trim();
            CellRef ref = CellRef.parse(address);
            if (ref == null) {
                throw new GridFileFormatException(lineNumber, "Invalid cell reference '" + address + "'");
            }
            if (cells.containsKey(ref)) {
                throw new GridFileFormatException(lineNumber, "Duplicate cell " + ref);
            }
            Cell cell;
            try {
                cell = inputParser.parse(line.substring(colon + 1), ref);
            } catch (FormulaParseException e) {
                throw new GridFileFormatException(lineNumber, e.getMessage(), e);
            }
            if (!cell.isEmpty()) {
                cells.put(ref, cell);
            }
        }
        return cells;
    }

    private static String formatCell(Cell cell) {
        switch (cell.getKind()) {
            case NUMBER:
                return Value.formatNumber(cell.getNumber());
            case TEXT:
                return CellInputParser.quote(cell.getText());
            case BOOL:
                return cell.getBool() ? "TRUE" : "FALSE";
            case FORMULA:
                return "=" + cell.getRawFormula();
            default:
                return null;
        }
    }
}
