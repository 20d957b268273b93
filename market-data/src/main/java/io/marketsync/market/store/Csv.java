package io.marketsync.market.store;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal RFC 4180 reading and writing: comma separated, fields quoted only when they contain a comma,
 * quote, CR or LF, embedded quotes doubled.
 */
final class Csv {
    private Csv() {}

    static String formatRow(List<String> cells) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(quote(cells.get(i)));
        }
        return sb.append('\n').toString();
    }

    static String quote(String cell) {
        if (cell == null) return "";
        boolean needs = false;
        for (int i = 0; i < cell.length() && !needs; i++) {
            char c = cell.charAt(i);
            needs = c == ',' || c == '"' || c == '\n' || c == '\r';
        }
        if (!needs) return cell;
        return '"' + cell.replace("\"", "\"\"") + '"';
    }

    /** Parses every row; blank lines are skipped. Quoted fields may span lines. */
    static List<List<String>> parse(Reader reader) throws IOException {
        Reader in = reader.markSupported() ? reader : new BufferedReader(reader);
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        boolean rowHasContent = false;
        int ch;
        while ((ch = in.read()) != -1) {
            char c = (char) ch;
            if (quoted) {
                if (c == '"') {
                    in.mark(1);
                    int next = in.read();
                    if (next == '"') {
                        cell.append('"');
                    } else {
                        quoted = false;
                        if (next != -1) in.reset();
                    }
                } else {
                    cell.append(c);
                }
                continue;
            }
            switch (c) {
                case '"' -> { quoted = true; rowHasContent = true; }
                case ',' -> { row.add(cell.toString()); cell.setLength(0); rowHasContent = true; }
                case '\r' -> { }
                case '\n' -> {
                    if (rowHasContent || cell.length() > 0) {
                        row.add(cell.toString());
                        rows.add(row);
                    }
                    row = new ArrayList<>();
                    cell.setLength(0);
                    rowHasContent = false;
                }
                default -> { cell.append(c); rowHasContent = true; }
            }
        }
        if (quoted) throw new IOException("unterminated quoted field");
        if (rowHasContent || cell.length() > 0) {
            row.add(cell.toString());
            rows.add(row);
        }
        return rows;
    }
}
