package com.flagship.member_payments.common;

import java.util.Arrays;
import java.util.List;

/**
 * CSV builder for exports. The header row is written bare ("Date,Type,Description,...");
 * data cells are always quoted with embedded quotes doubled.
 */
public final class CsvWriter {

    private final StringBuilder out = new StringBuilder();

    private CsvWriter() {
    }

    public static CsvWriter withHeader(String... columns) {
        CsvWriter writer = new CsvWriter();
        writer.out.append(String.join(",", columns)).append('\n');
        return writer;
    }

    public CsvWriter row(Object... cells) {
        return row(Arrays.asList(cells));
    }

    public CsvWriter row(List<?> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append(quote(cells.get(i)));
        }
        out.append('\n');
        return this;
    }

    static String quote(Object cell) {
        String value = cell == null ? "" : cell.toString();
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
