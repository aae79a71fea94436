package com.flagship.member_payments.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CsvWriterTest {

    @Test
    @DisplayName("Header is bare, cells are quoted")
    void headerAndRows() {
        String csv = CsvWriter.withHeader("Date", "Type", "Amount")
            .row("2026-03-10", "Membership Fee", "2500.00")
            .toString();

        assertEquals("Date,Type,Amount\n\"2026-03-10\",\"Membership Fee\",\"2500.00\"\n", csv);
    }

    @Test
    @DisplayName("Embedded quotes are doubled and commas stay inside the cell")
    void escaping() {
        String csv = CsvWriter.withHeader("Description")
            .row("Pitch day \"Spring\", Mumbai")
            .toString();

        assertEquals("Description\n\"Pitch day \"\"Spring\"\", Mumbai\"\n", csv);
    }

    @Test
    @DisplayName("Null cells become empty quoted strings")
    void nulls() {
        String csv = CsvWriter.withHeader("A", "B").row(Arrays.asList("x", null)).toString();

        assertTrue(csv.endsWith("\"x\",\"\"\n"));
    }
}
