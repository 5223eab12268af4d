package io.clgrader.core.assessment;

import io.clgrader.core.util.ArgumentTokenizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/// Compact tabular form of unit test cases.
///
/// A header names the columns and each row supplies one case. Tables are expanded into
/// ordinary {@link TestCase}s when an assessment is loaded, so executors never see them.
///
/// ### Validation
/// - the header is not empty and names each column at most once
/// - the header has at least one expectation column (`stdout`, `stderr`, `status`)
/// - every row has as many cells as the header
/// - `weight` and `status` cells are integers, every other cell is a string
///
/// {@snippet :
/// TestTable table = new TestTable(
///     List.of("args", "stdout"),
///     List.of(List.of("1 2", "3\n"), List.of("2 2", "4\n")));
/// List<TestCase> cases = table.expand();
/// }
///
/// @param header column names, not null
/// @param rows cell values per row, not null
public record TestTable(List<String> header, List<List<Object>> rows) {

    /// Column kinds a table header may name.
    public enum Column {
        NAME,
        WEIGHT,
        ARGS,
        STDIN,
        STDOUT,
        STDERR,
        STATUS;

        static Column parse(String label) {
            try {
                return valueOf(label.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown table column: '" + label + "'", e);
            }
        }

        boolean isExpectation() {
            return this == STDOUT || this == STDERR || this == STATUS;
        }

        boolean isInteger() {
            return this == WEIGHT || this == STATUS;
        }
    }

    public TestTable {
        header = List.copyOf(header);
        rows = rows.stream().map(row -> Collections.unmodifiableList(new ArrayList<>(row))).toList();
    }

    /// Validates the table and expands each row into a test case.
    ///
    /// @return one case per row, in row order, never null
    /// @throws IllegalArgumentException if the table violates a validation rule
    public List<TestCase> expand() {
        List<Column> columns = parseHeader();
        List<TestCase> cases = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            cases.add(expandRow(columns, rows.get(r), r + 1));
        }
        return cases;
    }

    private List<Column> parseHeader() {
        if (header.isEmpty()) {
            throw new IllegalArgumentException("Table header must not be empty");
        }
        List<Column> columns = new ArrayList<>(header.size());
        Set<Column> seen = EnumSet.noneOf(Column.class);
        for (String label : header) {
            Column column = Column.parse(label);
            if (!seen.add(column)) {
                throw new IllegalArgumentException("Duplicate table column: '" + label + "'");
            }
            columns.add(column);
        }
        if (columns.stream().noneMatch(Column::isExpectation)) {
            throw new IllegalArgumentException(
                    "Table header needs at least one of stdout, stderr or status");
        }
        return columns;
    }

    private static TestCase expandRow(List<Column> columns, List<Object> row, int rowNumber) {
        if (row.size() != columns.size()) {
            throw new IllegalArgumentException(
                    "Row "
                            + rowNumber
                            + " has "
                            + row.size()
                            + " cells, header has "
                            + columns.size());
        }
        TestCase.Builder testCase = TestCase.builder();
        Expectation.Builder expectation = Expectation.builder();

        for (int c = 0; c < columns.size(); c++) {
            Column column = columns.get(c);
            Object cell = row.get(c);
            if (column.isInteger()) {
                int value = integerCell(cell, column, rowNumber);
                if (column == Column.WEIGHT) {
                    testCase.weight(value);
                } else {
                    expectation.status(value);
                }
                continue;
            }
            String text = stringCell(cell, column, rowNumber);
            switch (column) {
                case NAME -> testCase.name(text);
                case ARGS -> testCase.arguments(ArgumentSpec.single(ArgumentTokenizer.split(text)));
                case STDIN -> testCase.stdin(text);
                case STDOUT -> expectation.stdout(TextPredicate.exact(text));
                case STDERR -> expectation.stderr(TextPredicate.exact(text));
                default -> throw new IllegalStateException("Unhandled column " + column);
            }
        }
        return testCase.expectation(expectation.build()).build();
    }

    private static int integerCell(Object cell, Column column, int rowNumber) {
        if (cell instanceof Integer || cell instanceof Long || cell instanceof Short) {
            return ((Number) cell).intValue();
        }
        throw new IllegalArgumentException(
                "Row " + rowNumber + ": column " + label(column) + " expects an integer, got " + cell);
    }

    private static String stringCell(Object cell, Column column, int rowNumber) {
        if (cell instanceof String text) {
            return text;
        }
        throw new IllegalArgumentException(
                "Row " + rowNumber + ": column " + label(column) + " expects a string, got " + cell);
    }

    private static String label(Column column) {
        return column.name().toLowerCase(Locale.ROOT);
    }
}
