package com.di.loannova.contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative column rules a dataset must satisfy.
 *
 * @param requiredColumns     columns that must exist
 * @param numericColumns      values must coerce to numbers (non-numeric literals rejected)
 * @param dateColumns         values must be ISO-8601 dates or timestamps and not in the future
 * @param percentageColumns   numeric values bounded to [0, 100]
 * @param nonNegativeColumns  numeric values must be &gt;= 0
 * @param keyColumns          referential key, never null
 * @param uniqueKeys          whether the key combination must also be unique
 */
public record SchemaContract(List<String> requiredColumns,
                             List<String> numericColumns,
                             List<String> dateColumns,
                             List<String> percentageColumns,
                             List<String> nonNegativeColumns,
                             List<String> keyColumns,
                             boolean uniqueKeys) {

    public SchemaContract {
        requiredColumns    = copy(requiredColumns);
        numericColumns     = copy(numericColumns);
        dateColumns        = copy(dateColumns);
        percentageColumns  = copy(percentageColumns);
        nonNegativeColumns = copy(nonNegativeColumns);
        keyColumns         = copy(keyColumns);
    }

    public static SchemaContract empty() {
        return new SchemaContract(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), false);
    }

    /** Same contract with {@code extra} merged into the required columns. */
    public SchemaContract requiring(List<String> extra) {
        Set<String> merged = new LinkedHashSet<>(requiredColumns);
        merged.addAll(extra);
        return new SchemaContract(new ArrayList<>(merged), numericColumns, dateColumns,
                percentageColumns, nonNegativeColumns, keyColumns, uniqueKeys);
    }

    /**
     * Problems with the contract itself. A malformed contract cannot be trusted to
     * validate anything, so each entry is critical.
     */
    public List<Violation> definitionErrors() {
        List<Violation> errors = new ArrayList<>();
        List<List<String>> all = List.of(requiredColumns, numericColumns, dateColumns,
                percentageColumns, nonNegativeColumns, keyColumns);
        for (List<String> group : all) {
            for (String c : group) {
                if (c == null || c.isBlank()) {
                    errors.add(Violation.critical("*", "malformed_contract", null, "blank column name in contract"));
                }
            }
        }
        for (String c : dateColumns) {
            if (numericColumns.contains(c)) {
                errors.add(Violation.critical(c, "malformed_contract", null,
                        "column declared both numeric and date"));
            }
        }
        return errors;
    }

    private static List<String> copy(List<String> in) {
        if (in == null) return List.of();
        List<String> out = new ArrayList<>(in.size());
        for (String s : in) out.add(s == null ? null : s.trim());
        return Collections.unmodifiableList(out);
    }
}
