package com.phillippitts.axiom.service.policy;

import java.util.List;
import java.util.Set;

/**
 * Flags SQL injection signatures in user input ({@code sql_injection}): comment markers,
 * quote-terminated statements, destructive DDL/DML statements and UNION-based probes.
 */
public class SqlInjectionValidator extends PatternValidator {

    public static final String RULE = "sql_injection";

    public SqlInjectionValidator() {
        super(RULE, "SQL injection attempt detected", List.of(
                ci(";\\s*--"),
                ci("'\\s*;"),
                ci("--"),
                ci("/\\*.*?\\*/"),
                ci("\\bunion\\s+(all\\s+)?select\\b"),
                ci("'\\s*(or|and)\\s+'"),
                ci("\\b(drop|alter|truncate)\\s+(table|database|schema|index|view)\\b"),
                ci("\\bdelete\\s+from\\b"),
                ci("\\binsert\\s+into\\b"),
                ci("\\bupdate\\s+\\w+\\s+set\\b"),
                ci("\\bexec(ute)?\\s*\\(")
        ), Set.of(Direction.INPUT));
    }
}
