package com.phillippitts.axiom.service.policy;

import java.util.List;
import java.util.Set;

/**
 * Flags relative path escapes in user input ({@code path_traversal}), plain or URL-encoded.
 */
public class PathTraversalValidator extends PatternValidator {

    public static final String RULE = "path_traversal";

    public PathTraversalValidator() {
        super(RULE, "Path traversal attempt detected", List.of(
                ci("\\.\\./"),
                ci("\\.\\.\\\\"),
                ci("%2e%2e(%2f|%5c|/|\\\\)")
        ), Set.of(Direction.INPUT));
    }
}
