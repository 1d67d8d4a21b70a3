package com.phillippitts.axiom.service.policy;

import java.util.List;
import java.util.Set;

/**
 * Flags cross-site scripting payloads in user input ({@code xss_attempt}).
 */
public class XssValidator extends PatternValidator {

    public static final String RULE = "xss_attempt";

    public XssValidator() {
        super(RULE, "Cross-site scripting attempt detected", List.of(
                ci("<script[^>]*>"),
                ci("javascript:"),
                ci("\\bon\\w+\\s*="),
                ci("<iframe"),
                ci("<object"),
                ci("<embed")
        ), Set.of(Direction.INPUT));
    }
}
