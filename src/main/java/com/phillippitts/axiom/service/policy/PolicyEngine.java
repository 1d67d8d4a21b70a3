package com.phillippitts.axiom.service.policy;

import com.phillippitts.axiom.domain.PolicyResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs every registered {@link Validator} in registration order and aggregates all of their
 * violations into one {@link PolicyResult}. Evaluation never stops at the first failure.
 *
 * <p>When two validators report the same rule name, their details are joined with
 * {@code "; "} in registration order.
 *
 * <p>Each evaluation is written to the {@code axiom.policy.audit} logger (direction,
 * verdict, rule names; never the text itself).
 */
public class PolicyEngine {

    private static final Logger LOG = LogManager.getLogger(PolicyEngine.class);
    private static final Logger AUDIT = LogManager.getLogger("axiom.policy.audit");

    private final List<Validator> validators = new CopyOnWriteArrayList<>();

    public PolicyEngine() {
    }

    public PolicyEngine(List<? extends Validator> validators) {
        validators.forEach(this::addValidator);
    }

    public void addValidator(Validator validator) {
        validators.add(Objects.requireNonNull(validator, "validator must not be null"));
        LOG.debug("Registered validator #{}: {}", validators.size(), validator.getClass().getSimpleName());
    }

    public List<Validator> validators() {
        return List.copyOf(validators);
    }

    /**
     * Evaluates the text against the whole chain.
     *
     * @param text      text to check, {@code null} is treated as empty
     * @param direction input or output
     * @return aggregated result; passed exactly when no validator reported a violation
     */
    public PolicyResult evaluate(String text, Direction direction) {
        Objects.requireNonNull(direction, "direction must not be null");
        String subject = text == null ? "" : text;

        Map<String, String> violations = new LinkedHashMap<>();
        for (Validator validator : validators) {
            Map<String, String> found = validator.validate(subject, direction);
            if (found == null || found.isEmpty()) {
                continue;
            }
            found.forEach((rule, detail) -> violations.merge(rule, detail, (a, b) -> a + "; " + b));
        }

        PolicyResult result = PolicyResult.of(violations);
        AUDIT.info("direction={} passed={} length={} violations={}",
                direction, result.passed(), subject.length(), result.violations().keySet());
        return result;
    }
}
