package com.phillippitts.axiom.service.response;

import com.phillippitts.axiom.domain.Intent;
import com.phillippitts.axiom.domain.SessionContext;
import com.phillippitts.axiom.service.context.ContextSlots;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders one of several template variants per intent, filling {@code {entity}}
 * placeholders from the intent's entities.
 *
 * <p><b>Variant selection</b> is deterministic: the lowest-index variant that is not the one
 * recorded for this intent in the session's {@code last_variant.<intent>} slot and whose
 * placeholders can all be filled. A single-variant set may repeat. When no variant of the
 * intent renders (or the intent has no templates) the {@code fallback} set is used the same
 * way.
 */
public class TemplateResponseStrategy implements ResponseStrategy {

    public static final String NAME = "template";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z_][a-zA-Z0-9_]*)}");

    private final Map<String, List<String>> templates;

    /**
     * @param templates variants per intent name; must contain a non-empty {@code fallback} set
     *                  with at least one placeholder-free variant
     */
    public TemplateResponseStrategy(Map<String, List<String>> templates) {
        Objects.requireNonNull(templates, "templates must not be null");
        Map<String, List<String>> copy = new LinkedHashMap<>();
        templates.forEach((intent, variants) -> {
            if (variants != null && !variants.isEmpty()) {
                copy.put(intent, List.copyOf(variants));
            }
        });
        List<String> fallback = copy.get(Intent.FALLBACK);
        if (fallback == null || fallback.stream().noneMatch(t -> !PLACEHOLDER.matcher(t).find())) {
            throw new IllegalArgumentException("Templates need a '" + Intent.FALLBACK
                    + "' set with at least one variant without placeholders");
        }
        this.templates = Map.copyOf(copy);
    }

    @Override
    public GeneratedResponse respond(Intent intent, SessionContext context) {
        List<String> variants = templates.get(intent.name());
        if (variants != null) {
            Optional<GeneratedResponse> rendered = select(intent.name(), variants, intent.entities(), context);
            if (rendered.isPresent()) {
                return rendered.get();
            }
        }
        return select(Intent.FALLBACK, templates.get(Intent.FALLBACK), Map.of(), context)
                .orElseThrow(() -> new IllegalStateException("Fallback templates cannot be rendered"));
    }

    public boolean hasTemplates(String intentName) {
        return templates.containsKey(intentName);
    }

    private Optional<GeneratedResponse> select(String intentName, List<String> variants,
                                               Map<String, String> entities, SessionContext context) {
        int last = lastVariant(intentName, context);
        Optional<GeneratedResponse> repeat = Optional.empty();
        for (int i = 0; i < variants.size(); i++) {
            Optional<String> text = render(variants.get(i), entities);
            if (text.isEmpty()) {
                continue;
            }
            GeneratedResponse response = new GeneratedResponse(text.get(), intentName, NAME, i);
            if (i != last) {
                return Optional.of(response);
            }
            repeat = Optional.of(response);
        }
        return repeat;
    }

    private static int lastVariant(String intentName, SessionContext context) {
        if (context == null) {
            return -1;
        }
        Object value = context.slot(ContextSlots.lastVariant(intentName));
        return value instanceof Number n ? n.intValue() : -1;
    }

    static Optional<String> render(String template, Map<String, String> entities) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = entities.get(m.group(1));
            if (value == null) {
                return Optional.empty();
            }
            m.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        m.appendTail(out);
        return Optional.of(out.toString());
    }
}
