package com.easycashflows.service.rules;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code {{key}}} substitution. Placeholders without a matching key are left as written.
 */
@Component
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

    public String render(String body, Map<String, ?> variables) {
        if (body == null || body.isEmpty() || variables == null || variables.isEmpty()) {
            return body;
        }
        Matcher matcher = PLACEHOLDER.matcher(body);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String replacement = variables.containsKey(key)
                    ? stringify(variables.get(key))
                    : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String stringify(Object value) {
        return value == null ? "" : value.toString();
    }
}
