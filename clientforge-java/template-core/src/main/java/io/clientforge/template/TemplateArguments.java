package io.clientforge.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values bound to placeholder names for one {@link Template#build} call. Unlike
 * {@code Map.of}, explicit {@code null} values are kept, which nullable placeholders accept.
 */
public final class TemplateArguments {

    private final Map<String, Object> values = new LinkedHashMap<>();

    private TemplateArguments() {
    }

    public static TemplateArguments create() {
        return new TemplateArguments();
    }

    public TemplateArguments with(String name, Object value) {
        values.put(name, value);
        return this;
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
