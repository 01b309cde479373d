package io.clientforge.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * A parsed text template.
 *
 * <p>Placeholders:
 * <ul>
 *   <li>{@code %name%} is replaced by the formatted value of {@code name}.</li>
 *   <li>{@code %~cond -> "text"~%} is replaced by {@code text} (itself a template) when
 *       {@code cond} is {@code true}; when it is {@code false} the whole output line that
 *       contains the placeholder is dropped.</li>
 *   <li>{@code %cond -> "text"%} is replaced by {@code text} or by nothing.</li>
 *   <li>{@code %%} is a literal percent sign.</li>
 * </ul>
 *
 * <p>Placeholders are required, {@code String}-typed and formatted with
 * {@link String#valueOf(Object)} unless declared otherwise through {@link #builder(String)}.
 * Conditions are {@code Boolean}. Instances are immutable and can be built any number of
 * times; the same text and arguments always give the same output.
 *
 * <pre>
 * Template t = Template.builder("""
 *     public %type% %name%() {
 *         %~deprecated -&gt; "// deprecated"~%
 *     }""")
 *     .optional("deprecated")
 *     .build();
 * String code = t.build(TemplateArguments.create().with("type", "int").with("name", "size"));
 * </pre>
 */
public final class Template {

    private static final Logger log = LoggerFactory.getLogger(Template.class);

    /** Marks an output line produced by a false whole-line conditional. */
    private static final String LINE_REMOVAL = "\u0000remove-line\u0000";

    private final String source;
    private final List<Segment> segments;
    private final Map<String, Variable<?>> variables;

    private Template(String source, Map<String, Declaration<?>> declarations) {
        this.source = Objects.requireNonNull(source, "source");
        this.segments = List.copyOf(
            new TemplateParser(source, (text, column) -> new Template(text, declarations)).parse());
        this.variables = Collections.unmodifiableMap(collectVariables(segments, declarations));
    }

    /**
     * Parses {@code source} with default declarations for every placeholder.
     *
     * @throws TemplateSyntaxException if the text is malformed
     */
    public static Template of(String source) {
        return new Builder(source).build();
    }

    public static Builder builder(String source) {
        return new Builder(source);
    }

    /**
     * Variables of this template level, in the order they first appear. Placeholders that
     * only appear inside a conditional's text belong to that branch's template.
     */
    public Map<String, Variable<?>> getVariables() {
        return variables;
    }

    public String build(TemplateArguments arguments) {
        return build(0, arguments.asMap());
    }

    public String build(int indent, TemplateArguments arguments) {
        return build(indent, arguments.asMap());
    }

    public String build(Map<String, ?> arguments) {
        return build(0, arguments);
    }

    /**
     * Substitutes every placeholder, drops lines of false whole-line conditionals, and
     * prefixes every non-blank line after the first with {@code indent} spaces.
     *
     * @param indent    spaces added to each line after the first
     * @param arguments values by placeholder name; may contain {@code null} values
     * @return the built text
     * @throws MissingRequiredVariableException if a required placeholder has no value
     * @throws TypeMismatchException            if a value is null or of the wrong type
     */
    public String build(int indent, Map<String, ?> arguments) {
        Objects.requireNonNull(arguments, "arguments");

        Map<String, String> values = new HashMap<>();
        Map<String, Boolean> conditions = new HashMap<>();
        for (Variable<?> variable : variables.values()) {
            String name = variable.getName();
            boolean present = arguments.containsKey(name);
            if (!present && !variable.isOptional() && !variable.isNullable()) {
                throw new MissingRequiredVariableException(name);
            }
            Object value = arguments.get(name);
            if (variable.getKind().isConditional()) {
                conditions.put(name, present && Boolean.TRUE.equals(variable.accept(value)));
            } else {
                values.put(name, present ? variable.format(value) : "");
            }
        }

        StringBuilder out = new StringBuilder(source.length());
        for (Segment segment : segments) {
            if (segment instanceof Segment.Text text) {
                out.append(text.text());
            } else if (segment instanceof Segment.Slot slot) {
                out.append(values.get(slot.name()));
            } else if (segment instanceof Segment.Branch branch) {
                if (conditions.get(branch.name())) {
                    out.append(branch.template().build(branch.column(), arguments));
                } else if (branch.wholeLine()) {
                    out.append(LINE_REMOVAL);
                }
            }
        }

        String result = reflow(out.toString(), indent);
        log.trace("Built template with {} variable(s) into {} chars", variables.size(), result.length());
        return result;
    }

    private static String reflow(String text, int indent) {
        String prefix = " ".repeat(Math.max(indent, 0));
        StringBuilder sb = new StringBuilder(text.length());
        boolean first = true;
        for (String line : text.split("\n", -1)) {
            if (line.contains(LINE_REMOVAL)) {
                continue;
            }
            if (!first) {
                sb.append('\n');
                if (!line.isBlank()) {
                    sb.append(prefix);
                }
            }
            sb.append(line);
            first = false;
        }
        return sb.toString();
    }

    private static Map<String, Variable<?>> collectVariables(List<Segment> segments,
                                                            Map<String, Declaration<?>> declarations) {
        Map<String, Variable<?>> variables = new LinkedHashMap<>();
        for (Segment segment : segments) {
            String name;
            VariableKind syntaxKind;
            if (segment instanceof Segment.Slot slot) {
                name = slot.name();
                syntaxKind = VariableKind.PLAIN;
            } else if (segment instanceof Segment.Branch branch) {
                name = branch.name();
                syntaxKind = branch.wholeLine() ? VariableKind.WHOLE_LINE : VariableKind.CONDITIONAL;
            } else {
                continue;
            }

            Variable<?> existing = variables.get(name);
            if (existing != null) {
                if (existing.getKind().isConditional() != syntaxKind.isConditional()) {
                    throw TypeMismatchException.kindConflict(name, existing.getKind(), syntaxKind);
                }
                continue;
            }
            variables.put(name, createVariable(name, syntaxKind, declarations.get(name)));
        }
        return variables;
    }

    private static Variable<?> createVariable(String name, VariableKind syntaxKind, Declaration<?> declaration) {
        if (syntaxKind.isConditional()) {
            if (declaration != null && declaration.typed() && declaration.type() != Boolean.class) {
                throw new IllegalArgumentException(
                    "Conditional placeholder '" + name + "' must be declared as Boolean, not "
                        + declaration.type().getSimpleName());
            }
            boolean optional = declaration != null && declaration.optional();
            boolean nullable = declaration != null && declaration.nullable();
            return new Variable<>(name, syntaxKind, Boolean.class, String::valueOf, optional, nullable);
        }
        Declaration<?> d = declaration != null ? declaration : Declaration.DEFAULT;
        VariableKind kind = d.nullable() ? VariableKind.NULLABLE
            : d.optional() ? VariableKind.OPTIONAL
            : VariableKind.PLAIN;
        return d.toVariable(name, kind);
    }

    private Set<String> allNames() {
        Set<String> names = new LinkedHashSet<>(variables.keySet());
        for (Segment segment : segments) {
            if (segment instanceof Segment.Branch branch) {
                names.addAll(branch.template().allNames());
            }
        }
        return names;
    }

    @Override
    public String toString() {
        return "Template{variables=" + variables.keySet() + "}";
    }

    private record Declaration<T>(Class<T> type, Function<? super T, String> formatter,
                                  boolean typed, boolean optional, boolean nullable) {

        static final Declaration<String> DEFAULT =
            new Declaration<>(String.class, Function.identity(), false, false, false);

        Declaration<T> withOptional() {
            return new Declaration<>(type, formatter, typed, true, nullable);
        }

        Declaration<T> withNullable() {
            return new Declaration<>(type, formatter, typed, optional, true);
        }

        Variable<T> toVariable(String name, VariableKind kind) {
            return new Variable<>(name, kind, type, formatter, optional, nullable);
        }
    }

    /**
     * Declares placeholder types, formatters and acceptance rules before parsing.
     * Declarations apply to the name wherever it appears, including conditional text.
     */
    public static final class Builder {

        private final String source;
        private final Map<String, Declaration<?>> declarations = new HashMap<>();

        private Builder(String source) {
            this.source = Objects.requireNonNull(source, "source");
        }

        /**
         * Values for {@code name} must be instances of {@code type} and are turned into text
         * with {@code formatter}.
         */
        public <T> Builder declare(String name, Class<T> type, Function<? super T, String> formatter) {
            Declaration<?> previous = declarations.get(name);
            boolean optional = previous != null && previous.optional();
            boolean nullable = previous != null && previous.nullable();
            declarations.put(name, new Declaration<>(type, formatter, true, optional, nullable));
            return this;
        }

        public <T> Builder declare(String name, Class<T> type) {
            return declare(name, type, String::valueOf);
        }

        /** {@code name} may be left out of the arguments. */
        public Builder optional(String name) {
            declarations.put(name, declarations.getOrDefault(name, Declaration.DEFAULT).withOptional());
            return this;
        }

        /** {@code name} may be left out or bound to {@code null}. */
        public Builder nullable(String name) {
            declarations.put(name, declarations.getOrDefault(name, Declaration.DEFAULT).withNullable());
            return this;
        }

        /**
         * @throws TemplateSyntaxException  if the text is malformed
         * @throws TypeMismatchException    if one name is used as plain and as conditional placeholder
         * @throws IllegalArgumentException if a declared name never appears in the text
         */
        public Template build() {
            Template template = new Template(source, Map.copyOf(declarations));
            Set<String> names = template.allNames();
            for (String declared : declarations.keySet()) {
                if (!names.contains(declared)) {
                    throw new IllegalArgumentException("Declared variable '" + declared + "' does not appear in the template");
                }
            }
            log.debug("Parsed template with {} placeholder(s): {}", names.size(), names);
            return template;
        }
    }
}
