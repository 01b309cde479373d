package io.clientforge.generators.java;

import io.clientforge.spec.Names;

import javax.lang.model.SourceVersion;
import java.util.Set;

/**
 * Java-specific identifier rules on top of {@link Names}.
 */
final class JavaNames {

    private JavaNames() {
    }

    /** A field or parameter name for {@code name}; keywords get a trailing underscore. */
    static String memberName(String name) {
        String member = Names.toMemberName(name);
        return SourceVersion.isKeyword(member) ? member + "_" : member;
    }

    /** {@code base}, or {@code base2}, {@code base3}, ... whichever is not yet taken. */
    static String unique(String base, Set<String> taken) {
        String candidate = base;
        for (int i = 2; taken.contains(candidate); i++) {
            candidate = base + i;
        }
        return candidate;
    }

    /** Text safe to place inside a Javadoc comment. */
    static String javadoc(String text) {
        return text.replace("*/", "*&#47;");
    }

    /** A Java string literal holding {@code text}. */
    static String literal(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
