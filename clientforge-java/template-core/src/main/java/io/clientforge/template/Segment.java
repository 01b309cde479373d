package io.clientforge.template;

/**
 * One parsed piece of template text.
 */
interface Segment {

    /** Literal text copied to the output unchanged. */
    record Text(String text) implements Segment {
    }

    /** A {@code %name%} placeholder. */
    record Slot(String name) implements Segment {
    }

    /**
     * A conditional placeholder. {@code column} is where the opening {@code %} sits on its
     * line; the branch template was compiled with that indent.
     */
    record Branch(String name, boolean wholeLine, Template template, int column) implements Segment {
    }
}
