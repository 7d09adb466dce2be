package org.nibble.assembler.frontend.semantics;

import org.nibble.assembler.frontend.source.Span;

import java.util.Optional;

/**
 * One row of the {@link LabelTable}. The id and name never change; the definition span is
 * filled in by the parser and the resolved offset by the layout pass.
 */
public final class LabelEntry {

    private final int id;
    private final String name;
    private Span definitionSpan;
    private Byte resolvedOffset;

    LabelEntry(int id, String name, Span definitionSpan) {
        this.id = id;
        this.name = name;
        this.definitionSpan = definitionSpan;
    }

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    /**
     * @return The span of the defining {@code name:} token, or empty while the label is only referenced.
     */
    public Optional<Span> definitionSpan() {
        return Optional.ofNullable(definitionSpan);
    }

    /**
     * @return The byte offset the label resolves to, or empty before layout.
     */
    public Optional<Byte> resolvedOffset() {
        return Optional.ofNullable(resolvedOffset);
    }

    public boolean isDefined() {
        return definitionSpan != null;
    }

    void setDefinitionSpan(Span span) {
        this.definitionSpan = span;
    }

    void setResolvedOffset(byte offset) {
        this.resolvedOffset = offset;
    }

    @Override
    public String toString() {
        return "LabelEntry{id=" + id + ", name='" + name + "', span=" + definitionSpan + ", offset=" + resolvedOffset + '}';
    }
}
