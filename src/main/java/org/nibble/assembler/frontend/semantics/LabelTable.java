package org.nibble.assembler.frontend.semantics;

import org.nibble.assembler.frontend.source.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Label table for one assembly run. Entries live in an arena indexed by their id; a separate
 * name index maps each distinct name to its id. Label names are case-sensitive.
 * <p>
 * A reference seen before the definition creates an entry without a span (a forward reference);
 * the definition fills the span in later, and the layout pass fills in the resolved offset.
 * Ids are allocated sequentially and never reused.
 */
public class LabelTable {

    private final List<LabelEntry> entries = new ArrayList<>();
    private final Map<String, Integer> nameToId = new HashMap<>();

    /**
     * @param name The label name, without the trailing colon.
     * @return The id of the label, or empty if the name has not been seen.
     */
    public Optional<Integer> idOf(String name) {
        return Optional.ofNullable(nameToId.get(name));
    }

    /**
     * Registers a label definition for a name that has not been seen before.
     * @param name The label name.
     * @param span The span of the defining token.
     * @return The newly allocated id.
     * @throws IllegalStateException if the name is already present.
     */
    public int insertDefinition(String name, Span span) {
        if (nameToId.containsKey(name)) {
            throw new IllegalStateException("Internal assembler error: label '" + name + "' inserted twice");
        }
        return allocate(name, span);
    }

    /**
     * Returns the id for a referenced label, inserting a forward reference if the name is new.
     * @param name The referenced label name.
     * @return The id of the existing or newly inserted entry.
     */
    public int getOrInsertReference(String name) {
        Integer existing = nameToId.get(name);
        if (existing != null) {
            return existing;
        }
        return allocate(name, null);
    }

    /**
     * Records the definition span of a label that was so far only referenced.
     * @param id The label id.
     * @param span The span of the defining token.
     * @throws IllegalStateException if the label already has a definition.
     */
    public void setDefinitionSpan(int id, Span span) {
        LabelEntry entry = get(id);
        if (entry.isDefined()) {
            throw new IllegalStateException("Internal assembler error: label '" + entry.name() + "' defined twice");
        }
        entry.setDefinitionSpan(span);
    }

    /**
     * Records the byte offset a label resolves to.
     * @param id The label id.
     * @param offset The resolved offset.
     */
    public void setResolvedOffset(int id, byte offset) {
        get(id).setResolvedOffset(offset);
    }

    /**
     * @param id The label id.
     * @return The definition span, or empty for a label that is only referenced.
     */
    public Optional<Span> definitionSpanOf(int id) {
        return get(id).definitionSpan();
    }

    /**
     * @param id The label id.
     * @return The resolved offset, or empty if the label has not been laid out.
     */
    public Optional<Byte> resolvedOffsetOf(int id) {
        return get(id).resolvedOffset();
    }

    /**
     * @param id The label id.
     * @return The entry with the given id.
     * @throws IllegalArgumentException if no such id was allocated.
     */
    public LabelEntry get(int id) {
        if (id < 0 || id >= entries.size()) {
            throw new IllegalArgumentException("Unknown label id: " + id);
        }
        return entries.get(id);
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return All entries in id order.
     */
    public List<LabelEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    private int allocate(String name, Span span) {
        int id = entries.size();
        entries.add(new LabelEntry(id, name, span));
        nameToId.put(name, id);
        return id;
    }
}
