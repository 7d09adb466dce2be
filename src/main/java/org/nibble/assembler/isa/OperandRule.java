package org.nibble.assembler.isa;

import org.nibble.assembler.frontend.lexer.TokenType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The set of operand kinds accepted at one operand position.
 *
 * @param accepted The accepted kinds, iterated in declaration order of {@link OperandKind}.
 */
public record OperandRule(Set<OperandKind> accepted) {

    public OperandRule {
        if (accepted.isEmpty()) {
            throw new IllegalArgumentException("An operand rule must accept at least one kind");
        }
        accepted = Collections.unmodifiableSet(EnumSet.copyOf(accepted));
    }

    /**
     * @param first A kind accepted at this position.
     * @param rest Further accepted kinds.
     * @return A rule accepting exactly the given kinds.
     */
    public static OperandRule of(OperandKind first, OperandKind... rest) {
        return new OperandRule(EnumSet.of(first, rest));
    }

    public boolean accepts(OperandKind kind) {
        return accepted.contains(kind);
    }

    /**
     * @param type A token type.
     * @return {@code true} if any accepted kind is written as a token of the given type.
     */
    public boolean acceptsTokenType(TokenType type) {
        return accepted.stream().anyMatch(kind -> kind.tokenType() == type);
    }

    /**
     * Describes the accepted kinds for diagnostics, e.g. {@code register}, {@code integer or label}
     * or {@code register, integer or label}.
     * @return The human-readable description.
     */
    public String describe() {
        List<String> names = accepted.stream().map(OperandKind::displayName).collect(Collectors.toList());
        if (names.size() == 1) {
            return names.get(0);
        }
        return String.join(", ", names.subList(0, names.size() - 1)) + " or " + names.get(names.size() - 1);
    }
}
