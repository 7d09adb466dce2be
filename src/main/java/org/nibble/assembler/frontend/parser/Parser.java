package org.nibble.assembler.frontend.parser;

import org.nibble.assembler.api.AssemblerErrorCode;
import org.nibble.assembler.diagnostics.AssemblerLogger;
import org.nibble.assembler.frontend.lexer.Token;
import org.nibble.assembler.frontend.lexer.TokenType;
import org.nibble.assembler.frontend.semantics.LabelTable;
import org.nibble.assembler.frontend.source.SourceIndex;
import org.nibble.assembler.ir.IrImm;
import org.nibble.assembler.ir.IrInstruction;
import org.nibble.assembler.ir.IrItem;
import org.nibble.assembler.ir.IrLabelDef;
import org.nibble.assembler.ir.IrLabelRef;
import org.nibble.assembler.ir.IrOperand;
import org.nibble.assembler.ir.IrProgram;
import org.nibble.assembler.ir.IrReg;
import org.nibble.assembler.isa.Opcode;
import org.nibble.assembler.isa.OperandKind;
import org.nibble.assembler.isa.OperandRule;
import org.nibble.assembler.isa.OperandRules;
import org.nibble.assembler.isa.Register;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The parser for the assembly language. It consumes the filtered token list line by line
 * and produces the ordered IR items together with the {@link LabelTable}.
 * <p>
 * A line is {@code [label:] [mnemonic [operand [, operand]]]}. The operand shape of every
 * mnemonic comes from {@link OperandRules}. Parsing stops at the first error; there is no
 * resynchronization. A parser instance is single-use.
 */
public class Parser {

    private final List<Token> tokens;
    private final SourceIndex sourceIndex;
    private final LabelTable labels = new LabelTable();
    private int current = 0;
    private boolean pendingLabel = false;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, without comments or lexical errors.
     * @param sourceIndex The source the tokens were produced from.
     */
    public Parser(List<Token> tokens, SourceIndex sourceIndex) {
        this.tokens = tokens;
        this.sourceIndex = sourceIndex;
    }

    /**
     * Parses the entire token list.
     * @return The items in source order and the label table.
     * @throws ParseException on the first syntax error.
     */
    public ParseResult parse() throws ParseException {
        List<IrItem> items = new ArrayList<>();
        while (!isAtEnd()) {
            parseLine(items);
        }
        AssemblerLogger.debug("Parser: {} items, {} labels", items.size(), labels.size());
        return new ParseResult(new IrProgram(items), labels);
    }

    private void parseLine(List<IrItem> items) throws ParseException {
        if (match(TokenType.NEWLINE)) {
            return;
        }

        boolean parseInstruction = true;
        if (check(TokenType.LABEL)) {
            items.add(labelDefinition(peek()));
            advance();
            parseInstruction = !isAtEnd() && !check(TokenType.NEWLINE);
        }

        if (parseInstruction) {
            IrInstruction instruction = instruction();
            AssemblerLogger.trace("Parser: {}", instruction);
            items.add(instruction);
            pendingLabel = false;
        }

        consumeNewlineOrEnd();
    }

    private IrLabelDef labelDefinition(Token labelToken) throws ParseException {
        if (pendingLabel) {
            throw ParseException.at(AssemblerErrorCode.EXPECTED_INSTRUCTION_BEFORE_LABEL, labelToken);
        }
        pendingLabel = true;

        String withColon = sourceIndex.text(labelToken.span());
        String name = withColon.substring(0, withColon.length() - 1);

        Optional<Integer> existing = labels.idOf(name);
        if (existing.isPresent()) {
            int id = existing.get();
            if (labels.definitionSpanOf(id).isPresent()) {
                throw ParseException.at(AssemblerErrorCode.DUPLICATE_LABEL, labelToken);
            }
            labels.setDefinitionSpan(id, labelToken.span());
            return new IrLabelDef(id);
        }
        return new IrLabelDef(labels.insertDefinition(name, labelToken.span()));
    }

    private IrInstruction instruction() throws ParseException {
        Token mnemonic = advance();
        if (mnemonic.type() != TokenType.IDENTIFIER) {
            throw ParseException.at(AssemblerErrorCode.EXPECTED_INSTRUCTION, mnemonic);
        }

        Opcode opcode = Opcode.fromMnemonic(sourceIndex.text(mnemonic.span()))
                .orElseThrow(() -> ParseException.at(AssemblerErrorCode.INVALID_INSTRUCTION, mnemonic));
        List<OperandRule> rules = OperandRules.of(opcode);

        switch (rules.size()) {
            case 0:
                if (isAtEnd() || check(TokenType.NEWLINE)) {
                    return new IrInstruction.NoOperand(opcode, mnemonic.span());
                }
                throw ParseException.at(AssemblerErrorCode.EXPECTED_NO_OPERANDS, advance());
            case 1:
                return new IrInstruction.SingleOperand(opcode, operand(mnemonic, rules.get(0)), mnemonic.span());
            case 2:
                IrOperand first = operand(mnemonic, rules.get(0));
                expect(TokenType.COMMA);
                IrOperand second = operand(mnemonic, rules.get(1));
                return new IrInstruction.DoubleOperand(opcode, first, second, mnemonic.span());
            default:
                throw new IllegalStateException("Internal assembler error: " + opcode + " declares " + rules.size() + " operands");
        }
    }

    private IrOperand operand(Token mnemonic, OperandRule rule) throws ParseException {
        if (isAtEnd()) {
            throw ParseException.at(AssemblerErrorCode.EXPECTED_OPERAND_FOUND_EOF, mnemonic);
        }
        Token token = advance();
        if (!rule.acceptsTokenType(token.type())) {
            throw ParseException.expectedOperand(token, rule);
        }
        String text = sourceIndex.text(token.span());

        if (token.type() == TokenType.IDENTIFIER) {
            if (rule.accepts(OperandKind.REGISTER)) {
                Optional<Register> register = Register.fromName(text);
                if (register.isPresent()) {
                    return new IrReg(register.get(), token.span());
                }
            }
            if (rule.accepts(OperandKind.LABEL)) {
                // Validity of the label is checked once all definitions are known.
                return new IrLabelRef(labels.getOrInsertReference(text), token.span());
            }
            throw ParseException.at(AssemblerErrorCode.EXPECTED_REGISTER, token);
        }

        if (token.type() == TokenType.INTEGER) {
            try {
                return new IrImm(Byte.parseByte(text), token.span());
            } catch (NumberFormatException e) {
                throw ParseException.at(AssemblerErrorCode.INTEGER_OUT_OF_RANGE, token);
            }
        }

        throw new IllegalStateException("Internal assembler error: operand rule accepted token type " + token.type());
    }

    private void consumeNewlineOrEnd() throws ParseException {
        if (isAtEnd()) {
            return;
        }
        Token next = advance();
        if (next.type() != TokenType.NEWLINE) {
            throw ParseException.unexpectedToken(TokenType.NEWLINE, next);
        }
    }

    private void expect(TokenType type) throws ParseException {
        if (isAtEnd()) {
            throw ParseException.missingToken(type);
        }
        Token next = advance();
        if (next.type() != type) {
            throw ParseException.unexpectedToken(type, next);
        }
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        return tokens.get(current++);
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token peek() {
        return tokens.get(current);
    }
}
