package io.tisgrid.vm;

import io.tisgrid.vm.AstNode.*;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Recursive-descent parser. Each grammar rule is one method reading from a
 * shared cursor over the token list; whitespace and comments are dropped
 * before parsing starts.
 *
 * <pre>
 * Program           := (NODE_SPECIFIER SingleNodeProgram)*
 * SingleNodeProgram := (Instruction | LABEL)*
 * Instruction       := INSTRUCTION (SEPARATOR* Operand)* SEPARATOR*
 * Operand           := INTEGER | PORT | REGISTER | LABEL_REF
 * </pre>
 */
public class Parser {
    private static final Logger logger = LogManager.getLogger();

    private final List<Token> tokens;
    private int pos;

    public Parser(List<Token> tokens) {
        this.tokens = new ArrayList<>();
        for (Token t : tokens) {
            if (!t.kind().isTrivia()) {
                this.tokens.add(t);
            }
        }
    }

    /** Lexes and parses source text. */
    public static Program parse(String source) {
        return new Parser(Lexer.tokenize(source)).parseProgram();
    }

    public Program parseProgram() {
        Map<Integer, SingleNodeProgram> nodes = new LinkedHashMap<>();
        while (!atEnd()) {
            Token next = tokens.get(pos++);
            // Anything outside a node section is skipped
            if (next.kind() != TokenKind.NODE_SPECIFIER) {
                continue;
            }
            if (nodes.containsKey(next.nodeId())) {
                throw new ParseException("Node @" + next.nodeId() + " is declared more than once.", next);
            }
            nodes.put(next.nodeId(), parseSingleNode());
        }
        logger.debug("Parsed {} node program(s): {}", nodes.size(), nodes.keySet());
        return new Program(nodes);
    }

    SingleNodeProgram parseSingleNode() {
        List<AstNode> statements = new ArrayList<>();
        while (!atEnd()) {
            Token next = peek();
            switch (next.kind()) {
                case INSTRUCTION:
                    statements.add(parseInstruction());
                    break;
                case LABEL:
                    pos++;
                    statements.add(new Label(next.text(), next.span()));
                    break;
                case NODE_SPECIFIER:
                    return new SingleNodeProgram(statements);
                default:
                    throw new ParseException("Expected an instruction or a label, found "
                            + next.kind() + ".", next);
            }
        }
        return new SingleNodeProgram(statements);
    }

    Instruction parseInstruction() {
        Token opToken = expect(TokenKind.INSTRUCTION);
        List<AstNode> args = new ArrayList<>();
        int end = opToken.span().end();
        boolean lastWasSeparator = true;

        while (!atEnd()) {
            Token next = peek();
            if (next.kind() == TokenKind.SEPARATOR) {
                pos++;
                lastWasSeparator = true;
                continue;
            }
            AstNode operand = operand(next);
            if (operand == null) {
                break;
            }
            if (!args.isEmpty() && !lastWasSeparator) {
                throw new ParseException("Expected a separator before operand " + next.value() + ".", next);
            }
            pos++;
            args.add(operand);
            end = next.span().end();
            lastWasSeparator = false;
        }
        return new Instruction(opToken.opcode(), args, new SourceSpan(opToken.span().start(), end));
    }

    /** The operand node for a token, or null if the token cannot start an operand. */
    private static AstNode operand(Token t) {
        switch (t.kind()) {
            case INTEGER: return new IntegerLiteral(t.longValue());
            case PORT: return new PortLiteral(t.port());
            case REGISTER: return RegisterLiteral.ACC;
            case LABEL_REF: return new LabelReference(t.text());
            default: return null;
        }
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private boolean atEnd() {
        return pos >= tokens.size();
    }

    private Token expect(TokenKind kind) {
        Token next = tokens.get(pos);
        if (next.kind() != kind) {
            throw new ParseException("Unexpected token: was expecting " + kind + ", but got " + next.kind() + ".", next);
        }
        pos++;
        return next;
    }
}
