package io.tisgrid.vm;

import io.tisgrid.vm.AstNode.*;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Static checks for one node's program: operand count and operand kinds per
 * opcode, and that every label reference names a label of the same node.
 */
public final class Validator {

    private static final class OperandRule {
        final List<EnumSet<AstNode.Kind>> kinds;

        @SafeVarargs
        OperandRule(EnumSet<AstNode.Kind>... kinds) {
            this.kinds = List.of(kinds);
        }

        int arity() { return kinds.size(); }
    }

    private static final EnumSet<AstNode.Kind> SOURCE = EnumSet.of(
            AstNode.Kind.INTEGER_LITERAL, AstNode.Kind.PORT_LITERAL, AstNode.Kind.REGISTER_LITERAL);
    private static final EnumSet<AstNode.Kind> DESTINATION = EnumSet.of(
            AstNode.Kind.PORT_LITERAL, AstNode.Kind.REGISTER_LITERAL);
    private static final EnumSet<AstNode.Kind> TARGET = EnumSet.of(AstNode.Kind.LABEL_REFERENCE);

    // HCF has no rule: it is rejected outright
    private static final Map<Opcode, OperandRule> RULES = new EnumMap<>(Opcode.class);
    static {
        RULES.put(Opcode.MOV, new OperandRule(SOURCE, DESTINATION));
        RULES.put(Opcode.NOP, new OperandRule());
        RULES.put(Opcode.SWP, new OperandRule());
        RULES.put(Opcode.SWT, new OperandRule(SOURCE));
        RULES.put(Opcode.SAV, new OperandRule());
        RULES.put(Opcode.ADD, new OperandRule(SOURCE));
        RULES.put(Opcode.SUB, new OperandRule(SOURCE));
        RULES.put(Opcode.NEG, new OperandRule());
        RULES.put(Opcode.JMP, new OperandRule(TARGET));
        RULES.put(Opcode.JEZ, new OperandRule(TARGET));
        RULES.put(Opcode.JNZ, new OperandRule(TARGET));
        RULES.put(Opcode.JGZ, new OperandRule(TARGET));
        RULES.put(Opcode.JLZ, new OperandRule(TARGET));
        RULES.put(Opcode.JRO, new OperandRule(SOURCE));
    }

    private Validator() {}

    /**
     * Maps each label name to its statement index.
     *
     * @throws SemanticException if a label is defined twice
     */
    public static Map<String, Integer> labelTable(SingleNodeProgram program) {
        Map<String, Integer> labels = new HashMap<>();
        List<AstNode> statements = program.statements();
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i).kind() == AstNode.Kind.LABEL) {
                String name = ((Label) statements.get(i)).name();
                if (labels.put(name, i) != null) {
                    throw new SemanticException("Label " + name + " is defined more than once.", i);
                }
            }
        }
        return Collections.unmodifiableMap(labels);
    }

    public static void validate(SingleNodeProgram program, Map<String, Integer> labels) {
        List<AstNode> statements = program.statements();
        for (int i = 0; i < statements.size(); i++) {
            AstNode statement = statements.get(i);
            if (statement.kind() == AstNode.Kind.INSTRUCTION) {
                validateInstruction((Instruction) statement, labels, i);
            }
        }
    }

    static void validateInstruction(Instruction instr, Map<String, Integer> labels, int index) {
        if (instr.op() == Opcode.HCF) {
            throw new SemanticException("You can't have halt-and-catch-fire instructions in a program.", index);
        }
        OperandRule rule = RULES.get(instr.op());
        if (rule != null) {
            if (instr.args().size() != rule.arity()) {
                throw new SemanticException(String.format("%s instruction did not have required %d operand(s), it had %d.",
                        instr.op().mnemonic(), rule.arity(), instr.args().size()), index);
            }
            for (int a = 0; a < rule.arity(); a++) {
                AstNode arg = instr.arg(a);
                if (!rule.kinds.get(a).contains(arg.kind())) {
                    throw new SemanticException(String.format("Operand %d of %s was %s, but had to be one of %s.",
                            a + 1, instr.op().mnemonic(), arg.kind(), rule.kinds.get(a)), index);
                }
            }
        }
        for (AstNode arg : instr.args()) {
            if (arg.kind() == AstNode.Kind.LABEL_REFERENCE) {
                String name = ((LabelReference) arg).name();
                if (!labels.containsKey(name)) {
                    throw new SemanticException("Was not able to find label for reference " + name + ".", index);
                }
            }
        }
    }
}
