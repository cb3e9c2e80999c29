package io.tisgrid.vm;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import io.tisgrid.vm.AstNode.*;
import java.util.List;
import java.util.Map;

class ValidatorTest {

    private static SingleNodeProgram program(String body) {
        return Parser.parse("@0\n" + body).node(0);
    }

    private static void check(String body) {
        SingleNodeProgram p = program(body);
        Validator.validate(p, Validator.labelTable(p));
    }

    private static SemanticException rejected(String body) {
        return assertThrows(SemanticException.class, () -> check(body), body);
    }

    // --- Accepted programs ---

    @Test void acceptsWellFormedProgram() {
        assertDoesNotThrow(() -> check(
                "start: mov up, acc\nmov acc, down\nmov 1, nil\nswt 3\nswt acc\nswt left\n"
                + "add 1\nadd acc\nsub right\nneg\nsav\nswp\nnop\n"
                + "jmp start\njez start\njnz start\njgz start\njlz start\njro -1\njro acc\njro any"));
    }

    @Test void validationIsIdempotent() {
        SingleNodeProgram p = program("loop: mov 1, acc\njnz loop");
        Map<String, Integer> labels = Validator.labelTable(p);
        Validator.validate(p, labels);
        assertDoesNotThrow(() -> Validator.validate(p, labels));
    }

    @Test void labelTableMapsToStatementIndex() {
        Map<String, Integer> labels = Validator.labelTable(program("nop\na:\nnop\nb:"));
        assertEquals(Map.of("a", 1, "b", 3), labels);
    }

    // --- Arity ---

    @Test void wrongOperandCountAlwaysFails() {
        for (String body : List.of("nop 1", "swp acc", "sav 1", "neg acc",
                "mov 1", "mov 1, acc, 2", "add", "add 1, acc", "sub", "sub 1, 2",
                "swt", "swt 1, 2", "jro", "jro 1, 2", "x: jmp", "x: jez x, x", "x: jnz", "x: jgz x, x", "x: jlz")) {
            assertTrue(rejected(body).reason().contains("operand"), body);
        }
    }

    // --- Operand kinds ---

    @Test void wrongOperandKindFails() {
        rejected("mov 1, 2");
        rejected("x: mov x, acc");
        rejected("x: mov 1, x");
        rejected("jmp 5");
        rejected("jmp acc");
        rejected("jez up");
        rejected("x: add x");
        rejected("x: jro x");
    }

    // --- Labels ---

    @Test void unresolvedLabelIsNamed() {
        SemanticException e = rejected("nop\njmp nowhere");
        assertTrue(e.getMessage().contains("nowhere"), e.getMessage());
        assertEquals(1, e.statementIndex());
    }

    @Test void labelsDoNotCrossNodes() {
        SemanticException e = assertThrows(SemanticException.class,
                () -> TisVM.load("@0\nshared:\nnop\n@1\njmp shared"));
        assertEquals(1, e.nodeId());
    }

    @Test void duplicateLabel() {
        assertThrows(SemanticException.class, () -> Validator.labelTable(program("a:\nnop\na:")));
    }

    // --- hcf ---

    @Test void hcfIsNeverValid() {
        rejected("hcf");
        rejected("nop\nhcf");
        assertThrows(SemanticException.class, () -> new Node(0, 1, 1, program("hcf")));
    }
}
