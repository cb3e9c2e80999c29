package io.tisgrid.vm;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import io.tisgrid.vm.AstNode.SingleNodeProgram;
import java.util.List;
import java.util.Map;

class NodeTest {

    private static final SingleNodeProgram EMPTY = new SingleNodeProgram(List.of());

    // A lone node on a 1x1 grid: no neighbors at all
    private static Node node(String body) {
        return new Node(0, 1, 1, TisVM.parse("@0\n" + body).node(0));
    }

    private static Node run(String body, int steps) {
        Node n = node(body);
        step(n, steps);
        return n;
    }

    private static void step(Node n, int steps) {
        Map<Integer, Node> grid = Map.of(n.id(), n);
        for (int i = 0; i < steps; i++) {
            n.step(grid);
        }
    }

    // --- mov ---

    @Test void movIntegerToAcc() {
        assertEquals(5, run("mov 5, acc", 1).acc());
    }

    @Test void movNilReadsZeroWithoutBlocking() {
        Node n = run("mov 7, acc\nmov nil, acc", 2);
        assertEquals(0, n.acc());
        assertFalse(n.isBlocked());
        assertEquals(0, n.instructionPointer());
    }

    @Test void movToNilAlwaysCompletes() {
        Node n = run("mov 3, nil\nmov 4, acc", 2);
        assertEquals(4, n.acc());
        assertFalse(n.isBlocked());
    }

    // --- Arithmetic ---

    @Test void addAndSubIntegers() {
        assertEquals(7, run("add 10\nsub 3", 2).acc());
        assertEquals(-2, run("sub 2", 1).acc());
    }

    @Test void addAccDoubles() {
        assertEquals(14, run("mov 7, acc\nadd acc", 2).acc());
        assertEquals(-6, run("mov -3, acc\nadd acc", 2).acc());
        assertEquals(0, run("add acc", 1).acc());
    }

    @Test void subAccZeroes() {
        assertEquals(0, run("mov 9, acc\nsub acc", 2).acc());
        assertEquals(0, run("mov -40, acc\nsub acc", 2).acc());
    }

    @Test void neg() {
        assertEquals(-12, run("mov 12, acc\nneg", 2).acc());
        assertEquals(5, run("mov -5, acc\nneg", 2).acc());
    }

    // --- Register pairs ---

    @Test void savAndSwp() {
        Node n = run("mov 4, acc\nsav\nmov 1, acc\nswp", 4);
        assertEquals(4, n.acc());
        assertEquals(1, n.bak());
    }

    @Test void swpOnlyTouchesCurrentPair() {
        Node n = run("mov 2, acc\nswt 1\nmov 3, acc\nswp", 4);
        assertEquals(0, n.acc());
        assertEquals(3, n.bak());
        assertEquals(2, n.accs()[0]);
        assertEquals(0, n.baks()[0]);
    }

    @Test void swtSelectsRegisterPair() {
        Node n = run("mov 3, acc\nswt 2\nmov 9, acc\nswt 0", 3);
        assertEquals(2, n.registerCursor());
        assertEquals(9, n.acc());
        assertEquals(3, n.accs()[0]);
        step(n, 1);
        assertEquals(0, n.registerCursor());
        assertEquals(3, n.acc());
    }

    @Test void swtAccUsesCurrentAccumulator() {
        Node n = run("mov 5, acc\nswt acc", 2);
        assertEquals(5, n.registerCursor());
        assertEquals(0, n.acc());
        assertEquals(5, n.accs()[0]);
    }

    @Test void swtOutOfRangeFailsWhenExecuted() {
        Node n = node("mov 8, acc\nswt acc");
        step(n, 1);
        SemanticException e = assertThrows(SemanticException.class, () -> step(n, 1));
        assertEquals(0, n.id());
        assertEquals(0, e.nodeId());
        assertEquals(1, e.statementIndex());
        assertEquals(0, n.registerCursor());

        Node negative = node("swt -1");
        assertThrows(SemanticException.class, () -> step(negative, 1));
    }

    @Test void accsAreCopies() {
        Node n = run("mov 1, acc", 1);
        n.accs()[0] = 99;
        assertEquals(1, n.acc());
    }

    // --- Jumps ---

    @Test void jezJumpsWhenZero() {
        // falling through would load 1
        Node n = run("mov 0, acc\njez zero\nmov 1, acc\nzero: add 5", 3);
        assertEquals(5, n.acc());
    }

    @Test void conditionalJumpsFallThrough() {
        assertEquals(1, run("mov 0, acc\njnz x\nmov 1, acc\nx: nop", 3).acc());
        assertEquals(1, run("mov 0, acc\njgz x\nmov 1, acc\nx: nop", 3).acc());
        assertEquals(1, run("mov 0, acc\njlz x\nmov 1, acc\nx: nop", 3).acc());
        assertEquals(1, run("mov 2, acc\njez x\nmov 1, acc\nx: nop", 3).acc());
    }

    @Test void conditionalJumpsTaken() {
        assertEquals(2, run("mov 2, acc\njnz x\nmov 1, acc\nx: nop", 3).acc());
        assertEquals(2, run("mov 2, acc\njgz x\nmov 1, acc\nx: nop", 3).acc());
        assertEquals(-2, run("mov -2, acc\njlz x\nmov 1, acc\nx: nop", 3).acc());
    }

    @Test void jmpBackwards() {
        Node n = run("mov 1, acc\nloop: add 1\njmp loop", 7);
        // mov, then three rounds of add + jmp
        assertEquals(4, n.acc());
    }

    @Test void jroCountsOnlyInstructions() {
        Node n = run("jro 2\na:\nmov 1, acc\nb:\nmov 2, acc\nmov 3, acc", 2);
        assertEquals(2, n.acc());
    }

    @Test void jroBackwardsAndClamped() {
        Node n = run("mov 1, acc\nadd 1\njro -2", 3);
        assertEquals(2, n.acc());
        assertEquals(0, n.instructionPointer());
        Node clamped = run("add 1\njro -9", 2);
        assertEquals(0, clamped.instructionPointer());
        Node past = run("jro 9\nmov 1, acc\nmov 2, acc", 2);
        assertEquals(2, past.acc());
    }

    @Test void jroExtremeOffsetsClamp() {
        Node forward = run("nop\njro 9223372036854775807\nmov 1, acc\nmov 2, acc", 3);
        assertEquals(2, forward.acc());
        Node backward = run("add 1\njro -9223372036854775808", 2);
        assertEquals(0, backward.instructionPointer());
    }

    @Test void jroZeroRepeatsItself() {
        Node n = run("jro 0\nmov 1, acc", 5);
        assertEquals(0, n.acc());
        assertEquals(0, n.instructionPointer());
    }

    @Test void jroAcc() {
        Node n = run("mov 2, acc\njro acc\nmov 5, acc\nmov 7, acc", 3);
        assertEquals(7, n.acc());
    }

    // --- Control flow ---

    @Test void labelsTakeNoTime() {
        Node n = run("a:\nmov 1, acc\nb:\nadd 1\njmp a", 2);
        assertEquals(2, n.acc());
        step(n, 2);
        assertEquals(1, n.acc());
    }

    @Test void instructionPointerWraps() {
        Node n = run("mov 1, acc\nadd 1", 3);
        assertEquals(1, n.acc());
        assertEquals(1, n.instructionPointer());
    }

    @Test void labelOnlyProgramIsNoOp() {
        Node n = run("a:\nb:\nc:", 10);
        assertFalse(n.isBlocked());
        assertEquals(0, n.acc());
    }

    @Test void emptyProgramIsNoOp() {
        Node n = run("", 3);
        assertNull(n.currentStatement());
        assertEquals(0, n.instructionPointer());
    }

    // --- Blocking on a lone node ---

    @Test void readFromLastBeforeAnyTransferBlocksForever() {
        Node n = run("mov last, acc\nmov 1, acc", 1000);
        assertTrue(n.isBlocked());
        assertEquals(Port.LAST, n.pendingReceive());
        assertEquals(0, n.acc());
        assertEquals(0, n.instructionPointer());
    }

    @Test void writeToLastBeforeAnyTransferBlocksForever() {
        Node n = run("mov 3, last\nmov 1, acc", 50);
        assertEquals(new Node.Transfer(Port.LAST, 3), n.pendingSend());
        assertEquals(0, n.acc());
    }

    @Test void sendOffGridEdgeBlocksForever() {
        Node n = run("mov 1, up\nmov 2, acc", 10);
        assertEquals(new Node.Transfer(Port.UP, 1), n.pendingSend());
        assertNull(n.pendingReceive());
        assertEquals(0, n.acc());
    }

    @Test void sendToAnyWithNoNeighborBlocks() {
        Node n = run("mov 1, any", 10);
        assertEquals(new Node.Transfer(Port.ANY, 1), n.pendingSend());
    }

    @Test void receiveFromMissingNeighborBlocks() {
        Node n = run("add left", 10);
        assertEquals(Port.LEFT, n.pendingReceive());
        assertNull(n.deliveredValue());
    }

    // --- Neighbors ---

    @Test void neighborIds() {
        Node corner = new Node(0, 4, 5, EMPTY);
        assertNull(corner.neighborId(Port.UP));
        assertNull(corner.neighborId(Port.LEFT));
        assertEquals(5, corner.neighborId(Port.DOWN));
        assertEquals(1, corner.neighborId(Port.RIGHT));

        Node rowStart = new Node(5, 4, 5, EMPTY);
        assertEquals(0, rowStart.neighborId(Port.UP));
        assertEquals(10, rowStart.neighborId(Port.DOWN));
        assertNull(rowStart.neighborId(Port.LEFT));
        assertEquals(6, rowStart.neighborId(Port.RIGHT));

        Node rowEnd = new Node(4, 4, 5, EMPTY);
        assertNull(rowEnd.neighborId(Port.RIGHT));
        assertEquals(3, rowEnd.neighborId(Port.LEFT));

        Node last = new Node(19, 4, 5, EMPTY);
        assertNull(last.neighborId(Port.DOWN));
        assertNull(last.neighborId(Port.RIGHT));
        assertEquals(14, last.neighborId(Port.UP));

        assertThrows(IllegalArgumentException.class, () -> corner.neighborId(Port.ANY));
    }

    @Test void describeListsState() {
        String d = run("mov 5, acc\nmov acc, up", 2).describe();
        assertTrue(d.contains("Node 0"), d);
        assertTrue(d.contains("pending send: (UP, 5)"), d);
    }
}
