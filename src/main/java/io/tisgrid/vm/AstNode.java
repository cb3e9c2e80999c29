package io.tisgrid.vm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Abstract syntax tree. The variants are the nested final classes below and
 * are immutable once built.
 */
public abstract class AstNode {

    public enum Kind {
        INTEGER_LITERAL, PORT_LITERAL, REGISTER_LITERAL, LABEL, LABEL_REFERENCE,
        INSTRUCTION, SINGLE_NODE_PROGRAM, PROGRAM
    }

    public abstract Kind kind();

    /** Structural dump as a keyed tree: a "type" tag plus the payload. */
    public abstract Map<String, Object> toTree();

    private static Map<String, Object> tree(String type, String key, Object payload) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type);
        m.put(key, payload);
        return m;
    }

    // --- Operands ---

    public static final class IntegerLiteral extends AstNode {
        private final long value;

        public IntegerLiteral(long value) {
            this.value = value;
        }

        public long value() { return value; }

        @Override public Kind kind() { return Kind.INTEGER_LITERAL; }

        @Override public Map<String, Object> toTree() { return tree("IntegerLiteral", "value", value); }

        @Override
        public boolean equals(Object o) {
            return o instanceof IntegerLiteral && ((IntegerLiteral) o).value == value;
        }

        @Override public int hashCode() { return Long.hashCode(value); }

        @Override public String toString() { return Long.toString(value); }
    }

    public static final class PortLiteral extends AstNode {
        private final Port port;

        public PortLiteral(Port port) {
            this.port = Objects.requireNonNull(port);
        }

        public Port port() { return port; }

        @Override public Kind kind() { return Kind.PORT_LITERAL; }

        @Override public Map<String, Object> toTree() { return tree("PortLiteral", "value", port.name()); }

        @Override
        public boolean equals(Object o) {
            return o instanceof PortLiteral && ((PortLiteral) o).port == port;
        }

        @Override public int hashCode() { return port.hashCode(); }

        @Override public String toString() { return port.name(); }
    }

    /** The accumulator. There is only one register name, so this is a singleton. */
    public static final class RegisterLiteral extends AstNode {
        public static final RegisterLiteral ACC = new RegisterLiteral();

        private RegisterLiteral() {}

        @Override public Kind kind() { return Kind.REGISTER_LITERAL; }

        @Override public Map<String, Object> toTree() { return tree("RegisterLiteral", "value", "ACC"); }

        @Override public String toString() { return "ACC"; }
    }

    public static final class LabelReference extends AstNode {
        private final String name;

        public LabelReference(String name) {
            this.name = Objects.requireNonNull(name);
        }

        public String name() { return name; }

        @Override public Kind kind() { return Kind.LABEL_REFERENCE; }

        @Override public Map<String, Object> toTree() { return tree("LabelReference", "value", name); }

        @Override
        public boolean equals(Object o) {
            return o instanceof LabelReference && ((LabelReference) o).name.equals(name);
        }

        @Override public int hashCode() { return name.hashCode(); }

        @Override public String toString() { return name; }
    }

    // --- Statements ---

    /** A label definition. Takes no time when executed. */
    public static final class Label extends AstNode {
        private final String name;
        private final SourceSpan span;

        public Label(String name) {
            this(name, null);
        }

        public Label(String name, SourceSpan span) {
            this.name = Objects.requireNonNull(name);
            this.span = span;
        }

        public String name() { return name; }

        /** Where the label was written, or null for hand-built trees. */
        public SourceSpan span() { return span; }

        @Override public Kind kind() { return Kind.LABEL; }

        @Override public Map<String, Object> toTree() { return tree("Label", "value", name); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Label && ((Label) o).name.equals(name);
        }

        @Override public int hashCode() { return name.hashCode(); }

        @Override public String toString() { return name + ":"; }
    }

    public static final class Instruction extends AstNode {
        private final Opcode op;
        private final List<AstNode> args;
        private final SourceSpan span;

        public Instruction(Opcode op, List<AstNode> args) {
            this(op, args, null);
        }

        public Instruction(Opcode op, List<AstNode> args, SourceSpan span) {
            this.op = Objects.requireNonNull(op);
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
            this.span = span;
        }

        public Opcode op() { return op; }

        public List<AstNode> args() { return args; }

        public AstNode arg(int index) { return args.get(index); }

        /** Where the instruction was written, or null for hand-built trees. */
        public SourceSpan span() { return span; }

        @Override public Kind kind() { return Kind.INSTRUCTION; }

        @Override
        public Map<String, Object> toTree() {
            List<Object> argTrees = new ArrayList<>(args.size());
            for (AstNode arg : args) {
                argTrees.add(arg.toTree());
            }
            Map<String, Object> m = tree("Instruction", "op", op.mnemonic());
            m.put("args", argTrees);
            return m;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Instruction)) return false;
            Instruction other = (Instruction) o;
            return op == other.op && args.equals(other.args);
        }

        @Override public int hashCode() { return 31 * op.hashCode() + args.hashCode(); }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(op.mnemonic());
            for (int i = 0; i < args.size(); i++) {
                sb.append(i == 0 ? " " : ", ").append(args.get(i));
            }
            return sb.toString();
        }
    }

    // --- Programs ---

    /** One node's statements, labels and instructions, in source order. */
    public static final class SingleNodeProgram extends AstNode {
        private final List<AstNode> statements;

        public SingleNodeProgram(List<AstNode> statements) {
            for (AstNode s : statements) {
                if (s.kind() != Kind.INSTRUCTION && s.kind() != Kind.LABEL) {
                    throw new IllegalArgumentException("Not a statement: " + s);
                }
            }
            this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        }

        public List<AstNode> statements() { return statements; }

        public int size() { return statements.size(); }

        @Override public Kind kind() { return Kind.SINGLE_NODE_PROGRAM; }

        @Override
        public Map<String, Object> toTree() {
            List<Object> trees = new ArrayList<>(statements.size());
            for (AstNode s : statements) {
                trees.add(s.toTree());
            }
            return tree("SingleNodeProgram", "ast", trees);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SingleNodeProgram && ((SingleNodeProgram) o).statements.equals(statements);
        }

        @Override public int hashCode() { return statements.hashCode(); }
    }

    /** All node programs of a source file, keyed by node id. */
    public static final class Program extends AstNode {
        private final Map<Integer, SingleNodeProgram> nodesById;

        public Program(Map<Integer, SingleNodeProgram> nodesById) {
            this.nodesById = Collections.unmodifiableMap(new TreeMap<>(nodesById));
        }

        public Map<Integer, SingleNodeProgram> nodesById() { return nodesById; }

        public SingleNodeProgram node(int id) { return nodesById.get(id); }

        @Override public Kind kind() { return Kind.PROGRAM; }

        @Override
        public Map<String, Object> toTree() {
            Map<String, Object> nodes = new LinkedHashMap<>();
            for (Map.Entry<Integer, SingleNodeProgram> e : nodesById.entrySet()) {
                nodes.put(Integer.toString(e.getKey()), e.getValue().toTree());
            }
            return tree("Program", "nodes", nodes);
        }
    }
}
