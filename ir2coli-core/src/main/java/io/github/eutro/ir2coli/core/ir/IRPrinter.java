package io.github.eutro.ir2coli.core.ir;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Renders IR as human-readable text.
 * <p>
 * Binary operators are fully parenthesised, so the rendering of an
 * expression is also valid as an affine term wherever the expression is affine.
 */
public final class IRPrinter implements ExprVisitor<Void>, StmtVisitor<Void> {
    private static final int TAB_SIZE = 2;

    private final StringBuilder sb = new StringBuilder();
    private int indent = 0;

    private IRPrinter() {
    }

    /**
     * Render an expression.
     *
     * @param e The expression.
     * @return Its text.
     */
    public static String print(Expr e) {
        IRPrinter printer = new IRPrinter();
        e.accept(printer);
        return printer.sb.toString();
    }

    /**
     * Render a statement, one line per simple statement.
     *
     * @param s The statement.
     * @return Its text.
     */
    public static String print(Stmt s) {
        IRPrinter printer = new IRPrinter();
        s.accept(printer);
        return printer.sb.toString();
    }

    /**
     * Render a list of expressions as {@code [a, b, c]}.
     *
     * @param exprs The expressions.
     * @return The text.
     */
    public static String printList(List<? extends Expr> exprs) {
        IRPrinter printer = new IRPrinter();
        printer.sb.append('[');
        printer.printArgs(exprs);
        printer.sb.append(']');
        return printer.sb.toString();
    }

    private void doIndent() {
        for (int i = 0; i < indent; i++) sb.append(' ');
    }

    private void printArgs(List<? extends Expr> args) {
        Iterator<? extends Expr> it = args.iterator();
        while (it.hasNext()) {
            it.next().accept(this);
            if (it.hasNext()) sb.append(", ");
        }
    }

    private Void binOp(Expr.BinOp op, String sym) {
        sb.append('(');
        op.a.accept(this);
        sb.append(sym);
        op.b.accept(this);
        sb.append(')');
        return null;
    }

    private Void call(String name, Expr... args) {
        sb.append(name).append('(');
        printArgs(Arrays.asList(args));
        sb.append(')');
        return null;
    }

    private void block(Stmt body) {
        sb.append(" {\n");
        indent += TAB_SIZE;
        body.accept(this);
        indent -= TAB_SIZE;
        doIndent();
        sb.append("}\n");
    }

    @Override
    public Void visit(Expr.IntImm op) {
        if (op.type.bits == 32) {
            sb.append(op.value);
        } else {
            sb.append('(').append(op.type).append(')').append(op.value);
        }
        return null;
    }

    @Override
    public Void visit(Expr.UIntImm op) {
        if (op.type.isBool()) {
            sb.append(op.value != 0);
        } else {
            sb.append('(').append(op.type).append(')').append(Long.toUnsignedString(op.value));
        }
        return null;
    }

    @Override
    public Void visit(Expr.FloatImm op) {
        if (op.type.bits == 32) {
            sb.append((float) op.value).append('f');
        } else {
            sb.append(op.value);
        }
        return null;
    }

    @Override
    public Void visit(Expr.StringImm op) {
        sb.append('"');
        for (char c : op.value.toCharArray()) {
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    sb.append(c);
            }
        }
        sb.append('"');
        return null;
    }

    @Override
    public Void visit(Expr.Cast op) {
        return call(op.type.toString(), op.value);
    }

    @Override
    public Void visit(Expr.Variable op) {
        sb.append(op.name);
        return null;
    }

    @Override
    public Void visit(Expr.Add op) {
        return binOp(op, " + ");
    }

    @Override
    public Void visit(Expr.Sub op) {
        return binOp(op, " - ");
    }

    @Override
    public Void visit(Expr.Mul op) {
        return binOp(op, "*");
    }

    @Override
    public Void visit(Expr.Div op) {
        return binOp(op, "/");
    }

    @Override
    public Void visit(Expr.Mod op) {
        return binOp(op, " % ");
    }

    @Override
    public Void visit(Expr.Min op) {
        return call("min", op.a, op.b);
    }

    @Override
    public Void visit(Expr.Max op) {
        return call("max", op.a, op.b);
    }

    @Override
    public Void visit(Expr.EQ op) {
        return binOp(op, " == ");
    }

    @Override
    public Void visit(Expr.NE op) {
        return binOp(op, " != ");
    }

    @Override
    public Void visit(Expr.LT op) {
        return binOp(op, " < ");
    }

    @Override
    public Void visit(Expr.LE op) {
        return binOp(op, " <= ");
    }

    @Override
    public Void visit(Expr.GT op) {
        return binOp(op, " > ");
    }

    @Override
    public Void visit(Expr.GE op) {
        return binOp(op, " >= ");
    }

    @Override
    public Void visit(Expr.And op) {
        return binOp(op, " && ");
    }

    @Override
    public Void visit(Expr.Or op) {
        return binOp(op, " || ");
    }

    @Override
    public Void visit(Expr.Not op) {
        sb.append('!');
        op.a.accept(this);
        return null;
    }

    @Override
    public Void visit(Expr.Select op) {
        return call("select", op.condition, op.trueValue, op.falseValue);
    }

    @Override
    public Void visit(Expr.Load op) {
        sb.append(op.name).append('[');
        op.index.accept(this);
        sb.append(']');
        return null;
    }

    @Override
    public Void visit(Expr.Ramp op) {
        sb.append("ramp(");
        op.base.accept(this);
        sb.append(", ");
        op.stride.accept(this);
        sb.append(", ").append(op.lanes).append(')');
        return null;
    }

    @Override
    public Void visit(Expr.Broadcast op) {
        sb.append('x').append(op.lanes).append('(');
        op.value.accept(this);
        sb.append(')');
        return null;
    }

    @Override
    public Void visit(Expr.Call op) {
        sb.append(op.name).append('(');
        printArgs(op.args);
        sb.append(')');
        return null;
    }

    @Override
    public Void visit(Expr.Let op) {
        sb.append("(let ").append(op.name).append(" = ");
        op.value.accept(this);
        sb.append(" in ");
        op.body.accept(this);
        sb.append(')');
        return null;
    }

    @Override
    public Void visit(Stmt.LetStmt op) {
        doIndent();
        sb.append("let ").append(op.name).append(" = ");
        op.value.accept(this);
        sb.append('\n');
        op.body.accept(this);
        return null;
    }

    @Override
    public Void visit(Stmt.AssertStmt op) {
        doIndent();
        sb.append("assert(");
        op.condition.accept(this);
        sb.append(", ");
        op.message.accept(this);
        sb.append(")\n");
        return null;
    }

    @Override
    public Void visit(Stmt.ProducerConsumer op) {
        doIndent();
        sb.append(op.isProducer ? "produce " : "consume ").append(op.name);
        block(op.body);
        return null;
    }

    @Override
    public Void visit(Stmt.For op) {
        doIndent();
        sb.append(op.forType.name().toLowerCase()).append(" (").append(op.name).append(", ");
        op.min.accept(this);
        sb.append(", ");
        op.extent.accept(this);
        sb.append(')');
        block(op.body);
        return null;
    }

    @Override
    public Void visit(Stmt.Store op) {
        doIndent();
        sb.append(op.name).append('[');
        op.index.accept(this);
        sb.append("] = ");
        op.value.accept(this);
        sb.append('\n');
        return null;
    }

    @Override
    public Void visit(Stmt.Provide op) {
        doIndent();
        sb.append(op.name).append('(');
        printArgs(op.args);
        sb.append(") = ");
        if (op.values.size() == 1) {
            op.values.get(0).accept(this);
        } else {
            sb.append('{');
            printArgs(op.values);
            sb.append('}');
        }
        sb.append('\n');
        return null;
    }

    @Override
    public Void visit(Stmt.Allocate op) {
        doIndent();
        sb.append("allocate ").append(op.name).append('[').append(op.type);
        for (Expr extent : op.extents) {
            sb.append(" * ");
            extent.accept(this);
        }
        sb.append(']');
        if (!Exprs.isOne(op.condition)) {
            sb.append(" if ");
            op.condition.accept(this);
        }
        sb.append('\n');
        op.body.accept(this);
        return null;
    }

    @Override
    public Void visit(Stmt.Free op) {
        doIndent();
        sb.append("free ").append(op.name).append('\n');
        return null;
    }

    @Override
    public Void visit(Stmt.Realize op) {
        doIndent();
        sb.append("realize ").append(op.name).append('(');
        Iterator<Range> it = op.bounds.iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) sb.append(", ");
        }
        sb.append(')');
        if (!Exprs.isOne(op.condition)) {
            sb.append(" if ");
            op.condition.accept(this);
        }
        block(op.body);
        return null;
    }

    @Override
    public Void visit(Stmt.Block op) {
        op.first.accept(this);
        if (op.rest != null) op.rest.accept(this);
        return null;
    }

    @Override
    public Void visit(Stmt.IfThenElse op) {
        doIndent();
        sb.append("if (");
        op.condition.accept(this);
        sb.append(')');
        sb.append(" {\n");
        indent += TAB_SIZE;
        op.thenCase.accept(this);
        indent -= TAB_SIZE;
        doIndent();
        if (op.elseCase != null) {
            sb.append("} else {\n");
            indent += TAB_SIZE;
            op.elseCase.accept(this);
            indent -= TAB_SIZE;
            doIndent();
        }
        sb.append("}\n");
        return null;
    }

    @Override
    public Void visit(Stmt.Evaluate op) {
        doIndent();
        op.value.accept(this);
        sb.append('\n');
        return null;
    }
}
