package io.github.eutro.ir2coli.codegen;

import io.github.eutro.ir2coli.core.ir.*;
import io.github.eutro.ir2coli.core.passes.InlineLets;
import io.github.eutro.ir2coli.core.passes.Simplify;
import io.github.eutro.ir2coli.core.passes.Substitute;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static io.github.eutro.ir2coli.codegen.CodegenException.Reason.*;

/**
 * Generates a COLi program from a loop nest.
 * <p>
 * Construction writes the prologue of the program: headers, the entry point,
 * the function context, and the declarations of the output and input buffers.
 * {@link #print(Stmt)} then writes one declaration for each buffer, computation
 * and constant the loop nest defines, and {@link #close()} writes the epilogue,
 * binding the arguments and calling into the framework to schedule, lower, dump
 * and emit the function.
 * <p>
 * A generator translates exactly one pipeline and is not thread-safe.
 * Any exception leaves the output incomplete; see {@link ColiCompiler}
 * for a wrapper that only writes complete programs.
 */
public class ColiCodeGen implements StmtVisitor<Void>, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ColiCodeGen.class);

    private static final String HEADERS = "#include <isl/set.h>\n" +
            "#include <isl/union_map.h>\n" +
            "#include <isl/union_set.h>\n" +
            "#include <isl/ast_build.h>\n" +
            "#include <isl/schedule.h>\n" +
            "#include <isl/schedule_node.h>\n\n" +
            "#include <coli/debug.h>\n" +
            "#include <coli/core.h>\n\n" +
            "#include <string.h>\n" +
            "#include <Halide.h>\n" +
            "#include \"halide_image_io.h\"\n";

    /**
     * Continuation lines of a computation declaration are indented this many levels deeper.
     */
    private static final int CONTINUATION_INDENT = 5;

    private static final String BUFFER_PREFIX = "buff_";

    private final CodeEmitter out;
    private final String func;
    private final ColiOptions options;

    private final Scope<Expr> scope = new Scope<>();
    private final LoopDims loopDims = new LoopDims();
    private final Declarations decls = new Declarations();
    private final ExprCodeGen exprCodeGen = new ExprCodeGen();

    private int depth = 0;
    private boolean closed = false;

    /**
     * Construct a generator with default options, writing the prologue.
     *
     * @param dest         Where to write the program.
     * @param pipelineName The name of the generated function, a C identifier.
     * @param outputs      The outputs of the pipeline.
     * @param inputs       The input images of the pipeline.
     */
    public ColiCodeGen(Appendable dest, String pipelineName, List<BufferSpec> outputs, List<BufferSpec> inputs) {
        this(dest, pipelineName, outputs, inputs, ColiOptions.DEFAULT);
    }

    /**
     * Construct a generator, writing the prologue.
     *
     * @param dest         Where to write the program.
     * @param pipelineName The name of the generated function, a C identifier.
     * @param outputs      The outputs of the pipeline.
     * @param inputs       The input images of the pipeline.
     * @param options      The options.
     */
    public ColiCodeGen(
            Appendable dest,
            String pipelineName,
            List<BufferSpec> outputs,
            List<BufferSpec> inputs,
            ColiOptions options
    ) {
        if (!Names.isIdentifier(pipelineName)) {
            throw new IllegalArgumentException("pipeline name is not an identifier: " + pipelineName);
        }
        this.out = new CodeEmitter(dest, options.tabSize);
        this.func = pipelineName;
        this.options = options;

        out.print(HEADERS).print("\n\n");
        out.print("using namespace coli;\n\n");
        out.print("int main(int argc, char **argv)\n");
        out.print("{\n");
        out.indent();

        out.line("// Set default coli options.");
        out.line("global::set_default_coli_options();");
        out.newline();
        out.linef("coli::function %s(\"%s\");", func, func);

        for (BufferSpec output : outputs) {
            declareOutput(output);
        }
        for (BufferSpec input : inputs) {
            declareInput(input);
        }
    }

    private static String bufferName(String name) {
        return BUFFER_PREFIX + name;
    }

    private static String extentsList(List<Integer> extents) {
        return extents.stream()
                .map(extent -> "coli::expr(" + extent + ")")
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private void declareOutput(BufferSpec output) {
        String bufferName = bufferName(output.name);
        decls.declareBuffer(bufferName, BufferRole.OUTPUT);
        for (int i = 0; i < output.rank(); i++) {
            scope.push(Names.printName(output.name + ".min." + i), Exprs.intConst(0));
            scope.push(Names.printName(output.name + ".extent." + i), Exprs.intConst(output.extents.get(i)));
        }
        out.linef("coli::buffer %s(\"%s\", %d, %s, %s, NULL, %s, &%s);",
                bufferName, bufferName, output.rank(), extentsList(output.extents),
                ColiTypes.typeName(output.type), BufferRole.OUTPUT.coliName, func);
    }

    private void declareInput(BufferSpec input) {
        String bufferName = bufferName(input.name);
        decls.declareBuffer(bufferName, BufferRole.INPUT);
        String typeName = ColiTypes.typeName(input.type);
        out.linef("coli::buffer %s(\"%s\", %d, %s, %s, NULL, %s, &%s);",
                bufferName, bufferName, input.rank(), extentsList(input.extents),
                typeName, BufferRole.INPUT.coliName, func);

        // the input is read through a computation spanning the whole buffer
        List<String> dims = new ArrayList<>();
        for (int i = 0; i < input.rank(); i++) {
            String dim = "i" + i;
            dims.add(dim);
            loopDims.push(dim, Exprs.intConst(0), Exprs.intConst(input.extents.get(i)));
        }
        String dimsStr = "[" + String.join(", ", dims) + "]";
        decls.declareComputation(input.name);
        out.linef("coli::computation %s(\"%s\", expr(), false, %s, &%s);",
                input.name, loopDims.domain(input.name, dimsStr), typeName, func);
        out.linef("%s.set_access(\"%s\");", input.name, accessRelation(input.name, dimsStr));
        out.newline();
        for (int i = 0; i < input.rank(); i++) {
            loopDims.pop();
        }
    }

    private static String accessRelation(String name, String dims) {
        return "{" + name + dims + "->" + bufferName(name) + dims + "}";
    }

    /**
     * Generate the declarations for a loop nest.
     * <p>
     * Expression-level lets are inlined first.
     *
     * @param s The loop nest.
     */
    public void print(@NotNull Stmt s) {
        if (closed) throw new IllegalStateException("generator already closed");
        visitStmt(InlineLets.INSTANCE.run(s));
    }

    /**
     * Render an expression as an expression of the generated program.
     * <p>
     * Expression-level lets are inlined first.
     *
     * @param e The expression.
     * @return The rendered expression.
     */
    public String print(@NotNull Expr e) {
        return printExpr(InlineLets.INSTANCE.mutate(e));
    }

    /**
     * Write the epilogue of the program. Further calls do nothing.
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;

        List<String> args = new ArrayList<>();
        for (String buffer : decls.buffers(BufferRole.OUTPUT)) args.add("&" + buffer);
        for (String buffer : decls.buffers(BufferRole.INPUT)) args.add("&" + buffer);

        out.newline();
        out.linef("%s.set_arguments({%s});", func, String.join(", ", args));
        out.linef("%s.gen_isl_ast();", func);
        out.linef("%s.gen_halide_stmt();", func);
        out.linef("%s.dump_halide_stmt();", func);
        out.linef("%s.gen_halide_obj(\"%s\");", func, String.format(options.objectFileFormat, func));
        out.dedent();
        out.line("}");
        out.newline();
    }

    private void enter() {
        if (depth >= options.maxDepth) {
            throw new CodegenException(TOO_DEEP,
                    "IR is nested more than " + options.maxDepth + " levels deep.");
        }
        depth++;
    }

    private void visitStmt(Stmt s) {
        enter();
        try {
            s.accept(this);
        } finally {
            depth--;
        }
    }

    private String printExpr(Expr e) {
        enter();
        try {
            return e.accept(exprCodeGen);
        } finally {
            depth--;
        }
    }

    private static CodegenException unsupported(String what) {
        return new CodegenException(UNSUPPORTED_CONSTRUCT, "Conversion of " + what + " to COLi is not supported.");
    }

    private void defineConstant(String name, Expr value) {
        decls.declareConstant(name);
        Expr simplified = Simplify.simplify(value);
        out.linef("coli::constant %s(\"%s\", %s, %s, true, NULL, 0, &%s);",
                name, name, printExpr(simplified), ColiTypes.typeName(simplified.type), func);
    }

    @Override
    public Void visit(Stmt.LetStmt op) {
        // close the value over the scope it is defined in, so later shadowing lets can't capture its names
        Expr value = Substitute.substitute(scope.bindings(), op.value);
        LOG.trace("let {} = {}", op.name, value);
        scope.push(op.name, value);
        visitStmt(op.body);
        scope.pop(op.name);
        return null;
    }

    @Override
    public Void visit(Stmt.AssertStmt op) {
        LOG.trace("Dropping assertion {}, conversion of AssertStmt to COLi is not supported.", op.condition);
        return null;
    }

    @Override
    public Void visit(Stmt.ProducerConsumer op) {
        if (op.body instanceof Stmt.Block) {
            throw new CodegenException(UNSUPPORTED_UPDATE,
                    "Producer/consumer of " + op.name + " has more than one statement; updates are not supported.");
        }
        if (op.isProducer && decls.isComputation(op.name)) {
            throw new CodegenException(DUPLICATE_COMPUTATION,
                    "Found another computation with the same name: " + op.name + ".");
        }

        List<LoopDim> saved = loopDims.snapshot();
        visitStmt(op.body);
        loopDims.restore(saved);
        return null;
    }

    @Override
    public Void visit(Stmt.For op) {
        if (!(op.min instanceof Expr.Variable)) {
            throw new IllegalStateException("Min of loop " + op.name + " should have been a variable, got " + op.min);
        }
        if (!(op.extent instanceof Expr.Variable)) {
            throw new IllegalStateException("Extent of loop " + op.name + " should have been a variable, got " + op.extent);
        }
        String minName = ((Expr.Variable) op.min).name;
        String extentName = ((Expr.Variable) op.extent).name;

        Expr minVal = scope.get(minName);
        Expr extentVal = scope.get(extentName);

        loopDims.push(op.name, op.min, op.extent);
        out.linef("// Define loop bounds for dimension \"%s\".", op.name);
        defineConstant(minName, minVal);
        defineConstant(extentName, extentVal);
        out.newline();

        // the loop index shadows any let of the same name in its body
        scope.push(op.name, new Expr.Variable(op.min.type, op.name));
        visitStmt(op.body);
        scope.pop(op.name);
        loopDims.pop();
        return null;
    }

    @Override
    public Void visit(Stmt.Store op) {
        throw new CodegenException(UNSUPPORTED_CONSTRUCT,
                "Store to " + op.name + " is flattened; COLi needs the unflattened Provide form.");
    }

    @Override
    public Void visit(Stmt.Provide op) {
        if (decls.isComputation(op.name)) {
            throw new CodegenException(DUPLICATE_COMPUTATION,
                    "Duplicate computation " + op.name + " is not supported.");
        }
        BufferRole role = decls.bufferRole(bufferName(op.name));
        if (role != BufferRole.OUTPUT && role != BufferRole.TEMPORARY) {
            throw new CodegenException(MISSING_BUFFER,
                    "The buffer for " + op.name + " should have been allocated previously.");
        }
        for (Expr arg : op.args) {
            if (!(arg instanceof Expr.Variable)) {
                throw new CodegenException(MALFORMED_STORE,
                        "Arguments of Provide to " + op.name + " should be loop dimensions, got " + arg
                                + "; updates are not supported.");
            }
        }
        if (op.values.size() != 1) {
            throw new CodegenException(MALFORMED_STORE,
                    "Provide to " + op.name + " stores " + op.values.size() + " values; only one is supported.");
        }

        Expr value = op.values.get(0);
        String dims = IRPrinter.printList(op.args);

        out.doIndent().print("coli::computation " + op.name + "(\"")
                .print(loopDims.domainHead(op.name, dims)).print("\"\n");
        out.indent(CONTINUATION_INDENT);
        out.line("\"" + loopDims.boundPredicate() + "}\",");
        out.line(printExpr(value) + ", true, " + ColiTypes.typeName(value.type) + ", &" + func + ");");
        out.indent(-CONTINUATION_INDENT);

        out.linef("%s.set_access(\"%s\");", op.name, accessRelation(op.name, dims));

        decls.declareComputation(op.name);
        return null;
    }

    @Override
    public Void visit(Stmt.Allocate op) {
        throw new CodegenException(UNSUPPORTED_CONSTRUCT,
                "Allocate of " + op.name + " is flattened; COLi needs the unflattened Realize form.");
    }

    @Override
    public Void visit(Stmt.Free op) {
        throw unsupported("Free");
    }

    @Override
    public Void visit(Stmt.Realize op) {
        String bufferName = bufferName(op.name);
        if (decls.isBuffer(bufferName)) {
            throw new CodegenException(DUPLICATE_BUFFER,
                    "Duplicate allocation (i.e. duplicate compute) of " + op.name + " is not supported.");
        }
        if (op.types.isEmpty()) {
            throw new CodegenException(UNSUPPORTED_REALIZE, "Realize of " + op.name + " has no types.");
        }
        for (int i = 1; i < op.types.size(); i++) {
            if (!op.types.get(i - 1).equals(op.types.get(i))) {
                throw new CodegenException(UNSUPPORTED_REALIZE,
                        "Realize of " + op.name + " should have the same type for all values.");
            }
        }
        for (Range bound : op.bounds) {
            if (!Exprs.isZero(bound.min)) {
                throw new CodegenException(UNSUPPORTED_REALIZE,
                        "Bounds of realize of " + op.name + " should start from 0, got " + bound.min + ".");
            }
        }

        StringBuilder sizes = new StringBuilder("{");
        Iterator<Range> it = op.bounds.iterator();
        while (it.hasNext()) {
            sizes.append(printExpr(it.next().extent));
            if (it.hasNext()) sizes.append(", ");
        }
        sizes.append('}');

        out.linef("coli::buffer %s(\"%s\", %d, %s, %s, NULL, %s, &%s);",
                bufferName, bufferName, op.bounds.size(), sizes,
                ColiTypes.typeName(op.types.get(0)), BufferRole.TEMPORARY.coliName, func);
        decls.declareBuffer(bufferName, BufferRole.TEMPORARY);

        visitStmt(op.body);
        return null;
    }

    @Override
    public Void visit(Stmt.Block op) {
        visitStmt(op.first);
        if (op.rest != null) visitStmt(op.rest);
        return null;
    }

    @Override
    public Void visit(Stmt.IfThenElse op) {
        // only the then case is translated
        if (op.elseCase != null) {
            LOG.warn("Conversion of IfThenElse to COLi is not supported; discarding the else case of if {}",
                    op.condition);
            LOG.trace("discarded else case:\n{}", op.elseCase);
        } else {
            LOG.trace("Conversion of IfThenElse to COLi is not supported; translating only the then case of if {}",
                    op.condition);
        }
        visitStmt(op.thenCase);
        return null;
    }

    @Override
    public Void visit(Stmt.Evaluate op) {
        LOG.trace("Ignoring evaluate of {}", op.value);
        return null;
    }

    /**
     * Renders expressions of the generated program.
     */
    private class ExprCodeGen implements ExprVisitor<String> {
        private String binOp(Expr.BinOp op, String sym) {
            return "(" + printExpr(op.a) + sym + printExpr(op.b) + ")";
        }

        private String exprOp(String coliOp, Expr... args) {
            StringBuilder sb = new StringBuilder("coli::expr(").append(coliOp);
            for (Expr arg : args) {
                sb.append(", ").append(printExpr(arg));
            }
            return sb.append(')').toString();
        }

        @Override
        public String visit(Expr.IntImm op) {
            return "coli::expr(" + ColiTypes.literalCast(op.type) + op.value + ")";
        }

        @Override
        public String visit(Expr.UIntImm op) {
            if (op.type.isBool()) {
                return "coli::expr(" + (op.value != 0) + ")";
            }
            return "coli::expr(" + ColiTypes.literalCast(op.type) + Long.toUnsignedString(op.value) + ")";
        }

        @Override
        public String visit(Expr.FloatImm op) {
            String literal;
            if (Double.isNaN(op.value)) {
                literal = "NAN";
            } else if (Double.isInfinite(op.value)) {
                literal = op.value > 0 ? "INFINITY" : "-INFINITY";
            } else {
                literal = null;
            }
            if (op.type.bits == 32) {
                return "coli::expr((float)" + (literal == null ? Float.toString((float) op.value) : literal) + ")";
            } else if (op.type.bits == 64) {
                return "coli::expr(" + (literal == null ? Double.toString(op.value) : literal) + ")";
            }
            throw new CodegenException(UNSUPPORTED_WIDTH,
                    "Conversion of float" + op.type.bits + " to COLi is not supported.");
        }

        @Override
        public String visit(Expr.StringImm op) {
            throw unsupported("StringImm");
        }

        @Override
        public String visit(Expr.Cast op) {
            throw unsupported("Cast");
        }

        @Override
        public String visit(Expr.Variable op) {
            if (decls.isConstant(op.name)) {
                return op.name + "(0)";
            }
            // otherwise it names a loop index
            return "coli::idx(\"" + op.name + "\")";
        }

        @Override
        public String visit(Expr.Add op) {
            return binOp(op, " + ");
        }

        @Override
        public String visit(Expr.Sub op) {
            return binOp(op, " - ");
        }

        @Override
        public String visit(Expr.Mul op) {
            return binOp(op, "*");
        }

        @Override
        public String visit(Expr.Div op) {
            return binOp(op, "/");
        }

        @Override
        public String visit(Expr.Mod op) {
            return binOp(op, " % ");
        }

        @Override
        public String visit(Expr.Min op) {
            return exprOp("coli::o_min", op.a, op.b);
        }

        @Override
        public String visit(Expr.Max op) {
            return exprOp("coli::o_max", op.a, op.b);
        }

        @Override
        public String visit(Expr.EQ op) {
            return binOp(op, " == ");
        }

        @Override
        public String visit(Expr.NE op) {
            return binOp(op, " != ");
        }

        @Override
        public String visit(Expr.LT op) {
            return binOp(op, " < ");
        }

        @Override
        public String visit(Expr.LE op) {
            return binOp(op, " <= ");
        }

        @Override
        public String visit(Expr.GT op) {
            return binOp(op, " > ");
        }

        @Override
        public String visit(Expr.GE op) {
            return binOp(op, " >= ");
        }

        @Override
        public String visit(Expr.And op) {
            return binOp(op, " && ");
        }

        @Override
        public String visit(Expr.Or op) {
            return binOp(op, " || ");
        }

        @Override
        public String visit(Expr.Not op) {
            return "!" + printExpr(op.a);
        }

        @Override
        public String visit(Expr.Select op) {
            return exprOp("coli::o_cond", op.condition, op.trueValue, op.falseValue);
        }

        @Override
        public String visit(Expr.Load op) {
            throw unsupported("Load");
        }

        @Override
        public String visit(Expr.Ramp op) {
            throw unsupported("Ramp");
        }

        @Override
        public String visit(Expr.Broadcast op) {
            throw unsupported("Broadcast");
        }

        @Override
        public String visit(Expr.Call op) {
            if (op.callType != Expr.Call.CallType.FUNCTION && op.callType != Expr.Call.CallType.IMAGE) {
                throw new CodegenException(UNSUPPORTED_CONSTRUCT,
                        "Only calls to pipeline functions or images are supported, got " + op.callType
                                + " call " + op + ".");
            }
            if (!decls.isComputation(op.name)) {
                throw new CodegenException(UNKNOWN_COMPUTATION,
                        "Call to computation " + op.name + " that does not exist.");
            }
            StringBuilder sb = new StringBuilder(op.name).append('(');
            Iterator<Expr> it = op.args.iterator();
            while (it.hasNext()) {
                sb.append(printExpr(it.next()));
                if (it.hasNext()) sb.append(", ");
            }
            return sb.append(')').toString();
        }

        @Override
        public String visit(Expr.Let op) {
            throw new IllegalStateException("Let expression " + op.name + " should have been inlined before generation.");
        }
    }
}
