package io.github.eutro.ir2coli.test;

import io.github.eutro.ir2coli.codegen.*;
import io.github.eutro.ir2coli.core.ir.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.github.eutro.ir2coli.core.ir.Exprs.*;
import static org.junit.jupiter.api.Assertions.*;

public class ColiCodeGenTest {
    private static final Type I32 = Type.int_(32);
    private static final List<BufferSpec> OUTPUTS = Arrays.asList(BufferSpec.of("output", I32, 4));
    private static final List<BufferSpec> INPUTS = Arrays.asList(BufferSpec.of("input", I32, 4));

    private static Stmt outputLoop(Stmt body) {
        return new Stmt.For("x", var("output.min.0"), var("output.extent.0"), Stmt.For.ForType.SERIAL, body);
    }

    private static Stmt provideOutput(Expr value) {
        return new Stmt.Provide("output", Arrays.asList(value), Arrays.asList(var("x")));
    }

    private static Expr callInput(Expr arg) {
        return new Expr.Call(I32, "input", Arrays.asList(arg), Expr.Call.CallType.IMAGE);
    }

    private static String compile(Stmt s) {
        return compile(s, ColiOptions.DEFAULT);
    }

    private static String compile(Stmt s, ColiOptions options) {
        return ColiCompiler.compile(s, "pipeline", OUTPUTS, INPUTS, options);
    }

    private static CodegenException.Reason failure(Stmt s) {
        return assertThrows(CodegenException.class, () -> compile(s)).reason;
    }

    private static int count(String haystack, String needle) {
        int n = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) n++;
        return n;
    }

    private static void assertInOrder(String text, String... parts) {
        int from = 0;
        for (String part : parts) {
            int at = text.indexOf(part, from);
            assertTrue(at >= 0, () -> "missing or out of order: " + part + "\nin:\n" + text);
            from = at + part.length();
        }
    }

    @Test
    void testPointwisePipeline() {
        String program = compile(outputLoop(provideOutput(new Expr.Add(callInput(var("x")), intConst(1)))));

        assertEquals(1, count(program, "coli::buffer buff_output("));
        assertEquals(1, count(program, "coli::buffer buff_input("));
        assertInOrder(program,
                "#include <coli/core.h>",
                "using namespace coli;\n\n",
                "int main(int argc, char **argv)\n{\n",
                "    // Set default coli options.\n",
                "    global::set_default_coli_options();\n\n",
                "    coli::function pipeline(\"pipeline\");\n",
                "    coli::buffer buff_output(\"buff_output\", 1, {coli::expr(4)}, coli::p_int32, NULL, coli::a_output, &pipeline);\n",
                "    coli::buffer buff_input(\"buff_input\", 1, {coli::expr(4)}, coli::p_int32, NULL, coli::a_input, &pipeline);\n",
                "    coli::computation input(\"{input[i0]: (0 <= i0 <= 3)}\", expr(), false, coli::p_int32, &pipeline);\n",
                "    input.set_access(\"{input[i0]->buff_input[i0]}\");\n\n",
                "    // Define loop bounds for dimension \"_x\".\n",
                "    coli::constant _output_min_0(\"_output_min_0\", coli::expr((int32_t)0), coli::p_int32, true, NULL, 0, &pipeline);\n",
                "    coli::constant _output_extent_0(\"_output_extent_0\", coli::expr((int32_t)4), coli::p_int32, true, NULL, 0, &pipeline);\n\n",
                "    coli::computation output(\"[_output_min_0, _output_extent_0]->{output[_x]: \"\n",
                "                        \"(_output_min_0 <= _x <= ((_output_min_0 + _output_extent_0) - 1))}\",\n",
                "                        (input(coli::idx(\"_x\")) + coli::expr((int32_t)1)), true, coli::p_int32, &pipeline);\n",
                "    output.set_access(\"{output[_x]->buff_output[_x]}\");\n\n",
                "    pipeline.set_arguments({&buff_output, &buff_input});\n",
                "    pipeline.gen_isl_ast();\n",
                "    pipeline.gen_halide_stmt();\n",
                "    pipeline.dump_halide_stmt();\n",
                "    pipeline.gen_halide_obj(\"build/generated_pipeline_test.o\");\n",
                "}\n");
        assertTrue(program.endsWith("}\n\n"));
        for (String line : program.split("\n")) {
            assertFalse(line.endsWith(" "), () -> "trailing whitespace: " + line);
        }
    }

    @Test
    void testDeterministic() {
        Stmt s = outputLoop(provideOutput(new Expr.Mul(callInput(var("x")), intConst(2))));
        assertEquals(compile(s), compile(s));
    }

    @Test
    void testTemporaryBuffer() {
        Expr y = var("y");
        Stmt s = new Stmt.Realize("g", Arrays.asList(I32), Arrays.asList(new Range(intConst(0), intConst(4))), boolConst(true),
                new Stmt.LetStmt("g.min.0", intConst(0),
                        new Stmt.LetStmt("g.extent.0", var("output.extent.0"),
                                Stmt.Block.of(
                                        new Stmt.ProducerConsumer("g", true,
                                                new Stmt.For("y", var("g.min.0"), var("g.extent.0"),
                                                        Stmt.For.ForType.SERIAL,
                                                        new Stmt.Provide("g",
                                                                Arrays.asList(new Expr.Mul(y, intConst(2))),
                                                                Arrays.asList(y)))),
                                        new Stmt.ProducerConsumer("g", false,
                                                outputLoop(provideOutput(new Expr.Call(I32, "g",
                                                        Arrays.asList(var("x")), Expr.Call.CallType.FUNCTION))))))));
        String program = compile(s);
        assertInOrder(program,
                "    coli::buffer buff_g(\"buff_g\", 1, {coli::expr((int32_t)4)}, coli::p_int32, NULL, coli::a_temporary, &pipeline);\n",
                "    coli::constant _g_min_0(\"_g_min_0\", coli::expr((int32_t)0),",
                "    coli::constant _g_extent_0(\"_g_extent_0\", coli::expr((int32_t)4),",
                "(coli::idx(\"_y\")*coli::expr((int32_t)2)), true, coli::p_int32, &pipeline);\n",
                "    g.set_access(\"{g[_y]->buff_g[_y]}\");\n",
                "g(coli::idx(\"_x\")), true, coli::p_int32, &pipeline);\n",
                "    pipeline.set_arguments({&buff_output, &buff_input});\n");
    }

    private static Stmt boundedBy(String extent) {
        return new Stmt.For("x", var("output.min.0"), var(extent), Stmt.For.ForType.SERIAL,
                provideOutput(intConst(0)));
    }

    @Test
    void testBoundChainResolution() {
        Stmt s = new Stmt.LetStmt("c", intConst(7),
                new Stmt.LetStmt("b", new Expr.Add(var("c"), intConst(1)),
                        new Stmt.LetStmt("a", new Expr.Add(var("b"), intConst(1)),
                                new Stmt.LetStmt("e", new Expr.Add(var("a"), intConst(1)),
                                        boundedBy("e")))));
        String program = compile(s);
        assertTrue(program.contains("coli::constant _e(\"_e\", coli::expr((int32_t)10), coli::p_int32,"), program);
    }

    @Test
    void testShadowedLetInBound() {
        Stmt s = new Stmt.LetStmt("t", intConst(1),
                new Stmt.LetStmt("t", new Expr.Add(var("t"), intConst(1)),
                        new Stmt.LetStmt("e", var("t"),
                                boundedBy("e"))));
        String program = compile(s);
        assertTrue(program.contains("coli::constant _e(\"_e\", coli::expr((int32_t)2), coli::p_int32,"), program);
    }

    @Test
    void testLaterShadowDoesNotCapture() {
        Stmt s = new Stmt.LetStmt("t", intConst(1),
                new Stmt.LetStmt("e", var("t"),
                        new Stmt.LetStmt("t", intConst(5),
                                boundedBy("e"))));
        String program = compile(s);
        assertTrue(program.contains("coli::constant _e(\"_e\", coli::expr((int32_t)1), coli::p_int32,"), program);
    }

    @Test
    void testMutuallyReferringLets() {
        // b is free where a is defined, so the chain stops there
        Stmt s = new Stmt.LetStmt("a", var("b"),
                new Stmt.LetStmt("b", var("a"),
                        new Stmt.LetStmt("e", var("a"),
                                boundedBy("e"))));
        String program = compile(s);
        assertTrue(program.contains("coli::constant _e(\"_e\", coli::idx(\"_b\"), coli::p_int32,"), program);
    }

    @Test
    void testDuplicateProvide() {
        assertEquals(CodegenException.Reason.DUPLICATE_COMPUTATION, failure(outputLoop(Stmt.Block.of(
                provideOutput(intConst(1)),
                provideOutput(intConst(2))))));
    }

    @Test
    void testDuplicateProducer() {
        assertEquals(CodegenException.Reason.DUPLICATE_COMPUTATION, failure(Stmt.Block.of(
                outputLoop(provideOutput(intConst(1))),
                new Stmt.ProducerConsumer("output", true, new Stmt.Evaluate(intConst(0))))));
    }

    @Test
    void testUpdateRejected() {
        assertEquals(CodegenException.Reason.UNSUPPORTED_UPDATE, failure(new Stmt.ProducerConsumer("output", true,
                Stmt.Block.of(outputLoop(provideOutput(intConst(1))), outputLoop(provideOutput(intConst(2)))))));
    }

    @Test
    void testNonVariableBound() {
        Stmt s = new Stmt.For("x", intConst(0), var("output.extent.0"), Stmt.For.ForType.SERIAL,
                provideOutput(intConst(1)));
        assertThrows(IllegalStateException.class, () -> compile(s));
    }

    @Test
    void testUnboundLoopVariable() {
        Stmt s = new Stmt.For("x", var("nowhere.min"), var("output.extent.0"), Stmt.For.ForType.SERIAL,
                provideOutput(intConst(1)));
        assertThrows(IllegalStateException.class, () -> compile(s));
    }

    @Test
    void testElseDiscarded() {
        Stmt s = outputLoop(new Stmt.IfThenElse(new Expr.LT(var("x"), intConst(2)),
                provideOutput(intConst(11)),
                provideOutput(intConst(22))));
        String program = compile(s);
        assertTrue(program.contains("coli::expr((int32_t)11), true"));
        assertFalse(program.contains("(int32_t)22"));
    }

    @Test
    void testFailedLoopLeavesNoDimension() {
        StringBuilder sb = new StringBuilder();
        ColiCodeGen cg = new ColiCodeGen(sb, "f", OUTPUTS, Arrays.asList());
        Stmt provide = new Stmt.Provide("output", Arrays.asList(intConst(1)), Arrays.asList(var("_x")));
        assertThrows(IllegalStateException.class, () -> cg.print(new Stmt.For("_y", var("_output_min_0"),
                intConst(4), Stmt.For.ForType.SERIAL, provide)));
        assertThrows(IllegalStateException.class, () -> cg.print(new Stmt.For("_y", var("_output_min_0"),
                var("nowhere"), Stmt.For.ForType.SERIAL, provide)));
        assertFalse(sb.toString().contains("\"_y\""), sb::toString);

        cg.print(new Stmt.For("_x", var("_output_min_0"), var("_output_extent_0"), Stmt.For.ForType.SERIAL,
                provide));
        String program = sb.toString();
        assertTrue(program.contains("coli::computation output(\"[_output_min_0, _output_extent_0]->{output[_x]: \"\n"),
                program);
        assertTrue(program.contains("\"(_output_min_0 <= _x <= ((_output_min_0 + _output_extent_0) - 1))}\",\n"),
                program);
    }

    @Test
    void testElseWithLoopDiscarded() {
        Stmt s = new Stmt.IfThenElse(new Expr.LT(var("output.min.0"), intConst(2)),
                outputLoop(provideOutput(intConst(11))),
                outputLoop(provideOutput(intConst(22))));
        String program = compile(s);
        assertTrue(program.contains("coli::expr((int32_t)11), true"), program);
        assertFalse(program.contains("(int32_t)22"), program);
        assertEquals(1, count(program, "// Define loop bounds"));
        assertEquals(1, count(program, "coli::computation output("));
    }

    @Test
    void testAssertDropped() {
        Stmt s = outputLoop(Stmt.Block.of(
                new Stmt.AssertStmt(new Expr.GE(var("x"), intConst(0)), new Expr.StringImm("x out of range")),
                provideOutput(intConst(1))));
        String program = compile(s);
        assertTrue(program.contains("coli::expr((int32_t)1), true"), program);
        assertFalse(program.contains("out of range"), program);
    }

    @Test
    void testStoreRejected() {
        assertEquals(CodegenException.Reason.UNSUPPORTED_CONSTRUCT,
                failure(outputLoop(new Stmt.Store("output", intConst(1), var("x")))));
    }

    @Test
    void testAllocateRejected() {
        assertEquals(CodegenException.Reason.UNSUPPORTED_CONSTRUCT,
                failure(new Stmt.Allocate("t", I32, Arrays.asList(intConst(4)), boolConst(true),
                        new Stmt.Evaluate(intConst(0)))));
    }

    @Test
    void testFreeRejected() {
        assertEquals(CodegenException.Reason.UNSUPPORTED_CONSTRUCT, failure(new Stmt.Free("t")));
    }

    @Test
    void testFailureWritesNothing() {
        StringBuilder dest = new StringBuilder();
        Stmt s = outputLoop(provideOutput(new Expr.StringImm("oops")));
        CodegenException e = assertThrows(CodegenException.class,
                () -> ColiCompiler.printToColi(s, dest, "pipeline", OUTPUTS, INPUTS));
        assertEquals(CodegenException.Reason.UNSUPPORTED_CONSTRUCT, e.reason);
        assertEquals("", dest.toString());
    }

    @Test
    void testProvideErrors() {
        assertEquals(CodegenException.Reason.MISSING_BUFFER, failure(outputLoop(
                new Stmt.Provide("h", Arrays.asList(intConst(1)), Arrays.asList(var("x"))))));
        assertEquals(CodegenException.Reason.DUPLICATE_COMPUTATION, failure(outputLoop(
                new Stmt.Provide("input", Arrays.asList(intConst(1)), Arrays.asList(var("x"))))));
        assertEquals(CodegenException.Reason.MALFORMED_STORE, failure(outputLoop(
                new Stmt.Provide("output", Arrays.asList(intConst(1)), Arrays.asList(new Expr.Add(var("x"), intConst(1)))))));
        assertEquals(CodegenException.Reason.MALFORMED_STORE, failure(outputLoop(
                new Stmt.Provide("output", Arrays.asList(intConst(1), intConst(2)), Arrays.asList(var("x"))))));
        assertEquals(CodegenException.Reason.UNKNOWN_COMPUTATION, failure(outputLoop(provideOutput(
                new Expr.Call(I32, "nothing", Arrays.asList(var("x")), Expr.Call.CallType.FUNCTION)))));
    }

    @Test
    void testRealizeErrors() {
        Stmt body = new Stmt.Evaluate(intConst(0));
        List<Range> bounds = Arrays.asList(new Range(intConst(0), intConst(4)));
        assertEquals(CodegenException.Reason.DUPLICATE_BUFFER, failure(
                new Stmt.Realize("output", Arrays.asList(I32), bounds, boolConst(true), body)));
        assertEquals(CodegenException.Reason.UNSUPPORTED_REALIZE, failure(
                new Stmt.Realize("g", Arrays.asList(), bounds, boolConst(true), body)));
        assertEquals(CodegenException.Reason.UNSUPPORTED_REALIZE, failure(
                new Stmt.Realize("g", Arrays.asList(I32, Type.float_(32)), bounds, boolConst(true), body)));
        assertEquals(CodegenException.Reason.UNSUPPORTED_REALIZE, failure(
                new Stmt.Realize("g", Arrays.asList(I32), Arrays.asList(new Range(intConst(1), intConst(4))),
                        boolConst(true), body)));
    }

    @Test
    void testTooDeep() {
        Stmt s = outputLoop(provideOutput(new Expr.Add(callInput(var("x")), intConst(1))));
        ColiOptions shallow = ColiOptions.builder().setMaxDepth(3).build();
        assertEquals(CodegenException.Reason.TOO_DEEP,
                assertThrows(CodegenException.class, () -> compile(s, shallow)).reason);
    }

    @Test
    void testOptions() {
        ColiOptions options = ColiOptions.builder()
                .setTabSize(2)
                .setObjectFileFormat("out/%s.o")
                .build();
        String program = compile(outputLoop(provideOutput(intConst(1))), options);
        assertTrue(program.contains("\n  pipeline.gen_halide_obj(\"out/pipeline.o\");\n"), program);
        assertTrue(program.contains("\n            \"(_output_min_0"), program);
    }

    @Test
    void testNamesKeptWithoutNormalization() {
        ColiOptions options = ColiOptions.builder().setNormalizeNames(false).build();
        Stmt s = new Stmt.For("x", var("m"), var("e"), Stmt.For.ForType.SERIAL, provideOutput(intConst(1)));
        Stmt bound = new Stmt.LetStmt("m", intConst(0), new Stmt.LetStmt("e", intConst(4), s));
        String program = compile(bound, options);
        assertTrue(program.contains("coli::constant m(\"m\", coli::expr((int32_t)0)"), program);
        assertTrue(program.contains("{output[x]: "), program);
    }

    @Test
    void testBadPipelineName() {
        assertThrows(IllegalArgumentException.class,
                () -> ColiCompiler.compile(new Stmt.Evaluate(intConst(0)), "my-pipeline", OUTPUTS, INPUTS,
                        ColiOptions.DEFAULT));
    }

    @Test
    void testCloseOnce() {
        StringBuilder sb = new StringBuilder();
        ColiCodeGen cg = new ColiCodeGen(sb, "f", OUTPUTS, Arrays.asList());
        cg.close();
        cg.close();
        assertEquals(1, count(sb.toString(), "set_arguments({&buff_output});"));
        assertThrows(IllegalStateException.class, () -> cg.print(new Stmt.Evaluate(intConst(0))));
    }

    @Test
    void testExpressions() {
        ColiCodeGen cg = new ColiCodeGen(new StringBuilder(), "f", Arrays.asList(), Arrays.asList());
        Expr x = var("x");
        assertEquals("coli::expr((int64_t)5)", cg.print(makeConst(Type.int_(64), 5)));
        assertEquals("coli::expr((uint8_t)200)", cg.print(makeConst(Type.uint(8), 200)));
        assertEquals("coli::expr(true)", cg.print(boolConst(true)));
        assertEquals("coli::expr((float)1.5)", cg.print(new Expr.FloatImm(Type.float_(32), 1.5)));
        assertEquals("coli::expr(1.5)", cg.print(new Expr.FloatImm(Type.float_(64), 1.5)));
        assertEquals("coli::expr((float)NAN)", cg.print(new Expr.FloatImm(Type.float_(32), Double.NaN)));
        assertEquals("(coli::idx(\"x\")*coli::expr((int32_t)2))", cg.print(new Expr.Mul(x, intConst(2))));
        assertEquals("(coli::idx(\"x\") % coli::expr((int32_t)2))", cg.print(new Expr.Mod(x, intConst(2))));
        assertEquals("coli::expr(coli::o_min, coli::idx(\"x\"), coli::expr((int32_t)1))",
                cg.print(new Expr.Min(x, intConst(1))));
        assertEquals("coli::expr(coli::o_cond, (coli::idx(\"x\") < coli::expr((int32_t)0)), "
                        + "coli::expr((int32_t)0), coli::idx(\"x\"))",
                cg.print(new Expr.Select(new Expr.LT(x, intConst(0)), intConst(0), x)));
        assertEquals("!(coli::idx(\"x\") >= coli::expr((int32_t)0))",
                cg.print(new Expr.Not(new Expr.GE(x, intConst(0)))));
        assertEquals("(coli::expr((int32_t)1) + coli::idx(\"x\"))",
                cg.print(new Expr.Let("y", intConst(1), new Expr.Add(var("y"), x))));
    }

    @Test
    void testUnsupportedExpressions() {
        ColiCodeGen cg = new ColiCodeGen(new StringBuilder(), "f", Arrays.asList(), Arrays.asList());
        assertEquals(CodegenException.Reason.UNSUPPORTED_WIDTH,
                assertThrows(CodegenException.class,
                        () -> cg.print(new Expr.FloatImm(Type.float_(16), 1))).reason);
        assertEquals(CodegenException.Reason.UNSUPPORTED_WIDTH,
                assertThrows(CodegenException.class, () -> cg.print(makeConst(Type.int_(12), 3))).reason);
        assertEquals(CodegenException.Reason.UNSUPPORTED_CONSTRUCT,
                assertThrows(CodegenException.class,
                        () -> cg.print(new Expr.Cast(Type.float_(32), var("x")))).reason);
        assertEquals(CodegenException.Reason.UNSUPPORTED_CONSTRUCT,
                assertThrows(CodegenException.class, () -> cg.print(new Expr.Call(I32, "sqrt",
                        Arrays.asList(var("x")), Expr.Call.CallType.EXTERN))).reason);
        assertEquals(CodegenException.Reason.UNSUPPORTED_CONSTRUCT,
                assertThrows(CodegenException.class, () -> cg.print(new Expr.Broadcast(intConst(1), 4))).reason);
    }

    @Test
    void testRampRejected() {
        ColiCodeGen cg = new ColiCodeGen(new StringBuilder(), "f", Arrays.asList(), Arrays.asList());
        CodegenException e = assertThrows(CodegenException.class,
                () -> cg.print(new Expr.Ramp(var("x"), intConst(1), 4)));
        assertEquals(CodegenException.Reason.UNSUPPORTED_CONSTRUCT, e.reason);
        assertTrue(e.getMessage().contains("Ramp"), e::getMessage);
    }

    @Test
    void testLoadRejected() {
        assertEquals(CodegenException.Reason.UNSUPPORTED_CONSTRUCT,
                failure(outputLoop(provideOutput(new Expr.Load(I32, "input", var("x"))))));
    }

    @Test
    void testPrepassChain() {
        Stmt s = new Stmt.For("x", var("m"), var("e"), Stmt.For.ForType.SERIAL,
                new Stmt.Provide("output",
                        Arrays.asList(new Expr.Let("t", new Expr.Add(var("x"), intConst(1)), var("t"))),
                        Arrays.asList(var("x"))));
        assertEquals("serial (_x, _m, _e) {\n" +
                "  output(_x) = (_x + 1)\n" +
                "}\n", IRPrinter.print(ColiCompiler.prepass(ColiOptions.DEFAULT).run(s)));
        ColiOptions keepNames = ColiOptions.builder().setNormalizeNames(false).build();
        assertEquals("serial (x, m, e) {\n" +
                "  output(x) = (x + 1)\n" +
                "}\n", IRPrinter.print(ColiCompiler.prepass(keepNames).run(s)));
    }
}
