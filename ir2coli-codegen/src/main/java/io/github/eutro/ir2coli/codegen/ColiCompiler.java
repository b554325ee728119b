package io.github.eutro.ir2coli.codegen;

import io.github.eutro.ir2coli.core.ir.Stmt;
import io.github.eutro.ir2coli.core.passes.IRPass;
import io.github.eutro.ir2coli.core.passes.InlineLets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Entry points for translating a pipeline into a standalone COLi program.
 * <p>
 * Output is all-or-nothing: the program is generated in memory, and is only
 * written to the destination once it is complete.
 */
public final class ColiCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(ColiCompiler.class);

    private ColiCompiler() {
    }

    /**
     * Get the passes run on a loop nest before it is generated.
     * <p>
     * Names are normalized first, if enabled, then expression-level lets are inlined.
     *
     * @param options The options.
     * @return The passes.
     */
    public static IRPass<Stmt, Stmt> prepass(ColiOptions options) {
        return options.normalizeNames
                ? NormalizeNames.INSTANCE.then(InlineLets.INSTANCE)
                : InlineLets.INSTANCE;
    }

    /**
     * Translate a pipeline with the default options.
     *
     * @param s            The loop nest of the pipeline.
     * @param dest         Where to write the program.
     * @param pipelineName The name of the generated function, a C identifier.
     * @param outputs      The outputs of the pipeline.
     * @param inputs       The input images of the pipeline.
     * @throws CodegenException If the loop nest cannot be translated.
     */
    public static void printToColi(
            Stmt s,
            Appendable dest,
            String pipelineName,
            List<BufferSpec> outputs,
            List<BufferSpec> inputs
    ) {
        printToColi(s, dest, pipelineName, outputs, inputs, ColiOptions.DEFAULT);
    }

    /**
     * Translate a pipeline.
     *
     * @param s            The loop nest of the pipeline.
     * @param dest         Where to write the program.
     * @param pipelineName The name of the generated function, a C identifier.
     * @param outputs      The outputs of the pipeline.
     * @param inputs       The input images of the pipeline.
     * @param options      The options.
     * @throws CodegenException If the loop nest cannot be translated.
     * @throws UncheckedIOException If writing to {@code dest} fails.
     */
    public static void printToColi(
            Stmt s,
            Appendable dest,
            String pipelineName,
            List<BufferSpec> outputs,
            List<BufferSpec> inputs,
            ColiOptions options
    ) {
        String program = compile(s, pipelineName, outputs, inputs, options);
        try {
            dest.append(program);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Translate a pipeline into a string.
     *
     * @param s            The loop nest of the pipeline.
     * @param pipelineName The name of the generated function, a C identifier.
     * @param outputs      The outputs of the pipeline.
     * @param inputs       The input images of the pipeline.
     * @param options      The options.
     * @return The program.
     * @throws CodegenException If the loop nest cannot be translated.
     */
    public static String compile(
            Stmt s,
            String pipelineName,
            List<BufferSpec> outputs,
            List<BufferSpec> inputs,
            ColiOptions options
    ) {
        LOG.debug("Generating COLi for pipeline {} with outputs {} and inputs {}", pipelineName, outputs, inputs);
        Stmt prepared = prepass(options).run(s);
        if (LOG.isDebugEnabled()) {
            LOG.debug("After pre-passes:\n{}", prepared);
        }

        StringBuilder sb = new StringBuilder();
        ColiCodeGen cg = new ColiCodeGen(sb, pipelineName, outputs, inputs, options);
        cg.print(prepared);
        cg.close();
        LOG.debug("Generated {} characters of COLi for pipeline {}", sb.length(), pipelineName);
        return sb.toString();
    }
}
