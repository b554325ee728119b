package io.github.eutro.ir2coli.codegen;

import org.intellij.lang.annotations.PrintFormat;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Writes lines of text at a current indentation level.
 */
public class CodeEmitter {
    private final Appendable out;
    private final int tabSize;
    private int indent = 0;

    /**
     * Construct an emitter.
     *
     * @param out     Where to write.
     * @param tabSize The number of spaces in one level of indentation.
     */
    public CodeEmitter(Appendable out, int tabSize) {
        this.out = out;
        this.tabSize = tabSize;
    }

    public void indent() {
        indent(1);
    }

    public void dedent() {
        indent(-1);
    }

    /**
     * Change the indentation by a number of levels.
     *
     * @param levels The number of levels to indent by, negative to dedent.
     */
    public void indent(int levels) {
        indent += levels * tabSize;
        if (indent < 0) {
            throw new IllegalStateException("negative indentation");
        }
    }

    /**
     * Write text, without a line break.
     *
     * @param text The text.
     * @return This emitter, for convenience.
     */
    public CodeEmitter print(CharSequence text) {
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    /**
     * Write the current indentation.
     *
     * @return This emitter, for convenience.
     */
    public CodeEmitter doIndent() {
        for (int i = 0; i < indent; i++) {
            print(" ");
        }
        return this;
    }

    /**
     * Write an indented line.
     *
     * @param line The line, without a line break.
     * @return This emitter, for convenience.
     */
    public CodeEmitter line(CharSequence line) {
        return doIndent().print(line).newline();
    }

    /**
     * Write an indented, formatted line.
     *
     * @param fmt  The format string.
     * @param args The format arguments.
     * @return This emitter, for convenience.
     */
    public CodeEmitter linef(@PrintFormat String fmt, Object... args) {
        return line(String.format(fmt, args));
    }

    public CodeEmitter newline() {
        return print("\n");
    }
}
