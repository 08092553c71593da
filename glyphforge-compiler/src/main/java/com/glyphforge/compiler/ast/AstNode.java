package com.glyphforge.compiler.ast;

/**
 * A bracketed command at one of the four nesting levels.
 */
public interface AstNode {

    String command();

    /** 1-based source line of the opening bracket. */
    int line();
}
