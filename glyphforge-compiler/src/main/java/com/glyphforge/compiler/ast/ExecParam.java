package com.glyphforge.compiler.ast;

/**
 * One parameter of an EXEC clause: a name with an optional value, a nested gamma
 * bracket, or both. {@code name} is the gamma's command when only a gamma was given.
 */
public record ExecParam(String name, Literal value, GammaBracket nested, int line) {
}
