package com.glyphforge.compiler.ast;

import java.util.List;

/**
 * Prints a canonical, line-number-free rendering of a tree, used to compare trees
 * structurally and in diagnostics.
 */
public final class AstPrinter {

    private AstPrinter() {
    }

    public static String print(Program program) {
        StringBuilder sb = new StringBuilder();
        for (AlphaBracket statement : program.statements()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            print(statement, sb);
        }
        return sb.toString();
    }

    private static void print(AlphaBracket alpha, StringBuilder sb) {
        sb.append("(alpha ").append(alpha.command());
        modifiers(alpha.modifiers(), sb);
        if (alpha.bridged()) {
            sb.append(" :").append(alpha.bridgeTarget() == null ? "_" : alpha.bridgeTarget());
        }
        for (BetaBracket beta : alpha.children()) {
            sb.append(' ');
            print(beta, sb);
        }
        if (alpha.exec() != null) {
            sb.append(" (exec");
            for (ExecParam param : alpha.exec().params()) {
                sb.append(" (param ").append(param.name());
                if (param.value() != null) {
                    sb.append(" =").append(literal(param.value()));
                }
                if (param.nested() != null) {
                    sb.append(' ');
                    print(param.nested(), sb);
                }
                sb.append(')');
            }
            sb.append(')');
        }
        sb.append(')');
    }

    private static void print(BetaBracket beta, StringBuilder sb) {
        sb.append("(beta ").append(beta.command());
        modifiers(beta.modifiers(), sb);
        assignment(beta.assigned(), beta.value(), sb);
        for (GammaBracket gamma : beta.children()) {
            sb.append(' ');
            print(gamma, sb);
        }
        sb.append(')');
    }

    private static void print(GammaBracket gamma, StringBuilder sb) {
        sb.append("(gamma ").append(gamma.command());
        modifiers(gamma.modifiers(), sb);
        if (gamma.bridged()) {
            sb.append(" :").append(gamma.bridgeTarget() == null ? "_" : gamma.bridgeTarget());
        }
        assignment(gamma.assigned(), gamma.value(), sb);
        for (DeltaBracket delta : gamma.children()) {
            sb.append(" (delta ").append(delta.command());
            for (Literal value : delta.values()) {
                sb.append(' ').append(literal(value));
            }
            sb.append(')');
        }
        sb.append(')');
    }

    private static void modifiers(List<String> modifiers, StringBuilder sb) {
        for (String modifier : modifiers) {
            sb.append(" +").append(modifier);
        }
    }

    private static void assignment(boolean assigned, Literal value, StringBuilder sb) {
        if (assigned) {
            sb.append(" =").append(value == null ? "_" : literal(value));
        }
    }

    private static String literal(Literal literal) {
        return literal.kind() == Literal.Kind.STRING ? "\"" + literal.text() + "\"" : literal.text();
    }
}
