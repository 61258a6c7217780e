package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;

/** {@code (a, b)} for calls and creations, {@code [a, b]} for element access. */
public final class ArgumentList extends SyntaxNode {
    private final List<Argument> arguments;

    private ArgumentList(SyntaxKind kind, List<Argument> arguments, Pos pos) {
        super(kind, pos);
        this.arguments = adoptAll(arguments);
    }

    public static ArgumentList parenthesized(List<Argument> arguments, Pos pos) {
        return new ArgumentList(SyntaxKind.ARGUMENT_LIST, arguments, pos);
    }

    public static ArgumentList bracketed(List<Argument> arguments, Pos pos) {
        return new ArgumentList(SyntaxKind.BRACKETED_ARGUMENT_LIST, arguments, pos);
    }

    public List<Argument> arguments() { return arguments; }

    @Override
    public List<SyntaxNode> children() { return List.copyOf(arguments); }
}
