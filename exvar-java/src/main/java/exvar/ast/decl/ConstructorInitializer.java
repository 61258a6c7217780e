package exvar.ast.decl;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.ArgumentList;

import java.util.List;
import java.util.Objects;

public final class ConstructorInitializer extends SyntaxNode {
    private final ArgumentList args;

    private ConstructorInitializer(SyntaxKind kind, ArgumentList args, Pos pos) {
        super(kind, pos);
        this.args = adopt(Objects.requireNonNull(args, "args"));
    }

    public static ConstructorInitializer ofThis(ArgumentList args, Pos pos) {
        return new ConstructorInitializer(SyntaxKind.THIS_CONSTRUCTOR_INITIALIZER, args, pos);
    }

    public static ConstructorInitializer ofBase(ArgumentList args, Pos pos) {
        return new ConstructorInitializer(SyntaxKind.BASE_CONSTRUCTOR_INITIALIZER, args, pos);
    }

    public ArgumentList args() { return args; }

    @Override
    public List<SyntaxNode> children() { return List.of(args); }
}
