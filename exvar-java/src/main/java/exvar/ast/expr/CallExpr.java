package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

public final class CallExpr extends Expr {
    private final Expr callee;
    private final ArgumentList args;

    public CallExpr(Expr callee, ArgumentList args, Pos pos) {
        super(SyntaxKind.INVOCATION_EXPRESSION, pos);
        this.callee = adopt(Objects.requireNonNull(callee, "callee"));
        this.args = adopt(Objects.requireNonNull(args, "args"));
    }

    public Expr callee() { return callee; }
    public ArgumentList args() { return args; }

    @Override
    public List<SyntaxNode> children() { return List.of(callee, args); }
}
