package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

public final class ArrayAccessExpr extends Expr {
    private final Expr target;
    private final ArgumentList args;

    public ArrayAccessExpr(Expr target, ArgumentList args, Pos pos) {
        super(SyntaxKind.ELEMENT_ACCESS_EXPRESSION, pos);
        this.target = adopt(Objects.requireNonNull(target, "target"));
        this.args = adopt(Objects.requireNonNull(args, "args"));
    }

    public Expr target() { return target; }
    public ArgumentList args() { return args; }

    @Override
    public List<SyntaxNode> children() { return List.of(target, args); }
}
