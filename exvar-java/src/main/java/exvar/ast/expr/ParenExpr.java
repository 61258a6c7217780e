package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

public final class ParenExpr extends Expr {
    private final Expr inner;

    public ParenExpr(Expr inner, Pos pos) {
        super(SyntaxKind.PARENTHESIZED_EXPRESSION, pos);
        this.inner = adopt(Objects.requireNonNull(inner, "inner"));
    }

    public Expr inner() { return inner; }

    @Override
    public List<SyntaxNode> children() { return List.of(inner); }
}
