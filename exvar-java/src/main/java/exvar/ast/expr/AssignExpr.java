package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

public final class AssignExpr extends Expr {
    private final Expr target;
    private final Expr value;

    public AssignExpr(Expr target, Expr value, Pos pos) {
        super(SyntaxKind.ASSIGNMENT_EXPRESSION, pos);
        this.target = adopt(Objects.requireNonNull(target, "target"));
        this.value = adopt(Objects.requireNonNull(value, "value"));
    }

    public Expr target() { return target; }
    public Expr value() { return value; }

    @Override
    public List<SyntaxNode> children() { return List.of(target, value); }
}
