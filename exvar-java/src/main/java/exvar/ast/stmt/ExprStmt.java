package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class ExprStmt extends Stmt {
    private final Expr expr;

    public ExprStmt(Expr expr, Pos pos) {
        super(SyntaxKind.EXPRESSION_STATEMENT, pos);
        this.expr = adopt(Objects.requireNonNull(expr, "expr"));
    }

    public Expr expr() { return expr; }

    @Override
    public List<SyntaxNode> children() { return List.of(expr); }
}
