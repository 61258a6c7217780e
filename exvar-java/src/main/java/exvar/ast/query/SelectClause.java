package exvar.ast.query;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class SelectClause extends QueryClause {
    private final Expr expr;

    public SelectClause(Expr expr, Pos pos) {
        super(SyntaxKind.SELECT_CLAUSE, pos);
        this.expr = adopt(Objects.requireNonNull(expr, "expr"));
    }

    public Expr expr() { return expr; }

    @Override
    public List<SyntaxNode> children() { return List.of(expr); }
}
