package exvar.ast.query;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class OrderByClause extends QueryClause {
    private final Expr ordering;

    public OrderByClause(Expr ordering, Pos pos) {
        super(SyntaxKind.ORDER_BY_CLAUSE, pos);
        this.ordering = adopt(Objects.requireNonNull(ordering, "ordering"));
    }

    public Expr ordering() { return ordering; }

    @Override
    public List<SyntaxNode> children() { return List.of(ordering); }
}
