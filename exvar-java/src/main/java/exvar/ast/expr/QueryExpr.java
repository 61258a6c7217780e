package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.query.FromClause;
import exvar.ast.query.QueryBody;

import java.util.List;
import java.util.Objects;

public final class QueryExpr extends Expr {
    private final FromClause from;
    private final QueryBody body;

    public QueryExpr(FromClause from, QueryBody body, Pos pos) {
        super(SyntaxKind.QUERY_EXPRESSION, pos);
        this.from = adopt(Objects.requireNonNull(from, "from"));
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public FromClause from() { return from; }
    public QueryBody body() { return body; }

    @Override
    public List<SyntaxNode> children() { return List.of(from, body); }
}
