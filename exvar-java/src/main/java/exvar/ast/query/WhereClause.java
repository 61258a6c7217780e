package exvar.ast.query;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class WhereClause extends QueryClause {
    private final Expr condition;

    public WhereClause(Expr condition, Pos pos) {
        super(SyntaxKind.WHERE_CLAUSE, pos);
        this.condition = adopt(Objects.requireNonNull(condition, "condition"));
    }

    public Expr condition() { return condition; }

    @Override
    public List<SyntaxNode> children() { return List.of(condition); }
}
