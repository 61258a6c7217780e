package exvar.ast.query;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class GroupClause extends QueryClause {
    private final Expr element;
    private final Expr key;

    public GroupClause(Expr element, Expr key, Pos pos) {
        super(SyntaxKind.GROUP_CLAUSE, pos);
        this.element = adopt(Objects.requireNonNull(element, "element"));
        this.key = adopt(Objects.requireNonNull(key, "key"));
    }

    public Expr element() { return element; }
    public Expr key() { return key; }

    @Override
    public List<SyntaxNode> children() { return List.of(element, key); }
}
