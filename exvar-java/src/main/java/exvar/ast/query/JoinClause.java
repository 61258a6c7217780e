package exvar.ast.query;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class JoinClause extends QueryClause {
    private final Identifier identifier;
    private final Expr inExpr;
    private final Expr left;
    private final Expr right;

    public JoinClause(Identifier identifier, Expr inExpr, Expr left, Expr right, Pos pos) {
        super(SyntaxKind.JOIN_CLAUSE, pos);
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.inExpr = adopt(Objects.requireNonNull(inExpr, "inExpr"));
        this.left = adopt(Objects.requireNonNull(left, "left"));
        this.right = adopt(Objects.requireNonNull(right, "right"));
    }

    public Identifier identifier() { return identifier; }
    public Expr inExpr() { return inExpr; }
    public Expr left() { return left; }
    public Expr right() { return right; }

    @Override
    public List<SyntaxNode> children() { return List.of(inExpr, left, right); }
}
