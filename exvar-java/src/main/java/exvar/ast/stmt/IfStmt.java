package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class IfStmt extends Stmt {
    private final Expr condition;
    private final Stmt thenStmt;
    private final Stmt elseStmt; // может быть null

    public IfStmt(Expr condition, Stmt thenStmt, Stmt elseStmt, Pos pos) {
        super(SyntaxKind.IF_STATEMENT, pos);
        this.condition = adopt(Objects.requireNonNull(condition, "condition"));
        this.thenStmt = adopt(Objects.requireNonNull(thenStmt, "thenStmt"));
        this.elseStmt = adopt(elseStmt);
    }

    public Expr condition() { return condition; }
    public Stmt thenStmt() { return thenStmt; }
    public Stmt elseStmt() { return elseStmt; }

    @Override
    public List<SyntaxNode> children() { return nodes(condition, thenStmt, elseStmt); }
}
