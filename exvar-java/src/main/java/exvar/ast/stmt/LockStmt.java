package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class LockStmt extends Stmt {
    private final Expr expr;
    private final Stmt body;

    public LockStmt(Expr expr, Stmt body, Pos pos) {
        super(SyntaxKind.LOCK_STATEMENT, pos);
        this.expr = adopt(Objects.requireNonNull(expr, "expr"));
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public Expr expr() { return expr; }
    public Stmt body() { return body; }

    @Override
    public List<SyntaxNode> children() { return List.of(expr, body); }
}
