package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class DoStmt extends Stmt {
    private final Stmt body;
    private final Expr condition;

    public DoStmt(Stmt body, Expr condition, Pos pos) {
        super(SyntaxKind.DO_STATEMENT, pos);
        this.body = adopt(Objects.requireNonNull(body, "body"));
        this.condition = adopt(Objects.requireNonNull(condition, "condition"));
    }

    public Stmt body() { return body; }
    public Expr condition() { return condition; }

    @Override
    public List<SyntaxNode> children() { return List.of(body, condition); }
}
