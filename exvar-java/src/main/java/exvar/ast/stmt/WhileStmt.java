package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class WhileStmt extends Stmt {
    private final Expr condition;
    private final Stmt body;

    public WhileStmt(Expr condition, Stmt body, Pos pos) {
        super(SyntaxKind.WHILE_STATEMENT, pos);
        this.condition = adopt(Objects.requireNonNull(condition, "condition"));
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public Expr condition() { return condition; }
    public Stmt body() { return body; }

    @Override
    public List<SyntaxNode> children() { return List.of(condition, body); }
}
