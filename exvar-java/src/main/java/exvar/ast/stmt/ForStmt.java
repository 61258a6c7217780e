package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

/** {@code for (init; condition; updates) body}; init and condition are optional. */
public final class ForStmt extends Stmt {
    private final Stmt init;
    private final Expr condition;
    private final List<Expr> updates;
    private final Stmt body;

    public ForStmt(Stmt init, Expr condition, List<Expr> updates, Stmt body, Pos pos) {
        super(SyntaxKind.FOR_STATEMENT, pos);
        if (init != null && !(init instanceof VarDeclStmt) && !(init instanceof ExprStmt)) {
            throw new IllegalArgumentException("for initializer must be a declaration or an expression");
        }
        this.init = adopt(init);
        this.condition = adopt(condition);
        this.updates = adoptAll(updates);
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public Stmt init() { return init; }
    public Expr condition() { return condition; }
    public List<Expr> updates() { return updates; }
    public Stmt body() { return body; }

    @Override
    public List<SyntaxNode> children() { return nodes(init, condition, updates, body); }
}
