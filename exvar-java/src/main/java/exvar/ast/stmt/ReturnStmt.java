package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;

public final class ReturnStmt extends Stmt {
    private final Expr value; // может быть null

    public ReturnStmt(Expr value, Pos pos) {
        super(SyntaxKind.RETURN_STATEMENT, pos);
        this.value = adopt(value);
    }

    public Expr value() { return value; }

    @Override
    public List<SyntaxNode> children() { return nodes(value); }
}
