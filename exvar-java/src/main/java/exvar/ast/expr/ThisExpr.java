package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;

public final class ThisExpr extends Expr {

    public ThisExpr(Pos pos) {
        super(SyntaxKind.THIS_EXPRESSION, pos);
    }

    @Override
    public List<SyntaxNode> children() { return List.of(); }
}
