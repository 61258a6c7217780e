package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;

public final class NullLiteral extends Expr {

    public NullLiteral(Pos pos) {
        super(SyntaxKind.NULL_LITERAL, pos);
    }

    @Override
    public List<SyntaxNode> children() { return List.of(); }
}
