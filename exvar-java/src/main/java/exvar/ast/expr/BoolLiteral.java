package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;

public final class BoolLiteral extends Expr {
    private final boolean value;

    public BoolLiteral(boolean value, Pos pos) {
        super(SyntaxKind.BOOL_LITERAL, pos);
        this.value = value;
    }

    public boolean value() { return value; }

    @Override
    public List<SyntaxNode> children() { return List.of(); }
}
