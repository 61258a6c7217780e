package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;

public final class NumberLiteral extends Expr {
    private final String text;

    public NumberLiteral(String text, Pos pos) {
        super(SyntaxKind.NUMERIC_LITERAL, pos);
        this.text = text;
    }

    public String text() { return text; }

    @Override
    public List<SyntaxNode> children() { return List.of(); }
}
