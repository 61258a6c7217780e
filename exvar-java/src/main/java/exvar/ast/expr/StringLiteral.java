package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;

public final class StringLiteral extends Expr {
    private final String value;

    public StringLiteral(String value, Pos pos) {
        super(SyntaxKind.STRING_LITERAL, pos);
        this.value = value;
    }

    public String value() { return value; }

    @Override
    public List<SyntaxNode> children() { return List.of(); }
}
