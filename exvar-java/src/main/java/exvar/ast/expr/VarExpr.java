package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;

public final class VarExpr extends Expr {
    private final String name;

    public VarExpr(String name, Pos pos) {
        super(SyntaxKind.IDENTIFIER_NAME, pos);
        this.name = name;
    }

    public String name() { return name; }

    @Override
    public List<SyntaxNode> children() { return List.of(); }
}
