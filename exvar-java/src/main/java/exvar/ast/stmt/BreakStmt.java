package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;

public final class BreakStmt extends Stmt {

    public BreakStmt(Pos pos) {
        super(SyntaxKind.BREAK_STATEMENT, pos);
    }

    @Override
    public List<SyntaxNode> children() { return List.of(); }
}
