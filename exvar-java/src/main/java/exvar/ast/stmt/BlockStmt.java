package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;

public final class BlockStmt extends Stmt {
    private final List<Stmt> statements;

    public BlockStmt(List<Stmt> statements, Pos pos) {
        super(SyntaxKind.BLOCK, pos);
        this.statements = adoptAll(statements);
    }

    public List<Stmt> statements() { return statements; }

    @Override
    public List<SyntaxNode> children() { return List.copyOf(statements); }
}
