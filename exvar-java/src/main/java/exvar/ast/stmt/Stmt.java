package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

public abstract sealed class Stmt extends SyntaxNode
        permits BlockStmt, VarDeclStmt, ExprStmt, IfStmt, WhileStmt, DoStmt, ForStmt,
        LockStmt, SwitchStmt, ReturnStmt, BreakStmt {

    protected Stmt(SyntaxKind kind, Pos pos) {
        super(kind, pos);
    }
}
