package exvar.ast.expr;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

public abstract sealed class Expr extends SyntaxNode
        permits VarExpr, NumberLiteral, StringLiteral, BoolLiteral, NullLiteral, ThisExpr,
        ParenExpr, UnaryExpr, BinaryExpr, AssignExpr, IsPatternExpr,
        FieldAccessExpr, CallExpr, ArrayAccessExpr, NewExpr, DeclarationExpr,
        LambdaExpr, SimpleLambdaExpr, AnonymousMethodExpr, QueryExpr {

    protected Expr(SyntaxKind kind, Pos pos) {
        super(kind, pos);
    }
}
