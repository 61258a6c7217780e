package exvar.ast.decl;

import exvar.ast.Identifier;
import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

public abstract sealed class MemberDecl extends SyntaxNode
        permits FieldDecl, MethodDecl, ConstructorDecl {

    protected MemberDecl(SyntaxKind kind, Pos pos) {
        super(kind, pos);
    }

    public abstract Identifier name();
}
