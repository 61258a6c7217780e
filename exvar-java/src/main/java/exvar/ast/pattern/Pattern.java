package exvar.ast.pattern;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

public abstract sealed class Pattern extends SyntaxNode
        permits DeclarationPattern, TypePattern, ConstantPattern, RecursivePattern {

    protected Pattern(SyntaxKind kind, Pos pos) {
        super(kind, pos);
    }
}
