package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

public abstract sealed class SwitchLabel extends SyntaxNode
        permits CaseLabel, PatternCaseLabel, DefaultLabel {

    protected SwitchLabel(SyntaxKind kind, Pos pos) {
        super(kind, pos);
    }
}
