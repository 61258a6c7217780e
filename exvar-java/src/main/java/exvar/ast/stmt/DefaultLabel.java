package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;

public final class DefaultLabel extends SwitchLabel {

    public DefaultLabel(Pos pos) {
        super(SyntaxKind.DEFAULT_SWITCH_LABEL, pos);
    }

    @Override
    public List<SyntaxNode> children() { return List.of(); }
}
