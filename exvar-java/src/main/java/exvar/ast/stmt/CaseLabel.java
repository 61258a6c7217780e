package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class CaseLabel extends SwitchLabel {
    private final Expr value;

    public CaseLabel(Expr value, Pos pos) {
        super(SyntaxKind.CASE_SWITCH_LABEL, pos);
        this.value = adopt(Objects.requireNonNull(value, "value"));
    }

    public Expr value() { return value; }

    @Override
    public List<SyntaxNode> children() { return List.of(value); }
}
