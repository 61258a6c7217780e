package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;
import exvar.ast.pattern.Pattern;

import java.util.List;
import java.util.Objects;

public final class PatternCaseLabel extends SwitchLabel {
    private final Pattern pattern;
    private final Expr whenCondition; // может быть null

    public PatternCaseLabel(Pattern pattern, Expr whenCondition, Pos pos) {
        super(SyntaxKind.CASE_PATTERN_SWITCH_LABEL, pos);
        this.pattern = adopt(Objects.requireNonNull(pattern, "pattern"));
        this.whenCondition = adopt(whenCondition);
    }

    public Pattern pattern() { return pattern; }
    public Expr whenCondition() { return whenCondition; }

    @Override
    public List<SyntaxNode> children() { return nodes(pattern, whenCondition); }
}
