package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.expr.Expr;

import java.util.List;
import java.util.Objects;

public final class SwitchStmt extends Stmt {
    private final Expr subject;
    private final List<SwitchSection> sections;

    public SwitchStmt(Expr subject, List<SwitchSection> sections, Pos pos) {
        super(SyntaxKind.SWITCH_STATEMENT, pos);
        this.subject = adopt(Objects.requireNonNull(subject, "subject"));
        this.sections = adoptAll(sections);
    }

    public Expr subject() { return subject; }
    public List<SwitchSection> sections() { return sections; }

    @Override
    public List<SyntaxNode> children() { return nodes(subject, sections); }
}
