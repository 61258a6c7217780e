package exvar.ast.stmt;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;

public final class SwitchSection extends SyntaxNode {
    private final List<SwitchLabel> labels;
    private final List<Stmt> statements;

    public SwitchSection(List<SwitchLabel> labels, List<Stmt> statements, Pos pos) {
        super(SyntaxKind.SWITCH_SECTION, pos);
        if (labels.isEmpty()) throw new IllegalArgumentException("A switch section needs at least one label");
        this.labels = adoptAll(labels);
        this.statements = adoptAll(statements);
    }

    public List<SwitchLabel> labels() { return labels; }
    public List<Stmt> statements() { return statements; }

    @Override
    public List<SyntaxNode> children() { return nodes(labels, statements); }
}
