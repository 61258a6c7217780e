package exvar.ast.pattern;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;
import exvar.ast.type.TypeRef;

import java.util.List;

/** Positional pattern {@code Point(var x, 0)}; the type is optional. */
public final class RecursivePattern extends Pattern {
    private final TypeRef type;
    private final List<Pattern> subpatterns;

    public RecursivePattern(TypeRef type, List<Pattern> subpatterns, Pos pos) {
        super(SyntaxKind.RECURSIVE_PATTERN, pos);
        this.type = adopt(type);
        this.subpatterns = adoptAll(subpatterns);
    }

    public TypeRef type() { return type; }
    public List<Pattern> subpatterns() { return subpatterns; }

    @Override
    public List<SyntaxNode> children() { return nodes(type, subpatterns); }
}
