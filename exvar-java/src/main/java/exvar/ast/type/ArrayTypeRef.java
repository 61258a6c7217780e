package exvar.ast.type;

import exvar.ast.Pos;
import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

import java.util.List;
import java.util.Objects;

public final class ArrayTypeRef extends TypeRef {
    private final TypeRef element;

    public ArrayTypeRef(TypeRef element, Pos pos) {
        super(SyntaxKind.ARRAY_TYPE, pos);
        this.element = adopt(Objects.requireNonNull(element, "element"));
    }

    public TypeRef element() { return element; }

    @Override
    public String text() { return element.text() + "[]"; }

    @Override
    public List<SyntaxNode> children() { return List.of(element); }
}
