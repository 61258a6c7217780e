package exvar.sema;

import exvar.ast.Pos;
import exvar.ast.SyntaxNode;
import exvar.ast.type.TypeRef;

/**
 * A local variable or parameter.
 *
 * @param declaredType     declared type syntax; {@code null} for implicitly typed lambda parameters
 * @param pos              position of the declared identifier
 * @param enclosingScope   evaluation context of an out variable's declaration, may be {@code null}
 * @param declaringContext the call, creation or constructor initializer an out variable is declared in
 */
public record LocalSymbol(
        String name,
        TypeRef declaredType,
        LocalDeclarationKind kind,
        Pos pos,
        MemberSymbol containingMember,
        Scope scope,
        Scope enclosingScope,
        SyntaxNode declaringContext
) implements Symbol {

    /** {@code var x} and untyped lambda parameters get their type from elsewhere. */
    public boolean isImplicitlyTyped() {
        return declaredType == null || declaredType.isVar();
    }

    @Override
    public String toString() {
        String type = declaredType == null ? "?" : declaredType.text();
        return name + " : " + type + " (" + kind + ")";
    }
}
