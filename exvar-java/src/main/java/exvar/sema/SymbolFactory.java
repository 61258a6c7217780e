package exvar.sema;

import exvar.ast.Identifier;
import exvar.ast.SyntaxNode;
import exvar.ast.type.TypeRef;

/**
 * Manufactures local symbols. Implementations must not fail for well-formed input.
 */
public interface SymbolFactory {

    LocalSymbol makeLocal(Scope scope, TypeRef type, Identifier identifier, LocalDeclarationKind kind);

    LocalSymbol makePatternVariable(Scope scope, TypeRef type, Identifier identifier);

    /**
     * @param enclosingScope   may be {@code null}
     * @param declaringContext the invocation, object creation or constructor initializer
     *                         whose argument list holds the declaration
     */
    LocalSymbol makeOutVariable(Scope scope, Scope enclosingScope, TypeRef type, Identifier identifier,
                                SyntaxNode declaringContext);
}
