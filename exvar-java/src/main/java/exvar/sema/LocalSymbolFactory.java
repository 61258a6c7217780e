package exvar.sema;

import exvar.ast.Identifier;
import exvar.ast.SyntaxNode;
import exvar.ast.type.TypeRef;

public final class LocalSymbolFactory implements SymbolFactory {

    public static final LocalSymbolFactory INSTANCE = new LocalSymbolFactory();

    private LocalSymbolFactory() {}

    @Override
    public LocalSymbol makeLocal(Scope scope, TypeRef type, Identifier identifier, LocalDeclarationKind kind) {
        return new LocalSymbol(identifier.text(), type, kind, identifier.pos(),
                scope.containingMember(), scope, null, null);
    }

    @Override
    public LocalSymbol makePatternVariable(Scope scope, TypeRef type, Identifier identifier) {
        return makeLocal(scope, type, identifier, LocalDeclarationKind.PATTERN_VARIABLE);
    }

    @Override
    public LocalSymbol makeOutVariable(Scope scope, Scope enclosingScope, TypeRef type, Identifier identifier,
                                       SyntaxNode declaringContext) {
        return new LocalSymbol(identifier.text(), type, LocalDeclarationKind.OUT_VARIABLE, identifier.pos(),
                scope.containingMember(), scope, enclosingScope, declaringContext);
    }
}
