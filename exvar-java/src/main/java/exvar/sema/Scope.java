package exvar.sema;

import exvar.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Scope {
    private final Scope parent;
    private final MemberSymbol containingMember;
    private final SyntaxNode syntax;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    public Scope(Scope parent, MemberSymbol containingMember, SyntaxNode syntax) {
        this.parent = parent;
        this.containingMember = containingMember;
        this.syntax = syntax;
    }

    public void define(Symbol sym) {
        String name = sym.name();
        if (symbols.containsKey(name)) {
            throw new SemanticException("[" + sym.pos() + "] Duplicate symbol: " + name);
        }
        symbols.put(name, sym);
    }

    public List<LocalSymbol> locals() {
        List<LocalSymbol> out = new ArrayList<>();
        for (Symbol sym : symbols.values()) {
            if (sym instanceof LocalSymbol l) out.add(l);
        }
        return out;
    }

    public Scope parent() { return parent; }

    public MemberSymbol containingMember() { return containingMember; }

    public SyntaxNode syntax() { return syntax; }

    @Override
    public String toString() {
        return "Scope(" + containingMember + ", " + syntax + ")";
    }
}
