package exvar.sema;

import exvar.ast.SyntaxNode;

import java.util.ArrayDeque;
import java.util.Deque;

public final class SymbolTable {
    private final Deque<Scope> scopes = new ArrayDeque<>();

    public SymbolTable(Scope global) { scopes.push(global); }

    public Scope push(MemberSymbol owner, SyntaxNode syntax) {
        Scope s = new Scope(current(), owner, syntax);
        scopes.push(s);
        return s;
    }

    public Scope pushNested(SyntaxNode syntax) {
        return push(current().containingMember(), syntax);
    }

    public Scope pop() {
        if (scopes.size() == 1) throw new IllegalStateException("Cannot pop the global scope");
        return scopes.pop();
    }

    public Scope current() { return scopes.peek(); }

    public void define(Symbol sym) { current().define(sym); }
}
