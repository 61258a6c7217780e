package exvar.sema;

import exvar.ast.Pos;

public record MemberSymbol(String name, Kind kind, Pos pos) implements Symbol {

    public enum Kind {
        FIELD, METHOD, CONSTRUCTOR, LAMBDA
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + name;
    }
}
