package exvar.sema;

import exvar.ast.Pos;

public sealed interface Symbol permits LocalSymbol, MemberSymbol {
    String name();

    Pos pos();
}
