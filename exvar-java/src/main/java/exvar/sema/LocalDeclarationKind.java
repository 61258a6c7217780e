package exvar.sema;

public enum LocalDeclarationKind {
    REGULAR_VARIABLE,
    PARAMETER,
    PATTERN_VARIABLE,
    OUT_VARIABLE
}
