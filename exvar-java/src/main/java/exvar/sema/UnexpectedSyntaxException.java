package exvar.sema;

import exvar.ast.SyntaxKind;
import exvar.ast.SyntaxNode;

/**
 * The tree has a shape the parser can never produce, even on erroneous input.
 * Signals a defect in whatever built the tree, not a problem with the source.
 */
public class UnexpectedSyntaxException extends IllegalStateException {
    private final SyntaxKind unexpectedKind;

    public UnexpectedSyntaxException(SyntaxKind unexpectedKind, SyntaxNode node) {
        super("[" + node.pos() + "] Unexpected context " + unexpectedKind + " for " + node.kind());
        this.unexpectedKind = unexpectedKind;
    }

    public SyntaxKind unexpectedKind() {
        return unexpectedKind;
    }
}
