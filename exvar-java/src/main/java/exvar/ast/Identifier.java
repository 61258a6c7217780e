package exvar.ast;

import java.util.Objects;

public record Identifier(String text, Pos pos) {

    public Identifier {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(pos, "pos");
    }

    public static Identifier of(String text) {
        return new Identifier(text, Pos.NONE);
    }

    @Override
    public String toString() {
        return text;
    }
}
