package com.infergate.backend;

import com.infergate.model.FinishReason;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * One incremental unit of assistant output: a role announcement, a text delta
 * or the terminal marker.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class StreamFragment {

    public enum Kind {
        ROLE,
        TEXT,
        FINISH
    }

    private static final StreamFragment ROLE = new StreamFragment(Kind.ROLE, "", null);

    private final Kind kind;
    private final String text;
    private final FinishReason finishReason;

    private StreamFragment(Kind kind, String text, FinishReason finishReason) {
        this.kind = kind;
        this.text = text;
        this.finishReason = finishReason;
    }

    public static StreamFragment role() {
        return ROLE;
    }

    public static StreamFragment text(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Text fragment must not be empty");
        }
        return new StreamFragment(Kind.TEXT, text, null);
    }

    public static StreamFragment finish(FinishReason finishReason) {
        return new StreamFragment(Kind.FINISH, null, Objects.requireNonNull(finishReason, "finishReason"));
    }

    public boolean isTerminal() {
        return kind == Kind.FINISH;
    }
}
