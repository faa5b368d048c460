package work.lcod.texstack.item;

import java.util.Locale;

/**
 * Closed set of stack item kinds. Each kind fixes whether its items open a scope, close one, or wrap a finished tree.
 */
public enum ItemKind {
    START("start", Role.OPEN),
    STOP("stop", Role.CLOSE),
    OPEN("open", Role.OPEN),
    CLOSE("close", Role.CLOSE),
    LEFT("left", Role.OPEN),
    RIGHT("right", Role.CLOSE),
    BEGIN("begin", Role.OPEN),
    END("end", Role.CLOSE),
    OVER("over", Role.CLOSE),
    SUBSUP("subsup", Role.NONE),
    PRIME("prime", Role.NONE),
    STYLE("style", Role.NONE),
    POSITION("position", Role.NONE),
    ARRAY("array", Role.OPEN),
    CELL("cell", Role.CLOSE),
    FN("fn", Role.NONE),
    NOT("not", Role.NONE),
    DOTS("dots", Role.NONE),
    MML("mml", Role.FINAL);

    private enum Role {
        NONE,
        OPEN,
        CLOSE,
        FINAL
    }

    private final String tag;
    private final Role role;

    ItemKind(String tag, Role role) {
        this.tag = tag;
        this.role = role;
    }

    public String tag() {
        return tag;
    }

    public boolean isOpen() {
        return role == Role.OPEN;
    }

    public boolean isClose() {
        return role == Role.CLOSE;
    }

    public boolean isFinal() {
        return role == Role.FINAL;
    }

    public static ItemKind fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Item kind is required");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (ItemKind kind : values()) {
            if (kind.tag.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown item kind: " + tag);
    }
}
