package work.lcod.texstack.item;

import java.util.Locale;
import work.lcod.texstack.error.TexErrorKind;
import work.lcod.texstack.tree.MmlNode;

/**
 * Script slot a {@link SubsupItem} is waiting to fill.
 */
public enum ScriptPosition {
    SUB(MmlNode.SUB, TexErrorKind.MISSING_OPEN_FOR_SUB),
    SUP(MmlNode.SUP, TexErrorKind.MISSING_OPEN_FOR_SUP);

    private final int slot;
    private final TexErrorKind missingOpen;

    ScriptPosition(int slot, TexErrorKind missingOpen) {
        this.slot = slot;
        this.missingOpen = missingOpen;
    }

    public int slot() {
        return slot;
    }

    TexErrorKind missingOpen() {
        return missingOpen;
    }

    public static ScriptPosition from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Script position is required (sub|sup)");
        }
        return ScriptPosition.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
