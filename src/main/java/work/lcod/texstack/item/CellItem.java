package work.lcod.texstack.item;

/**
 * Table separator: column separator ({@code &}), row separator ({@code \\}) or a plain line break.
 */
public class CellItem extends StackItem {
    public static final String ENTRY_SEPARATOR = "&";
    public static final String ROW_SEPARATOR = "\\\\";

    private boolean entry;
    private boolean cr;
    private boolean linebreak;

    public CellItem() {
        super(ItemKind.CELL);
    }

    public boolean isEntry() {
        return entry;
    }

    public CellItem setEntry(boolean entry) {
        this.entry = entry;
        return this;
    }

    public boolean isCR() {
        return cr;
    }

    /**
     * Marks this cell as a row separator; a cell still carrying the default {@code &} name is renamed {@code \\}.
     */
    public CellItem setCR(boolean cr) {
        this.cr = cr;
        renameSeparator(cr);
        return this;
    }

    public boolean isLinebreak() {
        return linebreak;
    }

    public CellItem setLinebreak(boolean linebreak) {
        this.linebreak = linebreak;
        renameSeparator(linebreak);
        return this;
    }

    private void renameSeparator(boolean rowBreak) {
        if (rowBreak && ENTRY_SEPARATOR.equals(name())) {
            setName(ROW_SEPARATOR);
        }
    }
}
