package work.lcod.texstack.item;

/**
 * {@code \right} delimiter.
 */
public class RightItem extends StackItem {
    private String delim;

    public RightItem(String delim) {
        super(ItemKind.RIGHT);
        this.delim = delim;
    }

    public String delim() {
        return delim;
    }

    public RightItem setDelim(String delim) {
        this.delim = delim;
        return this;
    }
}
