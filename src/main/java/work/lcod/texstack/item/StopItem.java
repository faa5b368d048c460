package work.lcod.texstack.item;

/**
 * End-of-input marker.
 */
public class StopItem extends StackItem {
    public StopItem() {
        super(ItemKind.STOP);
    }
}
