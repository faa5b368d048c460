package work.lcod.texstack.item;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.texstack.config.NumberingMode;
import work.lcod.texstack.config.ParserOptions;
import work.lcod.texstack.tree.MmlNode;

/**
 * Single creation point for stack items. Every kind of {@link ItemKind} has a constructor registered up front;
 * constructors may be swapped for a kind (e.g. a custom array environment) but the set of kinds is fixed.
 */
public final class StackItemFactory {
    private final Map<ItemKind, ItemConstructor> constructors = new EnumMap<>(ItemKind.class);

    public StackItemFactory(ParserOptions options) {
        Objects.requireNonNull(options, "options");
        register(ItemKind.START, nodes -> new StartItem());
        register(ItemKind.STOP, nodes -> new StopItem());
        register(ItemKind.OPEN, nodes -> new OpenItem());
        register(ItemKind.CLOSE, nodes -> new CloseItem());
        register(ItemKind.LEFT, nodes -> new LeftItem(options.leftDelimiter()));
        register(ItemKind.RIGHT, nodes -> new RightItem(options.rightDelimiter()));
        register(ItemKind.BEGIN, nodes -> new BeginItem());
        register(ItemKind.END, nodes -> new EndItem());
        register(ItemKind.OVER, nodes -> new OverItem());
        register(ItemKind.SUBSUP, SubsupItem::new);
        register(ItemKind.PRIME, PrimeItem::new);
        register(ItemKind.STYLE, nodes -> new StyleItem());
        register(ItemKind.POSITION, nodes -> new PositionItem());
        register(ItemKind.ARRAY, nodes -> new ArrayItem()
            .setArraydef("columnalign", options.columnAlign())
            .setArraydef("columnspacing", options.columnSpacing())
            .setArraydef("rowspacing", options.rowSpacing())
            .setNumbered(options.numberingMode() == NumberingMode.ALL)
            .setLabelPlacement(options.tagSide(), options.tagIndent()));
        register(ItemKind.CELL, nodes -> new CellItem().setName(CellItem.ENTRY_SEPARATOR));
        register(ItemKind.FN, FnItem::new);
        register(ItemKind.NOT, nodes -> new NotItem());
        register(ItemKind.DOTS, nodes -> new DotsItem());
        register(ItemKind.MML, nodes -> new MmlItem(nodes.length == 0 ? null : nodes[0]));
    }

    public StackItemFactory register(ItemKind kind, ItemConstructor constructor) {
        constructors.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(constructor, "constructor"));
        return this;
    }

    public Map<ItemKind, ItemConstructor> constructors() {
        return Collections.unmodifiableMap(constructors);
    }

    public StackItem create(ItemKind kind, MmlNode... nodes) {
        var constructor = constructors.get(kind);
        if (constructor == null) {
            throw new IllegalStateException("Item kind not registered: " + kind);
        }
        StackItem item = constructor.create(nodes == null ? new MmlNode[0] : nodes);
        if (item == null || !item.isKind(kind)) {
            throw new IllegalStateException("Constructor for " + kind.tag() + " produced " + item);
        }
        return item;
    }

    public <T extends StackItem> T create(ItemKind kind, Class<T> type, MmlNode... nodes) {
        StackItem item = create(kind, nodes);
        if (!type.isInstance(item)) {
            throw new IllegalStateException("Item " + kind.tag() + " is a " + item.getClass().getSimpleName()
                + ", not a " + type.getSimpleName());
        }
        return type.cast(item);
    }

    public StackItem create(String tag, MmlNode... nodes) {
        return create(ItemKind.fromTag(tag), nodes);
    }

    public StackItem mml(MmlNode node) {
        return create(ItemKind.MML, node);
    }
}
