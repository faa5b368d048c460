package work.lcod.texstack.item;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.texstack.error.TexErrorKind;
import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.Nodes;

/**
 * Entry of the parse stack: a partially reduced construct plus the nodes collected for it so far.
 *
 * <p>Subclasses override {@link #checkItem(ParseContext, StackItem)} to react to the item about to be pushed
 * on top of them, and fall back to the shared rule implemented here.
 */
public abstract class StackItem {
    private final ItemKind kind;
    private final List<MmlNode> data = new ArrayList<>();
    private final Map<ItemKind, TexErrorKind> closeErrors = new EnumMap<>(ItemKind.class);
    private Map<String, Object> env;
    private String name;

    protected StackItem(ItemKind kind, MmlNode... nodes) {
        this.kind = Objects.requireNonNull(kind, "kind");
        closeErrors.put(ItemKind.CLOSE, TexErrorKind.EXTRA_CLOSE_MISSING_OPEN);
        closeErrors.put(ItemKind.RIGHT, TexErrorKind.MISSING_LEFT_EXTRA_RIGHT);
        closeErrors.put(ItemKind.END, TexErrorKind.EXTRA_OPEN_MISSING_CLOSE);
        if (nodes != null) {
            for (MmlNode node : nodes) {
                if (node != null) {
                    data.add(node);
                }
            }
        }
    }

    public final ItemKind kind() {
        return kind;
    }

    public final boolean isKind(ItemKind candidate) {
        return kind == candidate;
    }

    public final boolean isOpen() {
        return kind.isOpen();
    }

    public final boolean isClose() {
        return kind.isClose();
    }

    public final boolean isFinal() {
        return kind.isFinal();
    }

    public String name() {
        return name;
    }

    public StackItem setName(String name) {
        this.name = name;
        return this;
    }

    /**
     * Scope variables. Open items own a fresh map; other items see the enclosing scope's map.
     */
    public Map<String, Object> env() {
        return env;
    }

    public void useEnv(Map<String, Object> env) {
        this.env = env;
    }

    /**
     * Whether a new scope opened by this item starts from a copy of the enclosing scope's variables.
     */
    public boolean copyEnv() {
        return true;
    }

    public void clearEnv() {
        if (env != null) {
            env.clear();
        }
    }

    public List<MmlNode> data() {
        return Collections.unmodifiableList(data);
    }

    public void push(MmlNode... nodes) {
        for (MmlNode node : nodes) {
            data.add(node);
        }
    }

    public MmlNode pop() {
        return data.isEmpty() ? null : data.remove(data.size() - 1);
    }

    public MmlNode first() {
        return data.isEmpty() ? null : data.get(0);
    }

    protected MmlNode dataAt(int index) {
        return index < data.size() ? data.get(index) : null;
    }

    protected void setDataAt(int index, MmlNode node) {
        while (data.size() <= index) {
            data.add(null);
        }
        data.set(index, node);
    }

    protected void clearData() {
        data.clear();
    }

    protected void registerCloseError(ItemKind closer, TexErrorKind error) {
        closeErrors.put(closer, error);
    }

    public MmlNode toMml() {
        return toMml(true, false);
    }

    /**
     * Collected nodes as one node: the single node itself, or a row wrapping all of them.
     */
    public MmlNode toMml(boolean inferred, boolean forceRow) {
        if (data.size() == 1 && !forceRow) {
            return data.get(0);
        }
        return Nodes.create(inferred ? "inferredMrow" : "mrow", new ArrayList<>(data), null);
    }

    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        if (item instanceof OverItem over && isOpen()) {
            over.setNumerator(toMml(false, false));
            data.clear();
        }
        if (item instanceof CellItem cell && isOpen()) {
            if (cell.isLinebreak()) {
                return CheckResult.discard();
            }
            throw TexErrorKind.MISPLACED.error(item.name());
        }
        if (item.isClose() && closeErrors.containsKey(item.kind())) {
            throw closeErrors.get(item.kind()).error();
        }
        if (!item.isFinal()) {
            return CheckResult.push();
        }
        data.add(item.first());
        return CheckResult.discard();
    }

    @Override
    public String toString() {
        return kind.tag() + data;
    }
}
