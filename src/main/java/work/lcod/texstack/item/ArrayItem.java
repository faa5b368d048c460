package work.lcod.texstack.item;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.texstack.error.TexErrorKind;
import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.Nodes;

/**
 * Tabular environment. Collects entries into cells, cells into rows and rows into the table, driven by the
 * separator items pushed onto it.
 */
public class ArrayItem extends StackItem {
    private final List<MmlNode> table = new ArrayList<>();
    private final List<MmlNode> row = new ArrayList<>();
    private final List<String> frame = new ArrayList<>();
    private final List<Integer> hfill = new ArrayList<>();
    private final Map<String, Object> arraydef = new LinkedHashMap<>();
    private boolean dashed;
    private boolean numbered;
    private boolean requireClose;
    private String open;
    private String close;
    private String rowspacing;
    private String tagSide;
    private String tagIndent;

    public ArrayItem() {
        super(ItemKind.ARRAY);
    }

    @Override
    public boolean copyEnv() {
        return false;
    }

    public List<MmlNode> table() {
        return Collections.unmodifiableList(table);
    }

    public List<MmlNode> row() {
        return Collections.unmodifiableList(row);
    }

    public List<String> frame() {
        return Collections.unmodifiableList(frame);
    }

    public Map<String, Object> arraydef() {
        return arraydef;
    }

    public ArrayItem setArraydef(String name, Object value) {
        if (value == null) {
            arraydef.remove(name);
        } else {
            arraydef.put(name, value);
        }
        return this;
    }

    public ArrayItem addFrame(String side) {
        frame.add(side);
        return this;
    }

    public ArrayItem setDashed(boolean dashed) {
        this.dashed = dashed;
        return this;
    }

    public boolean isNumbered() {
        return numbered;
    }

    public ArrayItem setNumbered(boolean numbered) {
        this.numbered = numbered;
        return this;
    }

    /**
     * Side ({@code left} or {@code right}) and minimum spacing of equation labels, applied to tables that end up
     * with labeled rows.
     */
    public ArrayItem setLabelPlacement(String side, String indent) {
        this.tagSide = side;
        this.tagIndent = indent;
        return this;
    }

    public ArrayItem setRequireClose(boolean requireClose) {
        this.requireClose = requireClose;
        return this;
    }

    public ArrayItem setDelimiters(String open, String close) {
        this.open = open;
        this.close = close;
        return this;
    }

    /**
     * Extra spacing (in em) used to pad {@code rowspacing} up to the number of rows.
     */
    public ArrayItem setRowspacing(String rowspacing) {
        this.rowspacing = rowspacing;
        return this;
    }

    /**
     * Records a fill marker ({@code \hfill}) at the current position of the entry being collected.
     */
    public ArrayItem addHfill() {
        hfill.add(data().size());
        return this;
    }

    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        if (item.isClose() && !item.isKind(ItemKind.OVER)) {
            if (item instanceof CellItem cell && cell.isEntry()) {
                endEntry();
                clearEnv();
                return CheckResult.discard();
            }
            if (item instanceof CellItem cell && cell.isCR()) {
                endEntry();
                endRow();
                clearEnv();
                return CheckResult.discard();
            }
            endTable();
            clearEnv();
            MmlNode mml = buildTable();
            StackItem result = ctx.factory().mml(mml);
            if (requireClose) {
                if (item.isKind(ItemKind.CLOSE)) {
                    return CheckResult.replace(result);
                }
                throw TexErrorKind.MISSING_CLOSE_BRACE.error();
            }
            return CheckResult.replace(result, item);
        }
        return super.checkItem(ctx, item);
    }

    private MmlNode buildTable() {
        Object scriptlevel = arraydef.remove("scriptlevel");
        if (frame.size() > 0 && frame.size() < 4 && arraydef.get("rowlines") instanceof String lines) {
            arraydef.put("rowlines", lines.replaceAll("none( none)+$", "none"));
        }
        MmlNode mml = Nodes.create("mtable", table, arraydef);
        if (table.stream().anyMatch(tr -> tr.isKind("mlabeledtr"))) {
            mml.setAttribute("side", tagSide).setAttribute("minlabelspacing", tagIndent);
        }
        if (frame.size() == 4) {
            mml.setAttribute("frame", dashed ? "dashed" : "solid");
        } else if (!frame.isEmpty()) {
            mml = Nodes.create("menclose", mml)
                .setAttribute("notation", String.join(" ", frame))
                .setProperty("isFrame", true);
            if (!"none".equals(arraydef.getOrDefault("columnlines", "none"))
                || !"none".equals(arraydef.getOrDefault("rowlines", "none"))) {
                mml.setAttribute("padding", 0);
            }
        }
        if (scriptlevel != null) {
            mml = Nodes.create("mstyle", mml).setAttribute("scriptlevel", scriptlevel);
        }
        if (hasText(open) || hasText(close)) {
            mml = Nodes.fenced(open, mml, close);
        }
        return mml;
    }

    public void endEntry() {
        MmlNode mtd = Nodes.create("mtd", data(), null);
        if (!hfill.isEmpty()) {
            if (hfill.get(0) == 0) {
                mtd.setAttribute("columnalign", "right");
            }
            if (hfill.get(hfill.size() - 1) == data().size()) {
                mtd.setAttribute("columnalign", mtd.attribute("columnalign") != null ? "center" : "left");
            }
        }
        row.add(mtd);
        clearData();
        hfill.clear();
    }

    public void endRow() {
        MmlNode node;
        if (numbered && row.size() == 3) {
            row.add(0, row.remove(row.size() - 1));
            node = Nodes.create("mlabeledtr", row, null);
        } else {
            node = Nodes.create("mtr", row, null);
        }
        table.add(node);
        row.clear();
    }

    public void endTable() {
        if (!data().isEmpty() || !row.isEmpty()) {
            endEntry();
            endRow();
        }
        checkLines();
    }

    /**
     * Fits {@code rowlines} and {@code rowspacing} to the number of rows. A single row line on a single row
     * becomes the bottom frame and leaves no {@code rowlines} behind.
     */
    void checkLines() {
        if (arraydef.get("rowlines") != null) {
            List<String> lines = new ArrayList<>(Arrays.asList(String.valueOf(arraydef.get("rowlines")).split(" ")));
            if (lines.size() == table.size()) {
                frame.add("bottom");
                lines.remove(lines.size() - 1);
            } else {
                while (lines.size() < table.size()) {
                    lines.add("none");
                }
            }
            if (lines.isEmpty()) {
                arraydef.remove("rowlines");
            } else {
                arraydef.put("rowlines", String.join(" ", lines));
            }
        }
        if (rowspacing != null) {
            Object current = arraydef.get("rowspacing");
            List<String> rows = current == null
                ? new ArrayList<>()
                : new ArrayList<>(Arrays.asList(String.valueOf(current).split(" ")));
            while (rows.size() < table.size()) {
                rows.add(rowspacing + "em");
            }
            arraydef.put("rowspacing", String.join(" ", rows));
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
