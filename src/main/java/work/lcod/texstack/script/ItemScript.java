package work.lcod.texstack.script;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.texstack.item.ArrayItem;
import work.lcod.texstack.item.CellItem;
import work.lcod.texstack.item.DotsItem;
import work.lcod.texstack.item.ItemKind;
import work.lcod.texstack.item.LeftItem;
import work.lcod.texstack.item.OverItem;
import work.lcod.texstack.item.PositionItem;
import work.lcod.texstack.item.RightItem;
import work.lcod.texstack.item.ScriptPosition;
import work.lcod.texstack.item.StackItem;
import work.lcod.texstack.item.StyleItem;
import work.lcod.texstack.item.SubsupItem;
import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.runtime.ParseStack;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.NodeCodec;

/**
 * Declarative push sequence that drives a {@link ParseStack} without a tokenizer.
 *
 * <p>Each step is a map with a {@code kind} tag and kind-specific keys, e.g.
 * {@code {kind: left, delim: "["}}, {@code {kind: mml, node: "mi:x"}} or
 * {@code {kind: subsup, base: prev, position: sup}}. A {@code base} of {@code prev} takes the last node collected
 * by the top item. The pseudo step {@code {hfill: true}} records a fill
 * marker on the array at the top of the stack.
 */
public final class ItemScript {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<List<Map<String, Object>>> STEPS_REF = new TypeReference<>() {};
    private static final String PREV = "prev";

    private final List<Map<String, Object>> steps;

    public ItemScript(List<Map<String, Object>> steps) {
        this.steps = steps == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static ItemScript load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read script: " + path, ex);
        }
    }

    public static ItemScript parse(InputStream in) throws IOException {
        List<Map<String, Object>> parsed = YAML_MAPPER.readValue(in, STEPS_REF);
        return new ItemScript(parsed);
    }

    public List<Map<String, Object>> steps() {
        return steps;
    }

    /**
     * Runs every step on a fresh stack and returns the finished tree.
     */
    public MmlNode run(ParseContext ctx) {
        var stack = new ParseStack(ctx);
        for (int index = 0; index < steps.size(); index++) {
            var step = steps.get(index);
            if (step == null) {
                continue;
            }
            apply(stack, step, index);
        }
        return stack.finish();
    }

    void apply(ParseStack stack, Map<String, Object> step, int index) {
        if (Boolean.TRUE.equals(step.get("hfill"))) {
            if (!(stack.top() instanceof ArrayItem array)) {
                throw new IllegalArgumentException("Step " + index + ": hfill outside of an array");
            }
            array.addHfill();
            return;
        }
        String tag = Objects.toString(step.get("kind"), null);
        if (tag == null) {
            throw new IllegalArgumentException("Step " + index + " has no kind: " + step);
        }
        stack.push(buildItem(stack, ItemKind.fromTag(tag), step));
    }

    private StackItem buildItem(ParseStack stack, ItemKind kind, Map<String, Object> step) {
        var ctx = stack.context();
        var factory = ctx.factory();
        StackItem item = switch (kind) {
            case MML -> factory.mml(requiredNode(step, "node"));
            case LEFT -> {
                var left = factory.create(kind, LeftItem.class);
                if (step.get("delim") != null) {
                    left.setDelim(String.valueOf(step.get("delim")));
                }
                yield left;
            }
            case RIGHT -> {
                var right = factory.create(kind, RightItem.class);
                if (step.get("delim") != null) {
                    right.setDelim(String.valueOf(step.get("delim")));
                }
                yield right;
            }
            case OVER -> {
                var over = factory.create(kind, OverItem.class);
                over.setThickness(string(step.get("thickness")));
                over.setDelimiters(string(step.get("open")), string(step.get("close")));
                yield over;
            }
            case SUBSUP -> buildSubsup(stack, step);
            case PRIME -> {
                MmlNode prime = requiredNode(step, "node");
                Object base = step.get("base");
                if (base == null || "none".equals(base)) {
                    yield factory.create(kind, prime);
                }
                yield factory.create(kind, baseNode(stack, step), prime);
            }
            case STYLE -> {
                var style = factory.create(kind, StyleItem.class);
                asMap(step.get("styles")).forEach(style::setStyle);
                yield style;
            }
            case POSITION -> buildPosition(stack, step);
            case ARRAY -> buildArray(stack, step);
            case CELL -> factory.create(kind, CellItem.class)
                .setEntry(Boolean.TRUE.equals(step.get("entry")))
                .setCR(Boolean.TRUE.equals(step.get("cr")))
                .setLinebreak(Boolean.TRUE.equals(step.get("linebreak")));
            case FN -> factory.create(kind, baseNode(stack, step));
            case DOTS -> factory.create(kind, DotsItem.class)
                .setDots(NodeCodec.fromLiteral(step.get("ldots")), NodeCodec.fromLiteral(step.get("cdots")));
            default -> factory.create(kind);
        };
        if (step.get("name") != null) {
            item.setName(String.valueOf(step.get("name")));
        }
        return item;
    }

    private StackItem buildSubsup(ParseStack stack, Map<String, Object> step) {
        var factory = stack.context().factory();
        var subsup = factory.create(ItemKind.SUBSUP, SubsupItem.class, baseNode(stack, step));
        if (step.get("position") != null) {
            subsup.setPosition(ScriptPosition.from(String.valueOf(step.get("position"))));
        }
        subsup.setPrimes(NodeCodec.fromLiteral(step.get("primes")));
        if (step.get("movesupsub") instanceof Boolean movesupsub) {
            subsup.setMovesupsub(movesupsub);
        }
        return subsup;
    }

    private StackItem buildPosition(ParseStack stack, Map<String, Object> step) {
        var position = stack.context().factory().create(ItemKind.POSITION, PositionItem.class);
        if ("horizontal".equals(step.get("move"))) {
            position.horizontal(NodeCodec.fromLiteral(step.get("left")), NodeCodec.fromLiteral(step.get("right")));
        } else {
            position.vertical(string(step.get("dh")), string(step.get("dd")));
        }
        return position;
    }

    private StackItem buildArray(ParseStack stack, Map<String, Object> step) {
        var array = stack.context().factory().create(ItemKind.ARRAY, ArrayItem.class);
        asMap(step.get("arraydef")).forEach(array::setArraydef);
        if (step.get("numbered") instanceof Boolean numbered) {
            array.setNumbered(numbered);
        }
        array.setRequireClose(Boolean.TRUE.equals(step.get("requireClose")));
        array.setDashed(Boolean.TRUE.equals(step.get("dashed")));
        array.setDelimiters(string(step.get("open")), string(step.get("close")));
        array.setRowspacing(string(step.get("rowspacing")));
        if (step.get("frame") instanceof List<?> sides) {
            for (Object side : sides) {
                array.addFrame(String.valueOf(side));
            }
        }
        return array;
    }

    private static MmlNode baseNode(ParseStack stack, Map<String, Object> step) {
        Object base = step.get("base");
        if (PREV.equals(base)) {
            return stack.prev();
        }
        return NodeCodec.fromLiteral(base);
    }

    private static MmlNode requiredNode(Map<String, Object> step, String key) {
        MmlNode node = NodeCodec.fromLiteral(step.get(key));
        if (node == null) {
            throw new IllegalArgumentException("Step " + step.get("kind") + " requires '" + key + "'");
        }
        return node;
    }

    private static Map<String, Object> asMap(Object value) {
        var map = new LinkedHashMap<String, Object>();
        if (value instanceof Map<?, ?> raw) {
            raw.forEach((key, entry) -> map.put(String.valueOf(key), entry));
        }
        return map;
    }

    private static String string(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    @Override
    public String toString() {
        return "script" + new ArrayList<>(steps);
    }
}
