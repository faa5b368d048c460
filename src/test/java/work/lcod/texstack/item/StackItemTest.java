package work.lcod.texstack.item;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.texstack.support.StackTestSupport.item;
import static work.lcod.texstack.support.StackTestSupport.mi;
import static work.lcod.texstack.support.StackTestSupport.mn;
import static work.lcod.texstack.support.StackTestSupport.stack;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.texstack.error.TexError;
import work.lcod.texstack.runtime.ParseContext;

class StackItemTest {
    private final ParseContext ctx = new ParseContext();

    @Test
    void finalItemsNeverAbsorb() {
        var mml = ctx.factory().mml(mi("x"));
        for (ItemKind kind : new ItemKind[] {ItemKind.CLOSE, ItemKind.STOP, ItemKind.SUBSUP, ItemKind.CELL}) {
            var result = mml.checkItem(ctx, ctx.factory().create(kind));
            assertEquals(CheckResult.Outcome.PUSH, result.outcome());
        }
        var other = mml.checkItem(ctx, ctx.factory().mml(mn("1")));
        assertEquals(CheckResult.Outcome.PUSH, other.outcome());
    }

    @Test
    void finalItemIsAbsorbedByOpenItem() {
        var open = ctx.factory().create(ItemKind.OPEN);
        var result = open.checkItem(ctx, ctx.factory().mml(mi("x")));
        assertSame(CheckResult.discard(), result);
        assertEquals("mi(x)", open.first().toString());
    }

    @Test
    void toMmlWrapsSeveralNodes() {
        var open = ctx.factory().create(ItemKind.OPEN);
        open.push(mi("a"));
        assertEquals("mi(a)", open.toMml().toString());
        assertEquals("mrow(mi(a))", open.toMml(false, true).toString());
        open.push(mi("b"));
        assertEquals("inferredMrow(mi(a),mi(b))", open.toMml().toString());
        assertEquals("mrow(mi(a),mi(b))", open.toMml(false, false).toString());
        assertEquals("mi(b)", open.pop().toString());
    }

    @Test
    void separatorInsideGroupIsMisplaced() {
        var stack = stack();
        stack.push(item(stack, ItemKind.OPEN));
        var error = assertThrows(TexError.class,
            () -> stack.push(item(stack, ItemKind.CELL, CellItem.class).setEntry(true).setName("&")));
        assertEquals("Misplaced", error.key());
        assertEquals("Misplaced &", error.getMessage());
    }

    @Test
    void unnamedSeparatorsAreNamedInErrors() {
        var stack = stack();
        stack.push(item(stack, ItemKind.OPEN));
        var entry = assertThrows(TexError.class,
            () -> stack.push(item(stack, ItemKind.CELL, CellItem.class).setEntry(true)));
        assertEquals("Misplaced &", entry.getMessage());
        var row = assertThrows(TexError.class,
            () -> stack.push(item(stack, ItemKind.CELL, CellItem.class).setCR(true)));
        assertEquals("Misplaced \\\\", row.getMessage());
        assertEquals(List.of("\\\\"), row.args());
    }

    @Test
    void lineBreakInsideGroupIsDropped() {
        var stack = stack();
        stack.push(item(stack, ItemKind.OPEN));
        stack.push(mi("a"));
        stack.push(item(stack, ItemKind.CELL, CellItem.class).setLinebreak(true));
        assertEquals(2, stack.size());
        assertEquals(ItemKind.OPEN, stack.top().kind());
    }

    @Test
    void nonFinalItemsAreStacked() {
        var stack = stack();
        stack.push(item(stack, ItemKind.STYLE));
        stack.push(item(stack, ItemKind.DOTS));
        assertEquals(3, stack.size());
        assertEquals(ItemKind.DOTS, stack.top().kind());
    }
}
