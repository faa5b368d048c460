package work.lcod.texstack.item;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.texstack.support.StackTestSupport.item;
import static work.lcod.texstack.support.StackTestSupport.mi;
import static work.lcod.texstack.support.StackTestSupport.stack;

import org.junit.jupiter.api.Test;
import work.lcod.texstack.error.TexError;
import work.lcod.texstack.tree.MmlNode;

class PositionItemTest {
    @Test
    void raiseWrapsInPaddedBox() {
        var stack = stack();
        stack.push(item(stack, ItemKind.POSITION, PositionItem.class).vertical("+.5em", "-.5em"));
        stack.push(mi("x"));

        var tree = stack.finish();
        assertEquals("mpadded(mi(x))", tree.toString());
        assertEquals("+.5em", tree.attribute("height"));
        assertEquals("-.5em", tree.attribute("depth"));
        assertEquals("+.5em", tree.attribute("voffset"));
    }

    @Test
    void horizontalMoveSurroundsWithSpaces() {
        var stack = stack();
        var left = MmlNode.of("mspace").setAttribute("width", "1em");
        stack.push(item(stack, ItemKind.POSITION, PositionItem.class).horizontal(left, null));
        stack.push(mi("x"));

        assertEquals("inferredMrow(mspace(),mi(x))", stack.finish().toString());
    }

    @Test
    void positionWaitsForBraceGroup() {
        var stack = stack();
        stack.push(item(stack, ItemKind.POSITION, PositionItem.class).vertical("1ex", null));
        stack.push(item(stack, ItemKind.OPEN));
        stack.push(mi("x"));
        stack.push(item(stack, ItemKind.CLOSE));
        assertEquals("mpadded(TeXAtom(mi(x)))", stack.finish().toString());
    }

    @Test
    void closeBeforeBoxIsReported() {
        var stack = stack();
        stack.push(item(stack, ItemKind.OPEN));
        stack.push(item(stack, ItemKind.POSITION).setName("\\raise"));
        var error = assertThrows(TexError.class, () -> stack.push(item(stack, ItemKind.CLOSE)));
        assertEquals("MissingBoxFor", error.key());
        assertEquals("Missing box for \\raise", error.getMessage());
    }
}
