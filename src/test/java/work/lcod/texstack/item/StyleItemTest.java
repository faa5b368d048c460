package work.lcod.texstack.item;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.texstack.support.StackTestSupport.item;
import static work.lcod.texstack.support.StackTestSupport.mi;
import static work.lcod.texstack.support.StackTestSupport.stack;

import org.junit.jupiter.api.Test;

class StyleItemTest {
    @Test
    void styleWrapsRestOfGroup() {
        var stack = stack();
        stack.push(mi("a"));
        stack.push(item(stack, ItemKind.OPEN));
        stack.push(item(stack, ItemKind.STYLE, StyleItem.class).setStyle("displaystyle", false).setStyle("scriptlevel", 1));
        stack.push(mi("b"), mi("c"));
        stack.push(item(stack, ItemKind.CLOSE));

        var tree = stack.finish();
        assertEquals("inferredMrow(mi(a),TeXAtom(mstyle(mi(b),mi(c))))", tree.toString());
        var style = tree.child(1).child(0);
        assertEquals(false, style.attribute("displaystyle"));
        assertEquals(1, style.attribute("scriptlevel"));
    }

    @Test
    void styleAtTopLevelEndsAtStop() {
        var stack = stack();
        stack.push(item(stack, ItemKind.STYLE, StyleItem.class).setStyle("mathcolor", "red"));
        stack.push(mi("x"));

        var tree = stack.finish();
        assertEquals("mstyle(mi(x))", tree.toString());
        assertEquals("red", tree.attribute("mathcolor"));
    }
}
