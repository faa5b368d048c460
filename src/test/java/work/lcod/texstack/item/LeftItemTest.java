package work.lcod.texstack.item;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.texstack.support.StackTestSupport.item;
import static work.lcod.texstack.support.StackTestSupport.mi;
import static work.lcod.texstack.support.StackTestSupport.stack;

import org.junit.jupiter.api.Test;
import work.lcod.texstack.error.TexError;
import work.lcod.texstack.tree.TexClass;

class LeftItemTest {
    @Test
    void leftRightPairBuildsFencedRow() {
        var stack = stack();
        stack.push(item(stack, ItemKind.LEFT, LeftItem.class).setDelim("["));
        stack.push(mi("a"), mi("b"));
        stack.push(item(stack, ItemKind.RIGHT, RightItem.class).setDelim("]"));

        var tree = stack.finish();
        assertEquals("mrow(mo([),mi(a),mi(b),mo(]))", tree.toString());
        assertEquals(TexClass.INNER, tree.texClass());
        assertEquals("[", tree.attribute("open"));
        assertEquals("]", tree.attribute("close"));
    }

    @Test
    void defaultDelimitersComeFromOptions() {
        var stack = stack();
        stack.push(item(stack, ItemKind.LEFT));
        stack.push(mi("a"));
        stack.push(item(stack, ItemKind.RIGHT));
        assertEquals("mrow(mo((),mi(a),mo()))", stack.finish().toString());
    }

    @Test
    void unmatchedLeftIsReportedAtStop() {
        var stack = stack();
        stack.push(item(stack, ItemKind.LEFT));
        stack.push(mi("a"));
        var error = assertThrows(TexError.class, stack::finish);
        assertEquals("ExtraLeftMissingRight", error.key());
    }

    @Test
    void unmatchedRightIsReported() {
        var stack = stack();
        var error = assertThrows(TexError.class, () -> stack.push(item(stack, ItemKind.RIGHT)));
        assertEquals("MissingLeftExtraRight", error.key());
        assertEquals("Missing \\left or extra \\right", error.getMessage());
    }

    @Test
    void braceCannotCloseLeft() {
        var stack = stack();
        stack.push(item(stack, ItemKind.LEFT));
        var error = assertThrows(TexError.class, () -> stack.push(item(stack, ItemKind.CLOSE)));
        assertEquals("ExtraCloseMissingOpen", error.key());
    }
}
