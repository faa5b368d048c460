package work.lcod.texstack.item;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.texstack.support.StackTestSupport.item;
import static work.lcod.texstack.support.StackTestSupport.mi;
import static work.lcod.texstack.support.StackTestSupport.mn;
import static work.lcod.texstack.support.StackTestSupport.stack;

import org.junit.jupiter.api.Test;
import work.lcod.texstack.error.TexError;

class OverItemTest {
    @Test
    void overSplitsGroupIntoFraction() {
        var stack = stack();
        stack.push(item(stack, ItemKind.OPEN));
        stack.push(mi("a"), mi("b"));
        stack.push(item(stack, ItemKind.OVER));
        stack.push(mn("2"));
        stack.push(item(stack, ItemKind.CLOSE));

        assertEquals("TeXAtom(mfrac(mrow(mi(a),mi(b)),mn(2)))", stack.finish().toString());
    }

    @Test
    void overAtTopLevelEndsAtStop() {
        var stack = stack();
        stack.push(mi("a"));
        stack.push(item(stack, ItemKind.OVER, OverItem.class).setThickness("0"));
        stack.push(mi("b"));

        var tree = stack.finish();
        assertEquals("mfrac(mi(a),mi(b))", tree.toString());
        assertEquals("0", tree.attribute("linethickness"));
    }

    @Test
    void emptyNumeratorIsAnEmptyRow() {
        var stack = stack();
        stack.push(item(stack, ItemKind.OPEN));
        stack.push(item(stack, ItemKind.OVER));
        stack.push(mi("b"));
        stack.push(item(stack, ItemKind.CLOSE));

        assertEquals("TeXAtom(mfrac(mrow(),mi(b)))", stack.finish().toString());
    }

    @Test
    void delimitedFractionGetsFixedFence() {
        var stack = stack();
        stack.push(mi("n"));
        stack.push(item(stack, ItemKind.OVER, OverItem.class).setThickness("0").setDelimiters("(", ")"));
        stack.push(mi("k"));

        var tree = stack.finish();
        assertEquals("mrow(mo((),mfrac(mi(n),mi(k)),mo()))", tree.toString());
        assertEquals(true, tree.child(1).property("withDelims"));
        assertEquals(false, tree.child(0).attribute("stretchy"));
    }

    @Test
    void secondOverIsAmbiguous() {
        var stack = stack();
        stack.push(item(stack, ItemKind.OPEN));
        stack.push(mi("a"));
        stack.push(item(stack, ItemKind.OVER));
        stack.push(mi("b"));
        var error = assertThrows(TexError.class, () -> stack.push(item(stack, ItemKind.OVER).setName("\\atop")));
        assertEquals("AmbiguousUseOf", error.key());
        assertEquals("Ambiguous use of \\atop", error.getMessage());
    }
}
