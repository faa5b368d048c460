package work.lcod.texstack.item;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.texstack.support.StackTestSupport.item;
import static work.lcod.texstack.support.StackTestSupport.mi;
import static work.lcod.texstack.support.StackTestSupport.mo;
import static work.lcod.texstack.support.StackTestSupport.stack;

import org.junit.jupiter.api.Test;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.TexClass;

class FnItemTest {
    @Test
    void functionAppliesToOrdinaryArgument() {
        var stack = stack();
        stack.push(item(stack, ItemKind.FN, mi("sin")));
        stack.push(mi("x"));

        var tree = stack.finish();
        assertEquals(3, tree.children().size());
        assertEquals("\u2061", tree.child(1).textContent());
        assertEquals(TexClass.NONE, tree.child(1).texClass());
        assertEquals("mi(x)", tree.child(2).toString());
    }

    @Test
    void noApplicationBeforeOperators() {
        var stack = stack();
        stack.push(item(stack, ItemKind.FN, mi("sin")));
        stack.push(mo("+", TexClass.BIN));
        assertEquals("inferredMrow(mi(sin),mo(+))", stack.finish().toString());
    }

    @Test
    void noApplicationBeforeSpaceOrEnd() {
        var stack = stack();
        stack.push(item(stack, ItemKind.FN, mi("sin")));
        stack.push(MmlNode.of("mspace"));
        assertEquals("inferredMrow(mi(sin),mspace())", stack.finish().toString());

        var bare = stack();
        bare.push(item(bare, ItemKind.FN, mi("log")));
        assertEquals("mi(log)", bare.finish().toString());
    }

    @Test
    void functionWaitsForBraceGroup() {
        var stack = stack();
        stack.push(item(stack, ItemKind.FN, mi("sin")));
        stack.push(item(stack, ItemKind.OPEN));
        stack.push(mi("x"));
        stack.push(item(stack, ItemKind.CLOSE));

        var tree = stack.finish();
        assertEquals("\u2061", tree.child(1).textContent());
        assertEquals("TeXAtom(mi(x))", tree.child(2).toString());
    }

    @Test
    void consecutiveFunctionsAreSeparatedByApplication() {
        var stack = stack();
        stack.push(item(stack, ItemKind.FN, mi("sin")));
        stack.push(item(stack, ItemKind.FN, mi("cos")));
        stack.push(mi("x"));

        var tree = stack.finish();
        assertEquals(5, tree.children().size());
        assertEquals("mi(cos)", tree.child(2).toString());
    }

    @Test
    void functionWithoutNameBehavesLikePlainItem() {
        var stack = stack();
        stack.push(item(stack, ItemKind.FN));
        stack.push(mi("x"));
        assertEquals(ItemKind.FN, stack.top().kind());
        assertEquals("mi(x)", stack.top().first().toString());
    }
}
