package work.lcod.texstack.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.texstack.api.LogLevel;
import work.lcod.texstack.item.CheckResult;
import work.lcod.texstack.item.ItemKind;
import work.lcod.texstack.item.StackItem;
import work.lcod.texstack.tree.MmlNode;

/**
 * The parse stack. Every item pushed is first offered to the current top item, whose {@code checkItem}
 * decides whether it is stacked, dropped, or whether the top is replaced by new items.
 */
public final class ParseStack {
    private final ParseContext ctx;
    private final List<StackItem> stack = new ArrayList<>();
    private Map<String, Object> env = new LinkedHashMap<>();

    public ParseStack(ParseContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        push(ctx.factory().create(ItemKind.START));
    }

    public ParseContext context() {
        return ctx;
    }

    public void push(StackItem... items) {
        for (StackItem item : items) {
            if (item != null) {
                pushOne(item);
            }
        }
    }

    public void push(MmlNode... nodes) {
        for (MmlNode node : nodes) {
            if (node != null) {
                pushOne(ctx.factory().mml(node));
            }
        }
    }

    private void pushOne(StackItem item) {
        StackItem top = top();
        if (top == null) {
            stackItem(item);
            return;
        }
        CheckResult result = top.checkItem(ctx, item);
        if (ctx.isLoggable(LogLevel.DEBUG)) {
            ctx.log(LogLevel.DEBUG, top.kind().tag() + " <- " + item.kind().tag() + ": " + result);
        }
        switch (result.outcome()) {
            case PUSH -> stackItem(item);
            case DISCARD -> {
                // absorbed or dropped by the top item
            }
            case REPLACE -> {
                pop();
                for (StackItem replacement : result.items()) {
                    pushOne(replacement);
                }
            }
        }
    }

    private void stackItem(StackItem item) {
        if (item.isOpen()) {
            Map<String, Object> scope = new LinkedHashMap<>();
            if (item.copyEnv()) {
                scope.putAll(env);
            }
            item.useEnv(scope);
            env = scope;
        } else {
            item.useEnv(env);
        }
        stack.add(item);
    }

    /**
     * Removes the top item. An open item's scope variables are cleared since its scope is over.
     */
    public StackItem pop() {
        if (stack.isEmpty()) {
            return null;
        }
        StackItem item = stack.remove(stack.size() - 1);
        if (item.isOpen()) {
            item.clearEnv();
        }
        StackItem top = top();
        env = top == null || top.env() == null ? new LinkedHashMap<>() : top.env();
        return item;
    }

    public StackItem top() {
        return top(1);
    }

    /**
     * The n-th item from the top (1 = top), or {@code null} when the stack is not that deep.
     */
    public StackItem top(int n) {
        return stack.size() < n || n < 1 ? null : stack.get(stack.size() - n);
    }

    public int size() {
        return stack.size();
    }

    public Map<String, Object> env() {
        return env;
    }

    /**
     * Takes the last node collected by the top item, e.g. the base of a script.
     */
    public MmlNode prev() {
        return prev(false);
    }

    public MmlNode prev(boolean noPop) {
        StackItem top = top();
        if (top == null) {
            return null;
        }
        if (noPop) {
            var data = top.data();
            return data.isEmpty() ? null : data.get(data.size() - 1);
        }
        return top.pop();
    }

    /**
     * Pushes the stop marker and returns the single tree the stack reduces to.
     */
    public MmlNode finish() {
        push(ctx.factory().create(ItemKind.STOP));
        StackItem top = top();
        if (stack.size() != 1 || !top.isFinal()) {
            throw new IllegalStateException("Parse stack did not reduce to a single tree: " + stack);
        }
        return top.toMml();
    }

    @Override
    public String toString() {
        return "stack" + stack;
    }
}
