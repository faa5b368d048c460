package work.lcod.texstack.item;

import java.util.Arrays;
import java.util.List;

/**
 * Decision returned by {@link StackItem#checkItem}: push the incoming item, drop it, or replace the top item.
 */
public final class CheckResult {
    private static final CheckResult PUSH = new CheckResult(Outcome.PUSH, List.of());
    private static final CheckResult DISCARD = new CheckResult(Outcome.DISCARD, List.of());

    private final Outcome outcome;
    private final List<StackItem> items;

    private CheckResult(Outcome outcome, List<StackItem> items) {
        this.outcome = outcome;
        this.items = items;
    }

    public static CheckResult push() {
        return PUSH;
    }

    public static CheckResult discard() {
        return DISCARD;
    }

    public static CheckResult replace(StackItem... items) {
        return replace(Arrays.asList(items));
    }

    /**
     * The top item is popped and {@code items} are pushed in order, each going through reduction again.
     */
    public static CheckResult replace(List<StackItem> items) {
        return new CheckResult(Outcome.REPLACE, List.copyOf(items));
    }

    public Outcome outcome() {
        return outcome;
    }

    public List<StackItem> items() {
        return items;
    }

    @Override
    public String toString() {
        return outcome == Outcome.REPLACE ? "replace" + items : outcome.name().toLowerCase();
    }

    public enum Outcome {
        PUSH,
        DISCARD,
        REPLACE
    }
}
