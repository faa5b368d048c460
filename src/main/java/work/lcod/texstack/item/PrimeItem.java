package work.lcod.texstack.item;

import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.Nodes;

/**
 * Prime marks waiting to be attached to their base as a superscript.
 *
 * <p>Created either with {@code (base, prime)} or with {@code (prime)} alone; a base-less prime takes the
 * superscript synthesized by the prime item below it as its base. An {@code msubsup} base only takes the prime in
 * its empty superscript slot; once that slot holds a prime, further primes nest in {@code msup}.
 */
public class PrimeItem extends StackItem {
    private final boolean hasBase;

    public PrimeItem(MmlNode... nodes) {
        super(ItemKind.PRIME, nodes);
        if (data().isEmpty()) {
            throw new IllegalArgumentException("prime item requires a prime node");
        }
        hasBase = data().size() > 1;
    }

    public boolean hasBase() {
        return hasBase;
    }

    public MmlNode base() {
        return hasBase ? dataAt(0) : null;
    }

    public MmlNode prime() {
        return hasBase ? dataAt(1) : dataAt(0);
    }

    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        MmlNode base = base() == null ? MmlNode.of("mi") : base();
        MmlNode combined;
        if (!base.isKind("msubsup") || base.child(MmlNode.SUP) != null) {
            combined = Nodes.create("msup", base, prime());
        } else {
            base.setChild(MmlNode.SUP, prime());
            combined = base;
        }
        if (item instanceof PrimeItem next && !next.hasBase()) {
            next.prime().setProperty("variantForm", true);
            return CheckResult.replace(ctx.factory().create(ItemKind.PRIME, combined, next.prime()));
        }
        return CheckResult.replace(ctx.factory().mml(combined), item);
    }
}
