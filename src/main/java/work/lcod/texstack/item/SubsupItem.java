package work.lcod.texstack.item;

import work.lcod.texstack.error.TexErrorKind;
import work.lcod.texstack.runtime.ParseContext;
import work.lcod.texstack.tree.MmlNode;
import work.lcod.texstack.tree.Nodes;

/**
 * Pending sub- or superscript. Holds the script node (base already in place) and fills one slot with the next
 * finished node.
 */
public class SubsupItem extends StackItem {
    private ScriptPosition position = ScriptPosition.SUB;
    private MmlNode primes;
    private Boolean movesupsub;

    public SubsupItem(MmlNode... nodes) {
        super(ItemKind.SUBSUP, nodes);
        MmlNode base = first();
        if (base == null || !(base.isKind("msubsup") || base.isKind("munderover"))) {
            clearData();
            push(Nodes.create("msubsup", base, null, null));
        }
    }

    public ScriptPosition position() {
        return position;
    }

    public SubsupItem setPosition(ScriptPosition position) {
        this.position = position;
        return this;
    }

    public MmlNode primes() {
        return primes;
    }

    public SubsupItem setPrimes(MmlNode primes) {
        this.primes = primes;
        return this;
    }

    public SubsupItem setMovesupsub(Boolean movesupsub) {
        this.movesupsub = movesupsub;
        return this;
    }

    @Override
    public CheckResult checkItem(ParseContext ctx, StackItem item) {
        if (item.isKind(ItemKind.OPEN) || item.isKind(ItemKind.LEFT)) {
            return CheckResult.push();
        }
        MmlNode script = first();
        if (item.isKind(ItemKind.MML)) {
            MmlNode value = item.first();
            if (primes != null) {
                if (position != ScriptPosition.SUP) {
                    script.setChild(MmlNode.SUP, primes);
                } else {
                    primes.setProperty("variantForm", true);
                    value = Nodes.create("mrow", primes, value);
                }
            }
            script.setChild(position.slot(), value);
            if (movesupsub != null) {
                script.setProperty("movesupsub", movesupsub);
            }
            return CheckResult.replace(ctx.factory().mml(script));
        }
        if (item.isKind(ItemKind.STOP)) {
            throw TexErrorKind.MISSING_SCRIPT.error();
        }
        throw position.missingOpen().error();
    }
}
