package work.lcod.texstack.tree;

/**
 * TeX spacing classes attached to tree nodes. The ordinal order matches TeX's class numbering.
 */
public enum TexClass {
    ORD,
    OP,
    BIN,
    REL,
    OPEN,
    CLOSE,
    PUNCT,
    INNER,
    VCENTER,
    NONE
}
