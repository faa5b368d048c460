package work.lcod.texstack.item;

import work.lcod.texstack.tree.MmlNode;

/**
 * Builds a fresh stack item of one kind from its initial nodes.
 */
@FunctionalInterface
public interface ItemConstructor {
    StackItem create(MmlNode... nodes);
}
