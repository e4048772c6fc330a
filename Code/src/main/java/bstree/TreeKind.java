package bstree;

/**
 * The two balancing strategies a tree can be built with.
 */
public enum TreeKind {
    /** Plain binary search order; equal keys become extra nodes in the left subtree. */
    UNBALANCED {
        @Override
        public <K extends Comparable<? super K>, V> AbstractBinaryTree<K, V, ?> newTree(boolean allowDuplicateKeys) {
            return new BSTree<>(allowDuplicateKeys);
        }

        @Override
        public <K extends Comparable<? super K>> AbstractBinaryTree<K, Void, ?> newKeyTree(boolean allowDuplicateKeys) {
            return BSTree.keysOnly(allowDuplicateKeys);
        }
    },

    /** AVL order; equal keys are folded into the duplicate list of one node. */
    BALANCED {
        @Override
        public <K extends Comparable<? super K>, V> AbstractBinaryTree<K, V, ?> newTree(boolean allowDuplicateKeys) {
            return new AVLTree<>(allowDuplicateKeys);
        }

        @Override
        public <K extends Comparable<? super K>> AbstractBinaryTree<K, Void, ?> newKeyTree(boolean allowDuplicateKeys) {
            return AVLTree.keysOnly(allowDuplicateKeys);
        }
    };

    /** Empty key/value tree of this kind. */
    public abstract <K extends Comparable<? super K>, V> AbstractBinaryTree<K, V, ?> newTree(boolean allowDuplicateKeys);

    /** Empty key-only tree of this kind. */
    public abstract <K extends Comparable<? super K>> AbstractBinaryTree<K, Void, ?> newKeyTree(boolean allowDuplicateKeys);

    public boolean isBalanced() {
        return this == BALANCED;
    }
}
