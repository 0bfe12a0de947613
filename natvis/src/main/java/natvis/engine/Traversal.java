package natvis.engine;

import java.util.ArrayDeque;
import java.util.List;

import natvis.IVariable;
import natvis.view.SimpleWrapper;

/**
 * Iterative walks over pointer linked structures in the debuggee. Both are bounded by a caller supplied
 * element count, since a corrupt structure can't be trusted to terminate on its own.
 */
class Traversal {
    private static class Node {
        enum ScanState {
            LEFT, VALUE, RIGHT
        }
        ScanState state = ScanState.LEFT;
        final IVariable content;

        Node(IVariable content) {
            this.content = content;
        }
    }

    /**
     * In-order walk with an explicit stack. Each stack entry goes LEFT (push left child) -> VALUE (emit) -> RIGHT (pop, push right child).
     *
     * There's no visited set: a cycle through left links never reaches a VALUE state and so never hits the `size` bound.
     */
    static void walkTree(IVariable root, NodeStep goLeft, NodeStep goRight, NodeStep getValue, List<IVariable> content, int size) {
        int i = 0;
        final var nodes = new ArrayDeque<Node>();
        nodes.push(new Node(root));
        while (!nodes.isEmpty() && i < size) {
            final var top = nodes.peek();
            switch (top.state) {
                case LEFT: {
                    top.state = Node.ScanState.VALUE;
                    final var leftVal = goLeft.maybeNull_apply(top.content);
                    if (leftVal != null && Numbers.parseAddr(leftVal.getValue()) != 0) {
                        nodes.push(new Node(leftVal));
                    }
                    break;
                }
                case VALUE: {
                    top.state = Node.ScanState.RIGHT;
                    final var value = getValue.maybeNull_apply(top.content);
                    if (value != null) {
                        content.add(new SimpleWrapper("[" + i + "]", value));
                        i++;
                    }
                    break;
                }
                case RIGHT: {
                    final var n = nodes.pop();
                    final var rightVal = goRight.maybeNull_apply(n.content);
                    if (rightVal != null && Numbers.parseAddr(rightVal.getValue()) != 0) {
                        nodes.push(new Node(rightVal));
                    }
                    break;
                }
            }
        }
    }

    /**
     * Follows `goNext` from `root` until `size` values are emitted, a null pointer is reached,
     * or the next node is `root` again. A cycle that rejoins somewhere other than the root only stops at `size`.
     *
     * @param noValueInRoot the root is a sentinel; don't emit its value
     */
    static void walkList(IVariable root, NodeStep goNext, NodeStep getValue, List<IVariable> content, int size, boolean noValueInRoot) {
        int i = 0;
        IVariable node = root;
        final long rootAddr = Numbers.parseAddr(node.getValue());
        long nextAddr = rootAddr;
        while (node != null && nextAddr != 0 && i < size) {
            if (!noValueInRoot || nextAddr != rootAddr) {
                final var value = getValue.maybeNull_apply(node);
                if (value != null) {
                    content.add(new SimpleWrapper("[" + i + "]", value));
                    i++;
                }
            }
            if (i < size) {
                node = goNext.maybeNull_apply(node);
                if (node == null) {
                    break;
                }
            }
            nextAddr = Numbers.parseAddr(node.getValue());
            if (nextAddr == rootAddr) {
                // circular link back to the head
                break;
            }
        }
    }
}
