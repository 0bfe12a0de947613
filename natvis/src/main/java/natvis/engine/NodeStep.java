package natvis.engine;

import java.util.Objects;

import natvis.IVariable;

/**
 * Moves from a tree/list node to a related value (left, right, next, or the node's payload).
 */
@FunctionalInterface
interface NodeStep {
    /**
     * @return the related value, or null if there is none
     */
    IVariable maybeNull_apply(IVariable node);

    static NodeStep identity() {
        return node -> node;
    }

    /**
     * Chooses, once per rule, how to follow pointer field `direction`: if the field has the node's own type
     * it is read directly; otherwise (e.g. a `_Node_base*` link in a `_Node<T>*` list) its value is cast back to the node's type.
     *
     * @return NodeStep | null if `node` has no such field
     */
    static NodeStep maybeNull_forField(String direction, IVariable node) {
        final var field = node.findChildByName(direction);
        if (field == null) {
            return null;
        }
        if (Objects.equals(field.getTypeName(), node.getTypeName())) {
            return v -> v.findChildByName(direction);
        }
        return v -> {
            if (Numbers.parseAddr(v.getValue()) == 0) {
                return null;
            }
            final var next = v.findChildByName(direction);
            if (next == null) {
                return null;
            }
            return next.evaluate("(" + v.getTypeName() + ")" + next.getValue(), "");
        };
    }
}
