package natvis.rules;

import java.util.Collections;
import java.util.List;

/**
 * One child of an `<Expand>` element. The set of kinds is closed; consumers dispatch through {@link Visitor},
 * so adding a kind means adding a visit method every consumer must implement.
 */
public abstract class ExpandRule {
    /**
     * null or blank means "always"
     */
    public final String maybeNull_condition;

    private ExpandRule(String maybeNull_condition) {
        this.maybeNull_condition = maybeNull_condition;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitItem(Item rule);
        R visitArrayItems(ArrayItems rule);
        R visitTreeItems(TreeItems rule);
        R visitLinkedListItems(LinkedListItems rule);
        R visitIndexListItems(IndexListItems rule);
        R visitExpandedItem(ExpandedItem rule);
    }

    /**
     * `<Item Name="[size]">_size</Item>`
     */
    public static final class Item extends ExpandRule {
        public final String maybeNull_name;
        public final String value;

        public Item(String maybeNull_name, String value, String maybeNull_condition) {
            super(maybeNull_condition);
            this.maybeNull_name = maybeNull_name;
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitItem(this);
        }
    }

    /**
     * `<ArrayItems><Size>_size</Size><ValuePointer>_data</ValuePointer></ArrayItems>`
     */
    public static final class ArrayItems extends ExpandRule {
        public final String size;
        /**
         * tried in order, the first one whose condition passes is used
         */
        public final List<ConditionalExpression> valuePointers;

        public ArrayItems(String size, List<ConditionalExpression> valuePointers, String maybeNull_condition) {
            super(maybeNull_condition);
            this.size = size;
            this.valuePointers = Collections.unmodifiableList(valuePointers);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArrayItems(this);
        }
    }

    /**
     * Any field other than the condition may be null; an incomplete rule is skipped during expansion.
     */
    public static final class TreeItems extends ExpandRule {
        public final String maybeNull_size;
        public final String maybeNull_headPointer;
        public final String maybeNull_leftPointer;
        public final String maybeNull_rightPointer;
        public final ConditionalExpression maybeNull_valueNode;

        public TreeItems(
            String maybeNull_size,
            String maybeNull_headPointer,
            String maybeNull_leftPointer,
            String maybeNull_rightPointer,
            ConditionalExpression maybeNull_valueNode,
            String maybeNull_condition
        ) {
            super(maybeNull_condition);
            this.maybeNull_size = maybeNull_size;
            this.maybeNull_headPointer = maybeNull_headPointer;
            this.maybeNull_leftPointer = maybeNull_leftPointer;
            this.maybeNull_rightPointer = maybeNull_rightPointer;
            this.maybeNull_valueNode = maybeNull_valueNode;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTreeItems(this);
        }
    }

    /**
     * Size is optional here: without one the walk goes until the next pointer is 0 or loops back to the head.
     */
    public static final class LinkedListItems extends ExpandRule {
        public final String maybeNull_size;
        public final String maybeNull_headPointer;
        public final String maybeNull_nextPointer;
        public final String maybeNull_valueNode;
        /**
         * the head is a sentinel whose value isn't shown
         */
        public final boolean noValueHeadPointer;

        public LinkedListItems(
            String maybeNull_size,
            String maybeNull_headPointer,
            String maybeNull_nextPointer,
            String maybeNull_valueNode,
            boolean noValueHeadPointer,
            String maybeNull_condition
        ) {
            super(maybeNull_condition);
            this.maybeNull_size = maybeNull_size;
            this.maybeNull_headPointer = maybeNull_headPointer;
            this.maybeNull_nextPointer = maybeNull_nextPointer;
            this.maybeNull_valueNode = maybeNull_valueNode;
            this.noValueHeadPointer = noValueHeadPointer;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLinkedListItems(this);
        }
    }

    /**
     * `<IndexListItems><Size>_M_index</Size><ValueNode>*(_M_array[$i])</ValueNode></IndexListItems>`
     */
    public static final class IndexListItems extends ExpandRule {
        public final List<ConditionalExpression> sizes;
        public final List<ConditionalExpression> valueNodes;

        public IndexListItems(List<ConditionalExpression> sizes, List<ConditionalExpression> valueNodes, String maybeNull_condition) {
            super(maybeNull_condition);
            this.sizes = Collections.unmodifiableList(sizes);
            this.valueNodes = Collections.unmodifiableList(valueNodes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndexListItems(this);
        }
    }

    /**
     * `<ExpandedItem>_Myptr</ExpandedItem>`: splices the children of another value in place.
     */
    public static final class ExpandedItem extends ExpandRule {
        public final String value;

        public ExpandedItem(String value, String maybeNull_condition) {
            super(maybeNull_condition);
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpandedItem(this);
        }
    }
}
