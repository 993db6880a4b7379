/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.streamjoin.interval;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.streamjoin.spi.relation.CallExpression;
import io.streamjoin.spi.relation.ConstantExpression;
import io.streamjoin.spi.relation.InputReferenceExpression;
import io.streamjoin.spi.relation.OperatorType;
import io.streamjoin.spi.relation.RowExpression;
import io.streamjoin.spi.relation.SpecialFormExpression;

import javax.annotation.concurrent.Immutable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Interval propagation over a filter expression.
 * <p>
 * The graph mirrors the expression tree, with structurally equal sub-expressions
 * sharing a single node. Nodes are identified by stable integer handles, assigned in
 * post-order (children before parents), and the traversal order never changes after
 * construction. The graph itself holds no intervals: every user allocates a
 * {@link NodeIntervals} and passes it to {@link #updateIntervals}.
 * <p>
 * An update runs two passes. The bottom-up pass computes the interval of every node
 * from its children (interval arithmetic for arithmetic nodes, boolean intervals for
 * predicates) and intersects observed nodes with their observation. The top-down pass
 * then assumes the filter is true and narrows the operands of every node that must be
 * true (conjunctions and comparisons), and the operands of arithmetic nodes by the
 * inverse operation. Both passes only intersect, so a pass never widens an interval
 * it computed.
 */
@Immutable
public final class ExpressionIntervalGraph
{
    private enum Kind
    {
        INPUT,
        CONSTANT,
        ARITHMETIC,
        COMPARISON,
        AND,
        OR,
        NOT,
        OPAQUE,
    }

    private final List<Node> nodes;
    private final Map<RowExpression, Integer> handles;
    private final int root;

    public ExpressionIntervalGraph(RowExpression expression)
    {
        requireNonNull(expression, "expression is null");
        List<Node> nodes = new ArrayList<>();
        Map<RowExpression, Integer> handles = new HashMap<>();
        this.root = addNode(expression, nodes, handles);
        this.nodes = ImmutableList.copyOf(nodes);
        this.handles = ImmutableMap.copyOf(handles);
    }

    private static int addNode(RowExpression expression, List<Node> nodes, Map<RowExpression, Integer> handles)
    {
        Integer existing = handles.get(expression);
        if (existing != null) {
            return existing;
        }
        List<RowExpression> children = expression.getChildren();
        int[] childHandles = new int[children.size()];
        for (int i = 0; i < children.size(); i++) {
            childHandles[i] = addNode(children.get(i), nodes, handles);
        }
        int handle = nodes.size();
        nodes.add(new Node(expression, kindOf(expression), childHandles, constantInterval(expression)));
        handles.put(expression, handle);
        return handle;
    }

    private static Kind kindOf(RowExpression expression)
    {
        if (expression instanceof InputReferenceExpression) {
            return Kind.INPUT;
        }
        if (expression instanceof ConstantExpression) {
            return Kind.CONSTANT;
        }
        if (expression instanceof CallExpression) {
            return ((CallExpression) expression).getOperator().isComparisonOperator() ? Kind.COMPARISON : Kind.ARITHMETIC;
        }
        if (expression instanceof SpecialFormExpression) {
            switch (((SpecialFormExpression) expression).getForm()) {
                case AND:
                    return Kind.AND;
                case OR:
                    return Kind.OR;
                case NOT:
                    return Kind.NOT;
            }
        }
        return Kind.OPAQUE;
    }

    private static Interval constantInterval(RowExpression expression)
    {
        if (!(expression instanceof ConstantExpression)) {
            return Interval.unbounded();
        }
        Object value = ((ConstantExpression) expression).getValue();
        if (value instanceof Long) {
            return Interval.point((Long) value);
        }
        if (value instanceof Boolean) {
            return Interval.of((Boolean) value);
        }
        // nulls and values outside the long domain carry no bound
        return Interval.unbounded();
    }

    public int getNodeCount()
    {
        return nodes.size();
    }

    public int getRoot()
    {
        return root;
    }

    public RowExpression getExpression(int node)
    {
        return nodes.get(node).getExpression();
    }

    /**
     * Returns the handle of the node for {@code expression}, if the filter contains it.
     */
    public OptionalInt getNode(RowExpression expression)
    {
        Integer handle = handles.get(expression);
        return handle == null ? OptionalInt.empty() : OptionalInt.of(handle);
    }

    /**
     * Can the root be constrained to be true?
     */
    public boolean isPredicate()
    {
        Kind kind = nodes.get(root).getKind();
        return kind == Kind.COMPARISON || kind == Kind.AND || kind == Kind.OR || kind == Kind.NOT;
    }

    public NodeIntervals createIntervals()
    {
        return new NodeIntervals(nodes.size());
    }

    /**
     * Recomputes every interval from scratch, given the observed range of some nodes.
     * The result only depends on {@code observations}, so repeating an update with the
     * same observations yields the same intervals.
     */
    public PropagationResult updateIntervals(NodeIntervals intervals, Map<Integer, Interval> observations)
    {
        requireNonNull(intervals, "intervals is null");
        requireNonNull(observations, "observations is null");
        checkArgument(intervals.size() == nodes.size(), "intervals do not belong to this graph");

        for (int handle = 0; handle < nodes.size(); handle++) {
            Interval interval = evaluate(nodes.get(handle), intervals);
            Interval observed = observations.get(handle);
            if (observed != null) {
                Optional<Interval> narrowed = interval.intersect(observed);
                if (!narrowed.isPresent()) {
                    return PropagationResult.INFEASIBLE;
                }
                interval = narrowed.get();
            }
            intervals.set(handle, interval);
        }

        if (!isPredicate()) {
            return PropagationResult.CANNOT_PROPAGATE;
        }
        if (!narrow(root, Interval.TRUE, intervals)) {
            return PropagationResult.INFEASIBLE;
        }

        // parents come after their children in post-order, so walking backwards
        // applies every constraint on a node before it is pushed further down
        for (int handle = nodes.size() - 1; handle >= 0; handle--) {
            if (!narrowChildren(nodes.get(handle), intervals.get(handle), intervals)) {
                return PropagationResult.INFEASIBLE;
            }
        }
        return PropagationResult.SUCCESS;
    }

    private static Interval evaluate(Node node, NodeIntervals intervals)
    {
        int[] children = node.getChildren();
        switch (node.getKind()) {
            case INPUT:
            case OPAQUE:
                return Interval.unbounded();
            case CONSTANT:
                return node.getConstant();
            case ARITHMETIC:
                switch (node.getOperator()) {
                    case ADD:
                        return intervals.get(children[0]).add(intervals.get(children[1]));
                    case SUBTRACT:
                        return intervals.get(children[0]).subtract(intervals.get(children[1]));
                    case NEGATION:
                        return intervals.get(children[0]).negate();
                    default:
                        return Interval.unbounded();
                }
            case COMPARISON:
                return intervals.get(children[0]).compare(node.getOperator(), intervals.get(children[1]));
            case AND: {
                Interval result = Interval.TRUE;
                for (int child : children) {
                    result = result.and(intervals.get(child));
                }
                return result;
            }
            case OR: {
                Interval result = Interval.FALSE;
                for (int child : children) {
                    result = result.or(intervals.get(child));
                }
                return result;
            }
            case NOT:
                return intervals.get(children[0]).not();
        }
        throw new IllegalStateException("Unknown node kind: " + node.getKind());
    }

    private static boolean narrowChildren(Node node, Interval interval, NodeIntervals intervals)
    {
        int[] children = node.getChildren();
        switch (node.getKind()) {
            case AND:
                if (interval.isCertainlyTrue()) {
                    for (int child : children) {
                        if (!narrow(child, Interval.TRUE, intervals)) {
                            return false;
                        }
                    }
                }
                return true;
            case COMPARISON:
                if (!interval.isCertainlyTrue()) {
                    return true;
                }
                return narrowComparison(node.getOperator(), children[0], children[1], intervals);
            case ARITHMETIC:
                return narrowArithmetic(node.getOperator(), interval, children, intervals);
            default:
                // OR, NOT and opaque nodes do not constrain their children
                return true;
        }
    }

    private static boolean narrowComparison(OperatorType operator, int left, int right, NodeIntervals intervals)
    {
        Interval leftInterval = intervals.get(left);
        Interval rightInterval = intervals.get(right);
        switch (operator) {
            case GREATER_THAN:
            case GREATER_THAN_OR_EQUAL:
                // strict comparisons are narrowed as non-strict ones, which keeps the bound a superset
                return narrowAtLeast(left, rightInterval, intervals) && narrowAtMost(right, leftInterval, intervals);
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL:
                return narrowAtMost(left, rightInterval, intervals) && narrowAtLeast(right, leftInterval, intervals);
            case EQUAL:
                return narrow(left, rightInterval, intervals) && narrow(right, leftInterval, intervals);
            default:
                return true;
        }
    }

    private static boolean narrowArithmetic(OperatorType operator, Interval result, int[] children, NodeIntervals intervals)
    {
        switch (operator) {
            case ADD: {
                Interval left = intervals.get(children[0]);
                Interval right = intervals.get(children[1]);
                return narrow(children[0], result.subtract(right), intervals) &&
                        narrow(children[1], result.subtract(left), intervals);
            }
            case SUBTRACT: {
                Interval left = intervals.get(children[0]);
                Interval right = intervals.get(children[1]);
                return narrow(children[0], result.add(right), intervals) &&
                        narrow(children[1], left.subtract(result), intervals);
            }
            case NEGATION:
                return narrow(children[0], result.negate(), intervals);
            default:
                return true;
        }
    }

    private static boolean narrowAtLeast(int node, Interval bound, NodeIntervals intervals)
    {
        if (!bound.hasLower()) {
            return true;
        }
        return narrow(node, Interval.atLeast(bound.getLower()), intervals);
    }

    private static boolean narrowAtMost(int node, Interval bound, NodeIntervals intervals)
    {
        if (!bound.hasUpper()) {
            return true;
        }
        return narrow(node, Interval.atMost(bound.getUpper()), intervals);
    }

    private static boolean narrow(int node, Interval constraint, NodeIntervals intervals)
    {
        Optional<Interval> narrowed = intervals.get(node).intersect(constraint);
        if (!narrowed.isPresent()) {
            return false;
        }
        intervals.set(node, narrowed.get());
        return true;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("root", nodes.get(root).getExpression())
                .add("nodeCount", nodes.size())
                .toString();
    }

    @Immutable
    private static final class Node
    {
        private final RowExpression expression;
        private final Kind kind;
        private final int[] children;
        private final Interval constant;

        private Node(RowExpression expression, Kind kind, int[] children, Interval constant)
        {
            this.expression = requireNonNull(expression, "expression is null");
            this.kind = requireNonNull(kind, "kind is null");
            this.children = requireNonNull(children, "children is null");
            this.constant = requireNonNull(constant, "constant is null");
        }

        public RowExpression getExpression()
        {
            return expression;
        }

        public Kind getKind()
        {
            return kind;
        }

        public OperatorType getOperator()
        {
            return ((CallExpression) expression).getOperator();
        }

        public int[] getChildren()
        {
            return children;
        }

        public Interval getConstant()
        {
            return constant;
        }
    }
}
