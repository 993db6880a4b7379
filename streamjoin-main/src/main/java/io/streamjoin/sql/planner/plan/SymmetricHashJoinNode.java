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
package io.streamjoin.sql.planner.plan;

import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;
import io.streamjoin.execution.SymmetricJoinConfig;
import io.streamjoin.interval.ExpressionIntervalGraph;
import io.streamjoin.interval.SortedFilterExpression;
import io.streamjoin.operator.InterpretedJoinFilterFunction;
import io.streamjoin.operator.join.SymmetricHashJoinStream;
import io.streamjoin.spi.PageStream;
import io.streamjoin.spi.StreamJoinException;
import io.streamjoin.spi.plan.ColumnIndex;
import io.streamjoin.spi.plan.Distribution;
import io.streamjoin.spi.plan.EquiJoinClause;
import io.streamjoin.spi.plan.Field;
import io.streamjoin.spi.plan.JoinFilter;
import io.streamjoin.spi.plan.JoinSide;
import io.streamjoin.spi.plan.JoinType;
import io.streamjoin.spi.plan.Ordering;
import io.streamjoin.spi.plan.Partitioning;
import io.streamjoin.spi.plan.PlanNode;
import io.streamjoin.spi.plan.PlanNodeId;
import io.streamjoin.spi.relation.InputReferenceExpression;
import io.streamjoin.spi.relation.RowExpression;

import javax.annotation.concurrent.Immutable;

import java.util.List;
import java.util.Optional;

import static com.facebook.presto.common.type.BooleanType.BOOLEAN;
import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.streamjoin.spi.StandardErrorCode.INVALID_JOIN_CRITERIA;
import static io.streamjoin.spi.StandardErrorCode.INVALID_JOIN_FILTER;
import static io.streamjoin.spi.StandardErrorCode.INVALID_PLAN;
import static io.streamjoin.spi.StandardErrorCode.MISSING_INPUT_ORDERING;
import static io.streamjoin.spi.StandardErrorCode.NOT_SUPPORTED;
import static io.streamjoin.spi.StandardErrorCode.TYPE_MISMATCH;
import static io.streamjoin.spi.plan.JoinSide.LEFT;
import static io.streamjoin.spi.plan.JoinSide.RIGHT;
import static io.streamjoin.spi.relation.Expressions.inputReferences;
import static io.streamjoin.spi.relation.Expressions.subExpressions;
import static io.streamjoin.sql.relational.RowExpressionInterpreter.isLongType;
import static io.streamjoin.sql.relational.RowExpressionInterpreter.isSupportedType;
import static java.lang.String.format;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * Equi-join of two inputs that are each ordered by an expression the join filter
 * constrains, such as {@code l.k = r.k AND l.t BETWEEN r.t - 5 AND r.t + 5} over inputs
 * ordered by {@code l.t} and {@code r.t}. The ordering lets every partition drop the
 * buffered rows that can no longer match, so memory does not grow with the inputs.
 * <p>
 * The interval graph of the filter and the sorted filter expressions of both inputs are
 * built once here and shared, read-only, by the streams of all partitions.
 */
@Immutable
public final class SymmetricHashJoinNode
        extends PlanNode
{
    private final PlanNode left;
    private final PlanNode right;
    private final List<EquiJoinClause> criteria;
    private final JoinFilter filter;
    private final JoinType type;
    private final boolean nullEqualsNull;
    private final SymmetricJoinConfig config;

    private final List<Field> outputFields;
    private final ExpressionIntervalGraph graph;
    private final SortedFilterExpression leftSortedExpression;
    private final SortedFilterExpression rightSortedExpression;

    public SymmetricHashJoinNode(
            PlanNodeId id,
            PlanNode left,
            PlanNode right,
            List<EquiJoinClause> criteria,
            JoinFilter filter,
            JoinType type,
            boolean nullEqualsNull)
    {
        this(id, left, right, criteria, filter, type, nullEqualsNull, new SymmetricJoinConfig());
    }

    public SymmetricHashJoinNode(
            PlanNodeId id,
            PlanNode left,
            PlanNode right,
            List<EquiJoinClause> criteria,
            JoinFilter filter,
            JoinType type,
            boolean nullEqualsNull,
            SymmetricJoinConfig config)
    {
        super(id);
        this.left = requireNonNull(left, "left is null");
        this.right = requireNonNull(right, "right is null");
        this.criteria = ImmutableList.copyOf(requireNonNull(criteria, "criteria is null"));
        this.filter = requireNonNull(filter, "filter is null");
        this.type = requireNonNull(type, "type is null");
        this.nullEqualsNull = nullEqualsNull;
        this.config = requireNonNull(config, "config is null");

        validateCriteria();
        Ordering leftOrdering = getInputOrdering(left, LEFT);
        Ordering rightOrdering = getInputOrdering(right, RIGHT);
        validateFilter();
        validateSortExpression(leftOrdering, LEFT);
        validateSortExpression(rightOrdering, RIGHT);
        if (left.getPartitionCount() != right.getPartitionCount()) {
            throw new StreamJoinException(INVALID_PLAN, format(
                    "Join inputs have different partition counts: %s and %s",
                    left.getPartitionCount(),
                    right.getPartitionCount()));
        }

        this.graph = new ExpressionIntervalGraph(filter.getExpression());
        this.leftSortedExpression = findSortedExpression(LEFT, leftOrdering);
        this.rightSortedExpression = findSortedExpression(RIGHT, rightOrdering);
        this.outputFields = buildOutputFields();
    }

    private void validateCriteria()
    {
        if (criteria.isEmpty()) {
            throw new StreamJoinException(INVALID_JOIN_CRITERIA, "Join requires at least one equality clause");
        }
        for (EquiJoinClause clause : criteria) {
            checkChannel(left, clause.getLeftChannel(), LEFT);
            checkChannel(right, clause.getRightChannel(), RIGHT);
            Type leftType = left.getOutputFields().get(clause.getLeftChannel()).getType();
            Type rightType = right.getOutputFields().get(clause.getRightChannel()).getType();
            if (!leftType.equals(rightType)) {
                throw new StreamJoinException(TYPE_MISMATCH, format(
                        "Join clause %s compares %s with %s",
                        clause,
                        leftType.getDisplayName(),
                        rightType.getDisplayName()));
            }
        }
    }

    private static void checkChannel(PlanNode source, int channel, JoinSide side)
    {
        if (channel < 0 || channel >= source.getOutputFields().size()) {
            throw new StreamJoinException(INVALID_JOIN_CRITERIA, format(
                    "Channel %s does not exist on the %s side of the join",
                    channel,
                    sideName(side)));
        }
    }

    private static Ordering getInputOrdering(PlanNode source, JoinSide side)
    {
        Optional<Ordering> ordering = source.getOutputOrdering();
        if (!ordering.isPresent()) {
            throw new StreamJoinException(MISSING_INPUT_ORDERING, format("The %s side of the join is not ordered", sideName(side)));
        }
        return ordering.get();
    }

    private void validateFilter()
    {
        List<Field> intermediateFields = filter.getIntermediateFields();
        List<ColumnIndex> columnIndices = filter.getColumnIndices();
        if (intermediateFields.size() != columnIndices.size()) {
            throw new StreamJoinException(INVALID_JOIN_FILTER, format(
                    "Join filter has %s fields but %s column indices",
                    intermediateFields.size(),
                    columnIndices.size()));
        }
        if (!filter.getExpression().getType().equals(BOOLEAN)) {
            throw new StreamJoinException(INVALID_JOIN_FILTER, "Join filter is not a boolean expression: " + filter.getExpression());
        }

        for (InputReferenceExpression reference : inputReferences(filter.getExpression())) {
            int field = reference.getField();
            if (field < 0 || field >= intermediateFields.size()) {
                throw new StreamJoinException(INVALID_JOIN_FILTER, format("Join filter references field %s, which does not exist", field));
            }
            if (!intermediateFields.get(field).getType().equals(reference.getType())) {
                throw new StreamJoinException(INVALID_JOIN_FILTER, format(
                        "Join filter reads field %s as %s, but it is %s",
                        field,
                        reference.getType().getDisplayName(),
                        intermediateFields.get(field).getType().getDisplayName()));
            }
        }

        for (int field = 0; field < columnIndices.size(); field++) {
            ColumnIndex columnIndex = columnIndices.get(field);
            PlanNode source = columnIndex.getSide() == LEFT ? left : right;
            List<Field> sourceFields = source.getOutputFields();
            if (columnIndex.getChannel() < 0 || columnIndex.getChannel() >= sourceFields.size()) {
                throw new StreamJoinException(INVALID_JOIN_FILTER, format(
                        "Join filter field %s maps to channel %s, which does not exist on the %s side",
                        field,
                        columnIndex.getChannel(),
                        sideName(columnIndex.getSide())));
            }
            Type sourceType = sourceFields.get(columnIndex.getChannel()).getType();
            if (!sourceType.equals(intermediateFields.get(field).getType())) {
                throw new StreamJoinException(INVALID_JOIN_FILTER, format(
                        "Join filter field %s is %s, but channel %s on the %s side is %s",
                        field,
                        intermediateFields.get(field).getType().getDisplayName(),
                        columnIndex.getChannel(),
                        sideName(columnIndex.getSide()),
                        sourceType.getDisplayName()));
            }
        }

        for (RowExpression expression : subExpressions(filter.getExpression())) {
            if (!isSupportedType(expression.getType())) {
                throw new StreamJoinException(NOT_SUPPORTED, format(
                        "Join filter expression %s has unsupported type %s",
                        expression,
                        expression.getType().getDisplayName()));
            }
        }
    }

    private void validateSortExpression(Ordering ordering, JoinSide side)
    {
        PlanNode source = side == LEFT ? left : right;
        RowExpression expression = ordering.getLeadingItem().getExpression();
        if (!isLongType(expression.getType())) {
            throw new StreamJoinException(NOT_SUPPORTED, format(
                    "The %s side of the join is ordered by %s of unsupported type %s",
                    sideName(side),
                    expression,
                    expression.getType().getDisplayName()));
        }
        for (InputReferenceExpression reference : inputReferences(expression)) {
            if (reference.getField() >= source.getOutputFields().size()) {
                throw new StreamJoinException(INVALID_PLAN, format(
                        "The %s side of the join is ordered by channel %s, which it does not have",
                        sideName(side),
                        reference.getField()));
            }
        }
    }

    private SortedFilterExpression findSortedExpression(JoinSide side, Ordering ordering)
    {
        return SortedFilterExpression.find(side, ordering.getLeadingItem(), filter, graph)
                .orElseThrow(() -> new StreamJoinException(MISSING_INPUT_ORDERING, format(
                        "The %s side of the join does not have an expression sorted",
                        sideName(side))));
    }

    private List<Field> buildOutputFields()
    {
        ImmutableList.Builder<Field> fields = ImmutableList.builder();
        for (JoinSide side : JoinSide.values()) {
            if (!type.outputsSide(side)) {
                continue;
            }
            PlanNode source = side == LEFT ? left : right;
            boolean nullPadded = type.isNullPadded(side);
            for (Field field : source.getOutputFields()) {
                fields.add(nullPadded ? field.withNullable(true) : field);
            }
        }
        return fields.build();
    }

    private static String sideName(JoinSide side)
    {
        return side.name().toLowerCase(ENGLISH);
    }

    public PlanNode getLeft()
    {
        return left;
    }

    public PlanNode getRight()
    {
        return right;
    }

    public List<EquiJoinClause> getCriteria()
    {
        return criteria;
    }

    public JoinFilter getFilter()
    {
        return filter;
    }

    public JoinType getType()
    {
        return type;
    }

    public boolean isNullEqualsNull()
    {
        return nullEqualsNull;
    }

    public ExpressionIntervalGraph getGraph()
    {
        return graph;
    }

    public SortedFilterExpression getSortedExpression(JoinSide side)
    {
        return side == LEFT ? leftSortedExpression : rightSortedExpression;
    }

    @Override
    public List<PlanNode> getSources()
    {
        return ImmutableList.of(left, right);
    }

    @Override
    public List<Field> getOutputFields()
    {
        return outputFields;
    }

    /**
     * Output rows follow the arrival of input pages, which interleaves both inputs.
     */
    @Override
    public Optional<Ordering> getOutputOrdering()
    {
        return Optional.empty();
    }

    @Override
    public Partitioning getOutputPartitioning()
    {
        switch (type) {
            case INNER:
            case LEFT:
            case LEFT_SEMI:
            case LEFT_ANTI:
                return left.getOutputPartitioning();
            case RIGHT: {
                Partitioning partitioning = right.getOutputPartitioning();
                if (partitioning.getKind() == Partitioning.Kind.HASH) {
                    return partitioning.shiftChannels(left.getOutputFields().size());
                }
                return partitioning;
            }
            case RIGHT_SEMI:
            case RIGHT_ANTI:
                return right.getOutputPartitioning();
            case FULL:
                return Partitioning.unknown(right.getPartitionCount());
            default:
                throw new IllegalStateException("Unknown join type: " + type);
        }
    }

    @Override
    public int getPartitionCount()
    {
        return left.getPartitionCount();
    }

    /**
     * The distribution each input must have: a single partition, or hash partitioned
     * on its equality channels so that matching rows meet in the same partition.
     */
    public List<Distribution> getRequiredInputDistributions()
    {
        return ImmutableList.of(requiredDistribution(left, LEFT), requiredDistribution(right, RIGHT));
    }

    private Distribution requiredDistribution(PlanNode source, JoinSide side)
    {
        if (source.getPartitionCount() == 1) {
            return Distribution.singlePartition();
        }
        return Distribution.hashPartitioned(criteria.stream()
                .map(clause -> clause.getChannel(side))
                .collect(toImmutableList()));
    }

    @Override
    public PageStream execute(int partition)
    {
        checkArgument(partition >= 0 && partition < getPartitionCount(), "partition %s does not exist, node has %s partitions", partition, getPartitionCount());
        List<Type> leftTypes = types(left);
        List<Type> rightTypes = types(right);
        PageStream leftInput = left.execute(partition);
        PageStream rightInput;
        try {
            rightInput = right.execute(partition);
        }
        catch (RuntimeException e) {
            leftInput.close();
            throw e;
        }
        return new SymmetricHashJoinStream(
                leftInput,
                rightInput,
                type,
                leftTypes,
                rightTypes,
                criteria.stream().map(EquiJoinClause::getLeftChannel).collect(toImmutableList()),
                criteria.stream().map(EquiJoinClause::getRightChannel).collect(toImmutableList()),
                nullEqualsNull,
                new InterpretedJoinFilterFunction(filter),
                graph,
                leftSortedExpression,
                rightSortedExpression,
                config);
    }

    private static List<Type> types(PlanNode node)
    {
        return node.getOutputFields().stream()
                .map(Field::getType)
                .collect(toImmutableList());
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("id", getId())
                .add("type", type)
                .add("criteria", criteria)
                .add("filter", filter)
                .add("nullEqualsNull", nullEqualsNull)
                .toString();
    }
}
