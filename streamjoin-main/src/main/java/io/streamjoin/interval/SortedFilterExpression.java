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

import com.facebook.presto.common.block.SortOrder;
import io.streamjoin.spi.plan.ColumnIndex;
import io.streamjoin.spi.plan.JoinFilter;
import io.streamjoin.spi.plan.JoinSide;
import io.streamjoin.spi.plan.Ordering.SortItem;
import io.streamjoin.spi.relation.InputReferenceExpression;
import io.streamjoin.spi.relation.RowExpression;

import javax.annotation.concurrent.Immutable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static com.google.common.base.MoreObjects.toStringHelper;
import static io.streamjoin.spi.relation.Expressions.field;
import static io.streamjoin.spi.relation.Expressions.inputReferences;
import static io.streamjoin.spi.relation.Expressions.rewriteInputReferences;
import static java.util.Objects.requireNonNull;

/**
 * A sub-expression of a join filter that is known to be sorted, because it is the
 * image of the leading sort expression of one join input.
 * <p>
 * The origin expression reads the input's own channels and is used to evaluate
 * buffered rows; the filter expression is the same expression over the filter's
 * intermediate schema and identifies the node of the interval graph that receives
 * observations and yields the pruning bound.
 */
@Immutable
public final class SortedFilterExpression
{
    private final JoinSide side;
    private final RowExpression originExpression;
    private final SortOrder sortOrder;
    private final RowExpression filterExpression;
    private final int node;

    public SortedFilterExpression(JoinSide side, RowExpression originExpression, SortOrder sortOrder, RowExpression filterExpression, int node)
    {
        this.side = requireNonNull(side, "side is null");
        this.originExpression = requireNonNull(originExpression, "originExpression is null");
        this.sortOrder = requireNonNull(sortOrder, "sortOrder is null");
        this.filterExpression = requireNonNull(filterExpression, "filterExpression is null");
        this.node = node;
    }

    /**
     * Finds the image of {@code sortItem}, the leading sort item of the {@code side}
     * input, inside the join filter. Every channel the sort expression reads must be
     * an input of the filter, and the rewritten expression must appear verbatim in the
     * filter; otherwise the sort order cannot be related to the filter and empty is returned.
     */
    public static Optional<SortedFilterExpression> find(JoinSide side, SortItem sortItem, JoinFilter filter, ExpressionIntervalGraph graph)
    {
        Map<Integer, Integer> channelToField = new HashMap<>();
        List<ColumnIndex> columnIndices = filter.getColumnIndices();
        for (int field = 0; field < columnIndices.size(); field++) {
            ColumnIndex columnIndex = columnIndices.get(field);
            if (columnIndex.getSide() == side) {
                channelToField.putIfAbsent(columnIndex.getChannel(), field);
            }
        }

        RowExpression origin = sortItem.getExpression();
        for (InputReferenceExpression reference : inputReferences(origin)) {
            if (!channelToField.containsKey(reference.getField())) {
                return Optional.empty();
            }
        }
        RowExpression converted = rewriteInputReferences(origin, reference -> field(channelToField.get(reference.getField()), reference.getType()));

        OptionalInt node = graph.getNode(converted);
        if (!node.isPresent()) {
            return Optional.empty();
        }
        return Optional.of(new SortedFilterExpression(side, origin, sortItem.getSortOrder(), converted, node.getAsInt()));
    }

    public JoinSide getSide()
    {
        return side;
    }

    public RowExpression getOriginExpression()
    {
        return originExpression;
    }

    public SortOrder getSortOrder()
    {
        return sortOrder;
    }

    public RowExpression getFilterExpression()
    {
        return filterExpression;
    }

    public int getNode()
    {
        return node;
    }

    /**
     * The range of every value at or after {@code value} in sort order.
     */
    public Interval observe(long value)
    {
        return sortOrder.isAscending() ? Interval.atLeast(value) : Interval.atMost(value);
    }

    public Interval getInterval(NodeIntervals intervals)
    {
        return intervals.get(node);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("side", side)
                .add("originExpression", originExpression)
                .add("sortOrder", sortOrder)
                .add("filterExpression", filterExpression)
                .add("node", node)
                .toString();
    }
}
