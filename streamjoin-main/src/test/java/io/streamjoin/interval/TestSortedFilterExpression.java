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
import io.streamjoin.spi.plan.ColumnIndex;
import io.streamjoin.spi.plan.Field;
import io.streamjoin.spi.plan.JoinFilter;
import io.streamjoin.spi.plan.JoinSide;
import io.streamjoin.spi.plan.Ordering.SortItem;
import io.streamjoin.spi.relation.RowExpression;
import org.testng.annotations.Test;

import java.util.Optional;

import static com.facebook.presto.common.block.SortOrder.ASC_NULLS_LAST;
import static com.facebook.presto.common.block.SortOrder.DESC_NULLS_FIRST;
import static com.facebook.presto.common.type.BigintType.BIGINT;
import static io.streamjoin.spi.plan.JoinSide.LEFT;
import static io.streamjoin.spi.plan.JoinSide.RIGHT;
import static io.streamjoin.spi.relation.Expressions.add;
import static io.streamjoin.spi.relation.Expressions.and;
import static io.streamjoin.spi.relation.Expressions.constant;
import static io.streamjoin.spi.relation.Expressions.field;
import static io.streamjoin.spi.relation.Expressions.greaterThan;
import static io.streamjoin.spi.relation.Expressions.lessThan;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestSortedFilterExpression
{
    // filter fields: 0 = left channel 2, 1 = right channel 0, 2 = left channel 3
    private static final JoinFilter FILTER = new JoinFilter(
            and(
                    greaterThan(add(field(0, BIGINT), field(2, BIGINT)), field(1, BIGINT)),
                    lessThan(field(0, BIGINT), add(field(1, BIGINT), constant(5L, BIGINT)))),
            ImmutableList.of(new Field("a", BIGINT), new Field("b", BIGINT), new Field("c", BIGINT)),
            ImmutableList.of(new ColumnIndex(2, LEFT), new ColumnIndex(0, RIGHT), new ColumnIndex(3, LEFT)));
    private static final ExpressionIntervalGraph GRAPH = new ExpressionIntervalGraph(FILTER.getExpression());

    @Test
    public void testColumnSortKey()
    {
        SortedFilterExpression sorted = find(LEFT, field(2, BIGINT)).get();
        assertEquals(sorted.getSide(), LEFT);
        assertEquals(sorted.getOriginExpression(), field(2, BIGINT));
        assertEquals(sorted.getFilterExpression(), field(0, BIGINT));
        assertEquals(GRAPH.getExpression(sorted.getNode()), field(0, BIGINT));

        SortedFilterExpression right = find(RIGHT, field(0, BIGINT)).get();
        assertEquals(right.getFilterExpression(), field(1, BIGINT));
    }

    @Test
    public void testCompositeSortKey()
    {
        SortedFilterExpression sorted = find(LEFT, add(field(2, BIGINT), field(3, BIGINT))).get();
        assertEquals(sorted.getFilterExpression(), add(field(0, BIGINT), field(2, BIGINT)));
    }

    @Test
    public void testNoImage()
    {
        // channel 1 of the left input is not a filter input
        assertFalse(find(LEFT, field(1, BIGINT)).isPresent());
        // channel 2 of the right input belongs to the other side
        assertFalse(find(RIGHT, field(2, BIGINT)).isPresent());
        // all channels are inputs, but the expression does not occur in the filter
        assertFalse(find(LEFT, add(field(3, BIGINT), field(2, BIGINT))).isPresent());
    }

    @Test
    public void testObserve()
    {
        SortedFilterExpression ascending = find(LEFT, field(2, BIGINT)).get();
        assertEquals(ascending.observe(7), Interval.atLeast(7));

        SortedFilterExpression descending = SortedFilterExpression.find(LEFT, new SortItem(field(2, BIGINT), DESC_NULLS_FIRST), FILTER, GRAPH).get();
        assertEquals(descending.getSortOrder(), DESC_NULLS_FIRST);
        assertEquals(descending.observe(7), Interval.atMost(7));
        assertTrue(descending.getInterval(GRAPH.createIntervals()).isUnbounded());
    }

    private static Optional<SortedFilterExpression> find(JoinSide side, RowExpression sortExpression)
    {
        return SortedFilterExpression.find(side, new SortItem(sortExpression, ASC_NULLS_LAST), FILTER, GRAPH);
    }
}
