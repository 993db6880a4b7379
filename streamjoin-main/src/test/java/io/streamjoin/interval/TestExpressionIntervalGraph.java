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

import com.google.common.collect.ImmutableMap;
import io.streamjoin.spi.relation.RowExpression;
import org.testng.annotations.Test;

import java.util.Map;

import static com.facebook.presto.common.type.BigintType.BIGINT;
import static io.streamjoin.spi.relation.Expressions.add;
import static io.streamjoin.spi.relation.Expressions.and;
import static io.streamjoin.spi.relation.Expressions.between;
import static io.streamjoin.spi.relation.Expressions.constant;
import static io.streamjoin.spi.relation.Expressions.field;
import static io.streamjoin.spi.relation.Expressions.greaterThan;
import static io.streamjoin.spi.relation.Expressions.lessThan;
import static io.streamjoin.spi.relation.Expressions.or;
import static io.streamjoin.spi.relation.Expressions.subtract;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestExpressionIntervalGraph
{
    private static final RowExpression LEFT_TIME = field(0, BIGINT);
    private static final RowExpression RIGHT_TIME = field(1, BIGINT);

    // #0 BETWEEN #1 - 5 AND #1 + 5
    private static final RowExpression BAND_FILTER = between(
            LEFT_TIME,
            subtract(RIGHT_TIME, constant(5L, BIGINT)),
            add(RIGHT_TIME, constant(5L, BIGINT)));

    @Test
    public void testStructure()
    {
        ExpressionIntervalGraph graph = new ExpressionIntervalGraph(BAND_FILTER);
        // #0, #1, 5, #1 - 5, >=, #1 + 5, <=, AND
        assertEquals(graph.getNodeCount(), 8);
        assertEquals(graph.getExpression(graph.getRoot()), BAND_FILTER);
        assertTrue(graph.isPredicate());
        assertTrue(graph.getNode(field(0, BIGINT)).isPresent());
        assertTrue(graph.getNode(subtract(field(1, BIGINT), constant(5L, BIGINT))).isPresent());
        assertFalse(graph.getNode(field(2, BIGINT)).isPresent());
    }

    @Test
    public void testSharedSubExpressions()
    {
        RowExpression difference = subtract(LEFT_TIME, RIGHT_TIME);
        ExpressionIntervalGraph graph = new ExpressionIntervalGraph(and(
                greaterThan(difference, constant(0L, BIGINT)),
                lessThan(difference, constant(10L, BIGINT))));
        // #0, #1, #0 - #1, 0, >, 10, <, AND
        assertEquals(graph.getNodeCount(), 8);
    }

    @Test
    public void testBoundFromOtherSide()
    {
        ExpressionIntervalGraph graph = new ExpressionIntervalGraph(BAND_FILTER);
        int left = graph.getNode(LEFT_TIME).getAsInt();
        int right = graph.getNode(RIGHT_TIME).getAsInt();
        NodeIntervals intervals = graph.createIntervals();

        // left rows buffered from 100 on, right input reached 200
        Map<Integer, Interval> observations = ImmutableMap.of(left, Interval.atLeast(100), right, Interval.atLeast(200));
        assertEquals(graph.updateIntervals(intervals, observations), PropagationResult.SUCCESS);
        assertEquals(intervals.get(left), Interval.atLeast(195));
        assertEquals(intervals.get(right), Interval.atLeast(200));
        assertEquals(intervals.get(graph.getRoot()), Interval.TRUE);

        // the same observations give the same intervals
        NodeIntervals again = graph.createIntervals();
        assertEquals(graph.updateIntervals(again, observations), PropagationResult.SUCCESS);
        for (int node = 0; node < graph.getNodeCount(); node++) {
            assertEquals(again.get(node), intervals.get(node));
        }
        assertEquals(graph.updateIntervals(intervals, observations), PropagationResult.SUCCESS);
        assertEquals(intervals.get(left), Interval.atLeast(195));
    }

    @Test
    public void testBoundWithoutObservations()
    {
        ExpressionIntervalGraph graph = new ExpressionIntervalGraph(BAND_FILTER);
        NodeIntervals intervals = graph.createIntervals();
        assertEquals(graph.updateIntervals(intervals, ImmutableMap.of()), PropagationResult.SUCCESS);
        assertTrue(intervals.get(graph.getNode(LEFT_TIME).getAsInt()).isUnbounded());
    }

    @Test
    public void testDescendingBound()
    {
        ExpressionIntervalGraph graph = new ExpressionIntervalGraph(BAND_FILTER);
        int left = graph.getNode(LEFT_TIME).getAsInt();
        int right = graph.getNode(RIGHT_TIME).getAsInt();
        NodeIntervals intervals = graph.createIntervals();

        Map<Integer, Interval> observations = ImmutableMap.of(left, Interval.atMost(500), right, Interval.atMost(300));
        assertEquals(graph.updateIntervals(intervals, observations), PropagationResult.SUCCESS);
        assertEquals(intervals.get(left), Interval.atMost(305));
    }

    @Test
    public void testInfeasible()
    {
        ExpressionIntervalGraph graph = new ExpressionIntervalGraph(BAND_FILTER);
        int left = graph.getNode(LEFT_TIME).getAsInt();
        int right = graph.getNode(RIGHT_TIME).getAsInt();

        Map<Integer, Interval> observations = ImmutableMap.of(left, Interval.atMost(10), right, Interval.atLeast(100));
        assertEquals(graph.updateIntervals(graph.createIntervals(), observations), PropagationResult.INFEASIBLE);
    }

    @Test
    public void testCannotPropagate()
    {
        ExpressionIntervalGraph graph = new ExpressionIntervalGraph(add(LEFT_TIME, RIGHT_TIME));
        assertFalse(graph.isPredicate());
        int left = graph.getNode(LEFT_TIME).getAsInt();
        assertEquals(graph.updateIntervals(graph.createIntervals(), ImmutableMap.of(left, Interval.atLeast(1))), PropagationResult.CANNOT_PROPAGATE);
    }

    @Test
    public void testDisjunctionDoesNotNarrow()
    {
        ExpressionIntervalGraph graph = new ExpressionIntervalGraph(or(
                greaterThan(LEFT_TIME, RIGHT_TIME),
                lessThan(LEFT_TIME, constant(0L, BIGINT))));
        int left = graph.getNode(LEFT_TIME).getAsInt();
        int right = graph.getNode(RIGHT_TIME).getAsInt();
        NodeIntervals intervals = graph.createIntervals();

        assertEquals(graph.updateIntervals(intervals, ImmutableMap.of(right, Interval.atLeast(50))), PropagationResult.SUCCESS);
        assertTrue(intervals.get(left).isUnbounded());
    }

    @Test
    public void testOverflowLeavesBoundOpen()
    {
        ExpressionIntervalGraph graph = new ExpressionIntervalGraph(BAND_FILTER);
        int left = graph.getNode(LEFT_TIME).getAsInt();
        int right = graph.getNode(RIGHT_TIME).getAsInt();
        NodeIntervals intervals = graph.createIntervals();

        // #1 - 5 underflows, so nothing bounds #0 from below
        Map<Integer, Interval> observations = ImmutableMap.of(right, Interval.atLeast(Long.MIN_VALUE));
        assertEquals(graph.updateIntervals(intervals, observations), PropagationResult.SUCCESS);
        assertFalse(intervals.get(left).hasLower());
    }
}
