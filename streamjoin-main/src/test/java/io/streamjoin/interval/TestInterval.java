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

import org.testng.annotations.Test;

import java.util.Optional;

import static io.streamjoin.spi.relation.OperatorType.EQUAL;
import static io.streamjoin.spi.relation.OperatorType.GREATER_THAN;
import static io.streamjoin.spi.relation.OperatorType.GREATER_THAN_OR_EQUAL;
import static io.streamjoin.spi.relation.OperatorType.LESS_THAN;
import static io.streamjoin.spi.relation.OperatorType.LESS_THAN_OR_EQUAL;
import static io.streamjoin.spi.relation.OperatorType.NOT_EQUAL;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestInterval
{
    @Test
    public void testArithmetic()
    {
        assertEquals(Interval.closed(1, 3).add(Interval.closed(10, 20)), Interval.closed(11, 23));
        assertEquals(Interval.closed(1, 3).subtract(Interval.closed(10, 20)), Interval.closed(-19, -7));
        assertEquals(Interval.atLeast(5).add(Interval.point(-5)), Interval.atLeast(0));
        assertEquals(Interval.atLeast(5).subtract(Interval.atLeast(1)), Interval.unbounded());
        assertEquals(Interval.atLeast(5).subtract(Interval.atMost(1)), Interval.atLeast(4));
        assertEquals(Interval.closed(-2, 7).negate(), Interval.closed(-7, 2));
        assertEquals(Interval.atMost(3).negate(), Interval.atLeast(-3));
    }

    @Test
    public void testOverflowDropsBound()
    {
        Interval sum = Interval.closed(Long.MAX_VALUE - 1, Long.MAX_VALUE).add(Interval.closed(0, 10));
        assertTrue(sum.hasLower());
        assertEquals(sum.getLower(), Long.MAX_VALUE - 1);
        assertFalse(sum.hasUpper());

        Interval difference = Interval.closed(Long.MIN_VALUE, 0).subtract(Interval.point(1));
        assertFalse(difference.hasLower());
        assertEquals(difference.getUpper(), -1);

        assertFalse(Interval.point(Long.MIN_VALUE).negate().hasUpper());
    }

    @Test
    public void testIntersect()
    {
        assertEquals(Interval.atLeast(3).intersect(Interval.atMost(8)), Optional.of(Interval.closed(3, 8)));
        assertEquals(Interval.closed(0, 10).intersect(Interval.unbounded()), Optional.of(Interval.closed(0, 10)));
        assertEquals(Interval.closed(0, 5).intersect(Interval.closed(5, 9)), Optional.of(Interval.point(5)));
        assertEquals(Interval.closed(0, 5).intersect(Interval.closed(6, 9)), Optional.empty());
        assertEquals(Interval.atMost(-1).intersect(Interval.atLeast(0)), Optional.empty());
    }

    @Test
    public void testContains()
    {
        assertTrue(Interval.closed(0, 10).contains(0));
        assertTrue(Interval.closed(0, 10).contains(10));
        assertFalse(Interval.closed(0, 10).contains(11));
        assertTrue(Interval.unbounded().contains(Long.MIN_VALUE));
        assertTrue(Interval.atLeast(0).contains(Interval.closed(1, 2)));
        assertFalse(Interval.closed(0, 10).contains(Interval.atLeast(1)));
        assertTrue(Interval.unbounded().contains(Interval.unbounded()));
    }

    @Test
    public void testCompare()
    {
        assertEquals(Interval.closed(0, 4).compare(LESS_THAN, Interval.closed(5, 9)), Interval.TRUE);
        assertEquals(Interval.closed(0, 5).compare(LESS_THAN, Interval.closed(5, 9)), Interval.UNCERTAIN);
        assertEquals(Interval.closed(0, 5).compare(LESS_THAN_OR_EQUAL, Interval.closed(5, 9)), Interval.TRUE);
        assertEquals(Interval.atLeast(10).compare(LESS_THAN_OR_EQUAL, Interval.atMost(9)), Interval.FALSE);
        assertEquals(Interval.atLeast(10).compare(GREATER_THAN, Interval.atMost(9)), Interval.TRUE);
        assertEquals(Interval.atLeast(10).compare(GREATER_THAN_OR_EQUAL, Interval.unbounded()), Interval.UNCERTAIN);
        assertEquals(Interval.point(3).compare(EQUAL, Interval.point(3)), Interval.TRUE);
        assertEquals(Interval.point(3).compare(EQUAL, Interval.atLeast(4)), Interval.FALSE);
        assertEquals(Interval.point(3).compare(NOT_EQUAL, Interval.atLeast(4)), Interval.TRUE);
        assertEquals(Interval.closed(0, 3).compare(NOT_EQUAL, Interval.point(3)), Interval.UNCERTAIN);
    }

    @Test
    public void testBooleanLogic()
    {
        assertEquals(Interval.TRUE.and(Interval.UNCERTAIN), Interval.UNCERTAIN);
        assertEquals(Interval.FALSE.and(Interval.UNCERTAIN), Interval.FALSE);
        assertEquals(Interval.TRUE.and(Interval.TRUE), Interval.TRUE);
        assertEquals(Interval.TRUE.or(Interval.UNCERTAIN), Interval.TRUE);
        assertEquals(Interval.FALSE.or(Interval.FALSE), Interval.FALSE);
        assertEquals(Interval.UNCERTAIN.not(), Interval.UNCERTAIN);
        assertEquals(Interval.of(true).not(), Interval.FALSE);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvertedBounds()
    {
        Interval.closed(5, 4);
    }

    @Test
    public void testToString()
    {
        assertEquals(Interval.closed(1, 2).toString(), "[1, 2]");
        assertEquals(Interval.atLeast(1).toString(), "[1, +inf]");
        assertEquals(Interval.unbounded().toString(), "[-inf, +inf]");
    }
}
