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
package io.streamjoin.spi.plan;

import org.testng.annotations.Test;

import static io.streamjoin.spi.plan.JoinSide.LEFT;
import static io.streamjoin.spi.plan.JoinSide.RIGHT;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestJoinType
{
    @Test
    public void testRequiresCompleteness()
    {
        assertFalse(JoinType.INNER.requiresCompleteness(LEFT));
        assertFalse(JoinType.INNER.requiresCompleteness(RIGHT));
        assertTrue(JoinType.FULL.requiresCompleteness(LEFT));
        assertTrue(JoinType.FULL.requiresCompleteness(RIGHT));
        for (JoinType type : new JoinType[] {JoinType.LEFT, JoinType.LEFT_SEMI, JoinType.LEFT_ANTI}) {
            assertTrue(type.requiresCompleteness(LEFT), type.toString());
            assertFalse(type.requiresCompleteness(RIGHT), type.toString());
        }
        for (JoinType type : new JoinType[] {JoinType.RIGHT, JoinType.RIGHT_SEMI, JoinType.RIGHT_ANTI}) {
            assertFalse(type.requiresCompleteness(LEFT), type.toString());
            assertTrue(type.requiresCompleteness(RIGHT), type.toString());
        }
    }

    @Test
    public void testEmissionRulesAreExclusive()
    {
        for (JoinType type : JoinType.values()) {
            for (JoinSide side : JoinSide.values()) {
                assertFalse(type.emitsOnlyVisited(side) && type.emitsOnlyUnvisited(side), type + " " + side);
                assertEquals(type.emitsOnlyVisited(side) || type.emitsOnlyUnvisited(side), type.requiresCompleteness(side), type + " " + side);
            }
        }
    }

    @Test
    public void testSemiAndAnti()
    {
        assertTrue(JoinType.LEFT_SEMI.emitsOnlyVisited(LEFT));
        assertFalse(JoinType.LEFT_SEMI.emitsOnlyVisited(RIGHT));
        assertTrue(JoinType.RIGHT_SEMI.emitsOnlyVisited(RIGHT));
        assertTrue(JoinType.LEFT_ANTI.emitsOnlyUnvisited(LEFT));
        assertTrue(JoinType.RIGHT_ANTI.emitsOnlyUnvisited(RIGHT));
        assertFalse(JoinType.RIGHT_ANTI.emitsOnlyUnvisited(LEFT));
    }

    @Test
    public void testOutputLayout()
    {
        assertTrue(JoinType.INNER.producesMatchedPairs());
        assertTrue(JoinType.FULL.producesMatchedPairs());
        assertFalse(JoinType.LEFT_SEMI.producesMatchedPairs());
        assertFalse(JoinType.RIGHT_ANTI.producesMatchedPairs());

        assertTrue(JoinType.LEFT_ANTI.outputsSide(LEFT));
        assertFalse(JoinType.LEFT_ANTI.outputsSide(RIGHT));
        assertFalse(JoinType.RIGHT_SEMI.outputsSide(LEFT));
        assertTrue(JoinType.RIGHT.outputsSide(LEFT));

        assertTrue(JoinType.LEFT.isNullPadded(RIGHT));
        assertFalse(JoinType.LEFT.isNullPadded(LEFT));
        assertTrue(JoinType.FULL.isNullPadded(LEFT));
        assertFalse(JoinType.INNER.isNullPadded(LEFT));
        assertFalse(JoinType.LEFT_ANTI.isNullPadded(RIGHT));
    }

    @Test
    public void testNegate()
    {
        assertEquals(LEFT.negate(), RIGHT);
        assertEquals(RIGHT.negate(), LEFT);
    }
}
