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
package io.streamjoin.operator.join;

import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;

public class TestRowHashTable
{
    @Test
    public void testChains()
    {
        RowHashTable table = new RowHashTable(4);
        assertEquals(table.add(7), 0);
        assertEquals(table.add(9), 1);
        assertEquals(table.addUnreachable(), 2);
        assertEquals(table.add(7), 3);

        assertEquals(table.getPositionCount(), 4);
        assertEquals(table.getFirstPosition(7), 3);
        assertEquals(table.getNextPosition(3), 0);
        assertEquals(table.getNextPosition(0), -1);
        assertEquals(table.getFirstPosition(9), 1);
        assertEquals(table.getFirstPosition(8), -1);
        assertEquals(table.getNextPosition(2), -1);
    }

    @Test
    public void testPrune()
    {
        RowHashTable table = new RowHashTable(4);
        table.add(7);
        table.add(9);
        table.add(7);
        table.add(5);
        table.add(7);

        table.prune(1);
        // 9, 7, 5, 7
        assertEquals(table.getPositionCount(), 4);
        assertEquals(table.getFirstPosition(7), 3);
        assertEquals(table.getNextPosition(3), 1);
        assertEquals(table.getNextPosition(1), -1);

        table.prune(2);
        // 5, 7
        assertEquals(table.getFirstPosition(9), -1);
        assertEquals(table.getFirstPosition(5), 0);
        assertEquals(table.getFirstPosition(7), 1);
        assertEquals(table.getNextPosition(1), -1);

        // new positions continue after the kept ones
        assertEquals(table.add(5), 2);
        assertEquals(table.getNextPosition(2), 0);

        table.prune(3);
        assertEquals(table.getPositionCount(), 0);
        assertEquals(table.getFirstPosition(5), -1);
        assertEquals(table.add(5), 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testPruneTooMuch()
    {
        RowHashTable table = new RowHashTable(4);
        table.add(1);
        table.prune(2);
    }

    @Test
    public void testVisitedRows()
    {
        VisitedRows visited = new VisitedRows();
        visited.add(3);
        visited.add(3);
        visited.add(10);
        assertEquals(visited.size(), 2);

        visited.retire(0, 5);
        assertEquals(visited.size(), 1);
        assertEquals(visited.contains(10), true);
        assertEquals(visited.contains(3), false);
    }
}
