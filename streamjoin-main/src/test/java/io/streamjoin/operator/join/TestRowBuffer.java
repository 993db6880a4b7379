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

import com.facebook.presto.common.Page;
import com.facebook.presto.common.block.BlockBuilder;
import com.google.common.collect.ImmutableList;
import org.testng.annotations.Test;

import java.util.List;

import static com.facebook.presto.common.type.BigintType.BIGINT;
import static io.streamjoin.RowPagesBuilder.rowPagesBuilder;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class TestRowBuffer
{
    @Test
    public void testAddAndRead()
    {
        RowBuffer buffer = new RowBuffer(ImmutableList.of(BIGINT, BIGINT), 16);
        for (Page page : pages()) {
            buffer.addPage(page);
        }
        assertEquals(buffer.getPositionCount(), 6);
        assertValues(buffer, 0, 1, 2, 3, 4, 5);
        assertEquals(buffer.getPagePosition(4), 1);
    }

    @Test
    public void testEmptyPageIgnored()
    {
        RowBuffer buffer = new RowBuffer(ImmutableList.of(BIGINT, BIGINT), 16);
        buffer.addPage(new Page(0, BIGINT.createBlockBuilder(null, 0).build(), BIGINT.createBlockBuilder(null, 0).build()));
        assertTrue(buffer.isEmpty());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testWrongChannelCount()
    {
        RowBuffer buffer = new RowBuffer(ImmutableList.of(BIGINT), 16);
        buffer.addPage(pages().get(0));
    }

    @Test
    public void testPrunePrefix()
    {
        RowBuffer buffer = new RowBuffer(ImmutableList.of(BIGINT, BIGINT), 16);
        for (Page page : pages()) {
            buffer.addPage(page);
        }
        long sizeBefore = buffer.getEstimatedSizeInBytes();

        // inside the first page
        buffer.prunePrefix(1);
        assertValues(buffer, 1, 2, 3, 4, 5);

        // the rest of the first page and one row of the second
        buffer.prunePrefix(3);
        assertValues(buffer, 4, 5);
        assertEquals(buffer.getPagePosition(0), 0);
        assertTrue(buffer.getEstimatedSizeInBytes() < sizeBefore);

        buffer.prunePrefix(0);
        assertValues(buffer, 4, 5);

        buffer.prunePrefix(2);
        assertTrue(buffer.isEmpty());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testPruneTooMuch()
    {
        RowBuffer buffer = new RowBuffer(ImmutableList.of(BIGINT, BIGINT), 16);
        buffer.addPage(pages().get(0));
        buffer.prunePrefix(4);
    }

    private static List<Page> pages()
    {
        // rows 0, 1, 2 | 3, 4 | 5
        return rowPagesBuilder(BIGINT, BIGINT)
                .row(0L, 0L)
                .row(1L, 10L)
                .row(2L, 20L)
                .pageBreak()
                .row(3L, 30L)
                .row(4L, 40L)
                .pageBreak()
                .row(5L, 50L)
                .build();
    }

    private static void assertValues(RowBuffer buffer, long... expected)
    {
        assertEquals(buffer.getPositionCount(), expected.length);
        for (int position = 0; position < expected.length; position++) {
            Page page = buffer.getPage(position);
            assertEquals(BIGINT.getLong(page.getBlock(0), buffer.getPagePosition(position)), expected[position]);

            BlockBuilder builder = BIGINT.createBlockBuilder(null, 1);
            buffer.appendTo(1, position, builder);
            assertEquals(BIGINT.getLong(builder.build(), 0), expected[position] * 10);
        }
    }
}
