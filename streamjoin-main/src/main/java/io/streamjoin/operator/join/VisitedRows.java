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

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

import javax.annotation.concurrent.NotThreadSafe;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Absolute ids of the rows of one side that matched at least once. An absolute id
 * is the deleted offset of the side plus the buffer position of the row, and stays
 * the same for the whole life of the row.
 */
@NotThreadSafe
public class VisitedRows
{
    private final LongOpenHashSet rows = new LongOpenHashSet();

    public void add(long row)
    {
        rows.add(row);
    }

    public boolean contains(long row)
    {
        return rows.contains(row);
    }

    /**
     * Forgets the {@code length} rows starting at absolute id {@code firstRow}.
     */
    public void retire(long firstRow, int length)
    {
        checkArgument(firstRow >= 0 && length >= 0, "invalid range");
        if (rows.isEmpty()) {
            return;
        }
        for (long row = firstRow; row < firstRow + length; row++) {
            rows.remove(row);
        }
    }

    public int size()
    {
        return rows.size();
    }

    public void clear()
    {
        rows.clear();
        rows.trim();
    }
}
