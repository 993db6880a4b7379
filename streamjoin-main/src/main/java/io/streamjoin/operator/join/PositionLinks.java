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

import it.unimi.dsi.fastutil.ints.IntArrayList;

import javax.annotation.concurrent.NotThreadSafe;

import static com.google.common.base.Preconditions.checkArgument;
import static io.airlift.slice.SizeOf.sizeOf;

/**
 * Links every buffered row to the previous row with the same key hash, or to -1 if
 * there is none. Together with the chain heads of {@link RowHashTable} this forms
 * one singly linked list per hash, newest row first.
 */
@NotThreadSafe
final class PositionLinks
{
    private final IntArrayList links;

    public PositionLinks(int expectedPositions)
    {
        links = new IntArrayList(expectedPositions);
    }

    /**
     * Appends the link of the next position and returns that position.
     */
    public int link(int previous)
    {
        links.add(previous);
        return links.size() - 1;
    }

    public int next(int position)
    {
        return links.getInt(position);
    }

    public int size()
    {
        return links.size();
    }

    /**
     * Forgets the first {@code length} positions. Remaining positions move down by
     * {@code length}, and links into the removed prefix are cut.
     */
    public void prune(int length)
    {
        checkArgument(length >= 0 && length <= links.size(), "cannot prune %s positions out of %s", length, links.size());
        links.removeElements(0, length);
        int[] elements = links.elements();
        for (int i = 0; i < links.size(); i++) {
            int previous = elements[i] - length;
            elements[i] = previous < 0 ? -1 : previous;
        }
    }

    public void clear()
    {
        links.clear();
    }

    public long getSizeInBytes()
    {
        return sizeOf(links.elements());
    }
}
