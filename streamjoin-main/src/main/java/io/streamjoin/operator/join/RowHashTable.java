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

import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectIterator;
import org.openjdk.jol.info.ClassLayout;

import javax.annotation.concurrent.NotThreadSafe;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Verify.verify;

/**
 * Maps the key hash of every buffered row to the buffer positions of the rows with
 * that hash. Positions are relative to the start of the buffer, so they have to be
 * rebased whenever the buffer drops a prefix; see {@link #prune}.
 * <p>
 * Rows with equal hashes are not necessarily equal: callers must compare the actual
 * key values of every position returned.
 */
@NotThreadSafe
public class RowHashTable
{
    private static final int INSTANCE_SIZE = ClassLayout.parseClass(RowHashTable.class).instanceSize();

    // hash -> newest position with this hash
    private final Long2IntOpenHashMap heads;
    private final PositionLinks positionLinks;

    public RowHashTable(int expectedPositions)
    {
        heads = new Long2IntOpenHashMap(expectedPositions);
        heads.defaultReturnValue(-1);
        positionLinks = new PositionLinks(expectedPositions);
    }

    /**
     * Adds the next buffer position under {@code hash} and returns that position.
     */
    public int add(long hash)
    {
        int position = positionLinks.link(heads.get(hash));
        heads.put(hash, position);
        return position;
    }

    /**
     * Adds the next buffer position without making it reachable by any hash,
     * for rows that can never match.
     */
    public int addUnreachable()
    {
        return positionLinks.link(-1);
    }

    public int getPositionCount()
    {
        return positionLinks.size();
    }

    /**
     * Returns the newest position with {@code hash}, or -1.
     */
    public int getFirstPosition(long hash)
    {
        return heads.get(hash);
    }

    /**
     * Returns the next older position with the same hash as {@code position}, or -1.
     */
    public int getNextPosition(int position)
    {
        return positionLinks.next(position);
    }

    /**
     * Removes the first {@code length} positions and moves the others down by {@code length}.
     */
    public void prune(int length)
    {
        checkArgument(length >= 0 && length <= positionLinks.size(), "cannot prune %s positions out of %s", length, positionLinks.size());
        if (length == 0) {
            return;
        }
        if (length == positionLinks.size()) {
            clear();
            return;
        }

        ObjectIterator<Long2IntMap.Entry> iterator = heads.long2IntEntrySet().iterator();
        while (iterator.hasNext()) {
            Long2IntMap.Entry entry = iterator.next();
            int head = entry.getIntValue();
            if (head < length) {
                // the newest row of the chain is pruned, so the whole chain is
                iterator.remove();
            }
            else {
                entry.setValue(head - length);
            }
        }
        positionLinks.prune(length);
        verify(heads.size() <= positionLinks.size(), "more chains than positions");
    }

    public void clear()
    {
        heads.clear();
        heads.trim();
        positionLinks.clear();
    }

    public long getSizeInBytes()
    {
        // keys and values of the live entries
        long headsSize = (long) heads.size() * (Long.BYTES + Integer.BYTES);
        return INSTANCE_SIZE + headsSize + positionLinks.getSizeInBytes();
    }
}
