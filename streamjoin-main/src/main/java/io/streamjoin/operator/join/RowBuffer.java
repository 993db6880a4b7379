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
import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.openjdk.jol.info.ClassLayout;

import javax.annotation.concurrent.NotThreadSafe;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static io.airlift.slice.SizeOf.sizeOf;
import static io.streamjoin.operator.join.SyntheticAddress.decodePageIndex;
import static io.streamjoin.operator.join.SyntheticAddress.decodePosition;
import static io.streamjoin.operator.join.SyntheticAddress.encodeSyntheticAddress;
import static java.util.Objects.requireNonNull;

/**
 * The rows buffered by one side of a join, in arrival order.
 * <p>
 * Pages are kept as they arrive; every buffered row has a synthetic address
 * (page index, position in page), so that row {@code i} of the buffer can be located
 * directly. Rows are only ever appended at the end and removed from the front:
 * removing a prefix drops the pages it covers entirely, and re-slices the page it
 * ends in with {@link Page#getRegion}.
 */
@NotThreadSafe
public class RowBuffer
{
    private static final int INSTANCE_SIZE = ClassLayout.parseClass(RowBuffer.class).instanceSize();

    private final List<Type> types;
    private final ObjectArrayList<Page> pages = new ObjectArrayList<>();
    private final LongArrayList valueAddresses;

    private long pagesMemorySize;

    public RowBuffer(List<Type> types, int expectedPositions)
    {
        this.types = ImmutableList.copyOf(requireNonNull(types, "types is null"));
        this.valueAddresses = new LongArrayList(expectedPositions);
    }

    public List<Type> getTypes()
    {
        return types;
    }

    public int getPositionCount()
    {
        return valueAddresses.size();
    }

    public boolean isEmpty()
    {
        return valueAddresses.isEmpty();
    }

    public void addPage(Page page)
    {
        checkArgument(page.getChannelCount() == types.size(), "expected %s channels, but page has %s", types.size(), page.getChannelCount());
        // ignore empty pages
        if (page.getPositionCount() == 0) {
            return;
        }

        int pageIndex = pages.size();
        pages.add(page);
        pagesMemorySize += page.getRetainedSizeInBytes();

        valueAddresses.ensureCapacity(valueAddresses.size() + page.getPositionCount());
        for (int position = 0; position < page.getPositionCount(); position++) {
            valueAddresses.add(encodeSyntheticAddress(pageIndex, position));
        }
    }

    /**
     * The page holding buffered row {@code position}; read it at {@link #getPagePosition}.
     */
    public Page getPage(int position)
    {
        checkElementIndex(position, valueAddresses.size(), "position");
        return pages.get(decodePageIndex(valueAddresses.getLong(position)));
    }

    public int getPagePosition(int position)
    {
        checkElementIndex(position, valueAddresses.size(), "position");
        return decodePosition(valueAddresses.getLong(position));
    }

    public void appendTo(int channel, int position, BlockBuilder output)
    {
        long address = valueAddresses.getLong(position);
        Page page = pages.get(decodePageIndex(address));
        types.get(channel).appendTo(page.getBlock(channel), decodePosition(address), output);
    }

    /**
     * Removes the first {@code length} rows. Row {@code length} becomes row 0.
     */
    public void prunePrefix(int length)
    {
        checkArgument(length >= 0 && length <= valueAddresses.size(), "cannot prune %s rows from a buffer of %s rows", length, valueAddresses.size());
        if (length == 0) {
            return;
        }
        if (length == valueAddresses.size()) {
            clear();
            return;
        }

        long firstKeptAddress = valueAddresses.getLong(length);
        int droppedPages = decodePageIndex(firstKeptAddress);
        int offsetInFirstPage = decodePosition(firstKeptAddress);

        for (int i = 0; i < droppedPages; i++) {
            pagesMemorySize -= pages.get(i).getRetainedSizeInBytes();
        }
        pages.removeElements(0, droppedPages);
        if (offsetInFirstPage > 0) {
            Page first = pages.get(0);
            Page region = first.getRegion(offsetInFirstPage, first.getPositionCount() - offsetInFirstPage);
            pagesMemorySize += region.getRetainedSizeInBytes() - first.getRetainedSizeInBytes();
            pages.set(0, region);
        }

        valueAddresses.removeElements(0, length);
        long[] addresses = valueAddresses.elements();
        for (int i = 0; i < valueAddresses.size(); i++) {
            int pageIndex = decodePageIndex(addresses[i]) - droppedPages;
            int position = decodePosition(addresses[i]);
            if (pageIndex == 0) {
                position -= offsetInFirstPage;
            }
            addresses[i] = encodeSyntheticAddress(pageIndex, position);
        }
    }

    public void clear()
    {
        pages.clear();
        valueAddresses.clear();
        pagesMemorySize = 0;
    }

    public long getEstimatedSizeInBytes()
    {
        return INSTANCE_SIZE + pagesMemorySize + sizeOf(valueAddresses.elements());
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("positionCount", valueAddresses.size())
                .add("pages", pages.size())
                .add("estimatedSize", getEstimatedSizeInBytes())
                .toString();
    }
}
