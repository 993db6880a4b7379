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

import com.facebook.airlift.log.Logger;
import com.facebook.presto.common.Page;
import com.facebook.presto.common.block.SortOrder;
import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;
import io.streamjoin.interval.SortedFilterExpression;
import io.streamjoin.operator.JoinFilterFunction;
import io.streamjoin.spi.StreamJoinException;
import io.streamjoin.spi.plan.JoinSide;
import io.streamjoin.spi.plan.JoinType;
import io.streamjoin.sql.relational.RowExpressionInterpreter;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static io.streamjoin.spi.StandardErrorCode.INPUT_ORDER_VIOLATION;
import static io.streamjoin.spi.plan.JoinSide.LEFT;
import static java.lang.String.format;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * The state one input keeps in a symmetric hash join: every row of the input that may
 * still find a partner, a hash table over the equality keys of those rows, and the set
 * of rows that already matched.
 * <p>
 * Buffered rows are addressed by their position in the buffer. Pruning removes a prefix
 * of the buffer, so the absolute id of a row is {@code deletedOffset + position}; only
 * the visited set works with absolute ids.
 */
@NotThreadSafe
public class OneSideHashJoiner
{
    private static final Logger log = Logger.get(OneSideHashJoiner.class);

    private final JoinSide side;
    private final JoinType joinType;
    private final JoinHashStrategy hashStrategy;
    private final boolean nullEqualsNull;
    private final SortedFilterExpression sortedExpression;
    private final JoinFilterFunction filterFunction;
    private final boolean checkInputOrder;

    private final RowBuffer buffer;
    private final RowHashTable hashTable;
    private final VisitedRows visitedRows = new VisitedRows();

    private long[] hashes = new long[0];
    private long ingestedRows;
    private long deletedOffset;
    private boolean exhausted;

    // sortedness guard state
    @Nullable
    private Long lastSortValue;
    private boolean sawNullSortValue;

    public OneSideHashJoiner(
            JoinSide side,
            JoinType joinType,
            List<Type> types,
            List<Integer> keyChannels,
            boolean nullEqualsNull,
            SortedFilterExpression sortedExpression,
            JoinFilterFunction filterFunction,
            boolean checkInputOrder,
            int expectedPositions)
    {
        this.side = requireNonNull(side, "side is null");
        this.joinType = requireNonNull(joinType, "joinType is null");
        requireNonNull(types, "types is null");
        requireNonNull(keyChannels, "keyChannels is null");
        this.nullEqualsNull = nullEqualsNull;
        this.sortedExpression = requireNonNull(sortedExpression, "sortedExpression is null");
        checkArgument(sortedExpression.getSide() == side, "sorted expression belongs to the %s side", sortedExpression.getSide());
        this.filterFunction = requireNonNull(filterFunction, "filterFunction is null");
        this.checkInputOrder = checkInputOrder;

        ImmutableList.Builder<Type> keyTypes = ImmutableList.builder();
        for (int channel : keyChannels) {
            keyTypes.add(types.get(channel));
        }
        this.hashStrategy = new JoinHashStrategy(keyTypes.build(), keyChannels);
        this.buffer = new RowBuffer(types, expectedPositions);
        this.hashTable = new RowHashTable(expectedPositions);
    }

    public JoinSide getSide()
    {
        return side;
    }

    public SortedFilterExpression getSortedExpression()
    {
        return sortedExpression;
    }

    public int getBufferedRowCount()
    {
        return buffer.getPositionCount();
    }

    public long getIngestedRowCount()
    {
        return ingestedRows;
    }

    public long getDeletedOffset()
    {
        return deletedOffset;
    }

    public int getVisitedRowCount()
    {
        return visitedRows.size();
    }

    public long getEstimatedSizeInBytes()
    {
        return buffer.getEstimatedSizeInBytes() + hashTable.getSizeInBytes();
    }

    public boolean isExhausted()
    {
        return exhausted;
    }

    public void setExhausted()
    {
        exhausted = true;
    }

    /**
     * Adds the rows of {@code page} to the buffer and to the hash table.
     */
    public void ingest(Page page)
    {
        requireNonNull(page, "page is null");
        checkState(!exhausted, "%s side is exhausted", side);
        int positionCount = page.getPositionCount();
        if (positionCount == 0) {
            return;
        }
        if (checkInputOrder) {
            checkOrder(page);
        }

        int firstPosition = buffer.getPositionCount();
        buffer.addPage(page);

        if (hashes.length < positionCount) {
            hashes = new long[positionCount];
        }
        for (int position = 0; position < positionCount; position++) {
            hashes[position] = hashStrategy.hashRow(position, page);
        }
        for (int position = 0; position < positionCount; position++) {
            int bufferPosition;
            if (!nullEqualsNull && hashStrategy.isAnyKeyNull(position, page)) {
                bufferPosition = hashTable.addUnreachable();
            }
            else {
                bufferPosition = hashTable.add(hashes[position]);
            }
            checkState(bufferPosition == firstPosition + position, "hash table and buffer are out of sync");
        }
        ingestedRows += positionCount;
    }

    private void checkOrder(Page page)
    {
        SortOrder sortOrder = sortedExpression.getSortOrder();
        for (int position = 0; position < page.getPositionCount(); position++) {
            Long value = RowExpressionInterpreter.evaluateLong(sortedExpression.getOriginExpression(), page, position);
            if (value == null) {
                if (sortOrder.isNullsFirst()) {
                    if (lastSortValue != null) {
                        throw orderViolation("null after non-null value " + lastSortValue);
                    }
                }
                sawNullSortValue = true;
                continue;
            }
            if (!sortOrder.isNullsFirst() && sawNullSortValue) {
                throw orderViolation(format("value %s after null", value));
            }
            if (lastSortValue != null) {
                boolean outOfOrder = sortOrder.isAscending() ? value < lastSortValue : value > lastSortValue;
                if (outOfOrder) {
                    throw orderViolation(format("value %s after %s", value, lastSortValue));
                }
            }
            lastSortValue = value;
        }
    }

    private StreamJoinException orderViolation(String detail)
    {
        return new StreamJoinException(INPUT_ORDER_VIOLATION, format(
                "Input on the %s side is not ordered by %s %s: %s",
                side.name().toLowerCase(ENGLISH),
                sortedExpression.getOriginExpression(),
                sortedExpression.getSortOrder(),
                detail));
    }

    /**
     * Joins the rows of {@code probePage}, the page the other side just ingested, with
     * the rows buffered here.
     */
    public void probe(Page probePage, OneSideHashJoiner probeSide, JoinPageBuilder output)
    {
        checkArgument(probeSide.side == side.negate(), "probe side must be the other side");
        long probeBase = probeSide.ingestedRows - probePage.getPositionCount();
        checkState(probeBase >= probeSide.deletedOffset, "probe page is not the last page ingested by the %s side", probeSide.side);

        boolean recordBuildVisits = joinType.requiresCompleteness(side);
        boolean recordProbeVisits = joinType.requiresCompleteness(probeSide.side);
        boolean producesPairs = joinType.producesMatchedPairs();

        for (int probePosition = 0; probePosition < probePage.getPositionCount(); probePosition++) {
            if (!nullEqualsNull && probeSide.hashStrategy.isAnyKeyNull(probePosition, probePage)) {
                continue;
            }
            long hash = probeSide.hashStrategy.hashRow(probePosition, probePage);
            for (int buildPosition = hashTable.getFirstPosition(hash); buildPosition >= 0; buildPosition = hashTable.getNextPosition(buildPosition)) {
                Page buildPage = buffer.getPage(buildPosition);
                int buildPagePosition = buffer.getPagePosition(buildPosition);
                if (!hashStrategy.rowEqualsRow(buildPagePosition, buildPage, probeSide.hashStrategy, probePosition, probePage, nullEqualsNull)) {
                    continue;
                }
                boolean matches = side == LEFT
                        ? filterFunction.filter(buildPagePosition, buildPage, probePosition, probePage)
                        : filterFunction.filter(probePosition, probePage, buildPagePosition, buildPage);
                if (!matches) {
                    continue;
                }
                if (recordBuildVisits) {
                    visitedRows.add(deletedOffset + buildPosition);
                }
                if (recordProbeVisits) {
                    probeSide.visitedRows.add(probeBase + probePosition);
                }
                if (producesPairs) {
                    output.appendMatch(side, buffer, buildPosition, probePage, probePosition);
                }
            }
        }
    }

    /**
     * Value of the sort expression for the first buffered row that has one, or null.
     */
    @Nullable
    public Long getFirstSortValue()
    {
        int count = buffer.getPositionCount();
        if (count == 0) {
            return null;
        }
        if (sortedExpression.getSortOrder().isNullsFirst()) {
            int nullEnd = findNullPrefixEnd();
            return nullEnd < count ? sortValue(nullEnd) : null;
        }
        // only nulls are left when the first row is null
        return sortValueOrNull(0);
    }

    /**
     * Returns how many leading buffered rows can no longer satisfy the filter, given the
     * {@code bound} on this side's sorted expression: the lower bound when sorted
     * ascending, the upper bound when sorted descending. Rows equal to the bound are kept.
     */
    public int computePruneLength(long bound)
    {
        int count = buffer.getPositionCount();
        if (count == 0) {
            return 0;
        }
        boolean ascending = sortedExpression.getSortOrder().isAscending();
        int low;
        int high;
        if (sortedExpression.getSortOrder().isNullsFirst()) {
            // a null never satisfies the filter, so the null prefix is always prunable
            low = findNullPrefixEnd();
            high = count;
        }
        else {
            low = 0;
            high = findFirstNull();
        }

        // first position in [low, high) whose value is not outside the bound
        while (low < high) {
            int middle = (low + high) >>> 1;
            long value = sortValue(middle);
            boolean outside = ascending ? value < bound : value > bound;
            if (outside) {
                low = middle + 1;
            }
            else {
                high = middle;
            }
        }
        return low;
    }

    private int findNullPrefixEnd()
    {
        int low = 0;
        int high = buffer.getPositionCount();
        while (low < high) {
            int middle = (low + high) >>> 1;
            if (sortValueOrNull(middle) == null) {
                low = middle + 1;
            }
            else {
                high = middle;
            }
        }
        return low;
    }

    private int findFirstNull()
    {
        int low = 0;
        int high = buffer.getPositionCount();
        while (low < high) {
            int middle = (low + high) >>> 1;
            if (sortValueOrNull(middle) != null) {
                low = middle + 1;
            }
            else {
                high = middle;
            }
        }
        return low;
    }

    @Nullable
    private Long sortValueOrNull(int position)
    {
        return RowExpressionInterpreter.evaluateLong(sortedExpression.getOriginExpression(), buffer.getPage(position), buffer.getPagePosition(position));
    }

    private long sortValue(int position)
    {
        Long value = sortValueOrNull(position);
        checkState(value != null, "unexpected null sort value at position %s", position);
        return value;
    }

    /**
     * Drops the first {@code length} buffered rows, emitting the rows the join type
     * requires for them into {@code output}.
     */
    public void prune(int length, JoinPageBuilder output)
    {
        checkState(length >= 0 && length <= buffer.getPositionCount(), "prune length %s outside of buffer with %s rows", length, buffer.getPositionCount());
        if (length == 0) {
            return;
        }

        if (joinType.requiresCompleteness(side)) {
            boolean onlyVisited = joinType.emitsOnlyVisited(side);
            boolean onlyUnvisited = joinType.emitsOnlyUnvisited(side);
            for (int position = 0; position < length; position++) {
                boolean visited = visitedRows.contains(deletedOffset + position);
                if ((onlyVisited && visited) || (onlyUnvisited && !visited)) {
                    output.appendUnmatched(side, buffer, position);
                }
            }
        }

        hashTable.prune(length);
        visitedRows.retire(deletedOffset, length);
        buffer.prunePrefix(length);
        deletedOffset += length;
        log.debug("Pruned %s rows from the %s side, %s rows left", length, side, buffer.getPositionCount());
    }

    /**
     * Emits the rows still owed for every buffered row and releases the buffer.
     */
    public int finish(JoinPageBuilder output)
    {
        int length = buffer.getPositionCount();
        prune(length, output);
        exhausted = true;
        return length;
    }

    public void close()
    {
        buffer.clear();
        hashTable.clear();
        visitedRows.clear();
        hashes = new long[0];
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("side", side)
                .add("bufferedRows", buffer.getPositionCount())
                .add("ingestedRows", ingestedRows)
                .add("deletedOffset", deletedOffset)
                .add("visitedRows", visitedRows.size())
                .add("exhausted", exhausted)
                .toString();
    }
}
