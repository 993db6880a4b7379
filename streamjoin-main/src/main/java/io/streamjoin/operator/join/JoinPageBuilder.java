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
import com.facebook.presto.common.PageBuilder;
import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;
import io.streamjoin.spi.plan.JoinSide;
import io.streamjoin.spi.plan.JoinType;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static io.streamjoin.spi.plan.JoinSide.LEFT;
import static io.streamjoin.spi.plan.JoinSide.RIGHT;
import static java.util.Objects.requireNonNull;

/**
 * Assembles the output pages of a join. The output holds the left columns followed
 * by the right columns, leaving out the side a semi or anti join does not output.
 * Pages are cut when they reach the configured size and queued until polled.
 */
@NotThreadSafe
public class JoinPageBuilder
{
    private final JoinType joinType;
    private final List<Type> leftTypes;
    private final List<Type> rightTypes;
    private final List<Type> outputTypes;
    private final int rightOutputOffset;
    private final PageBuilder pageBuilder;
    private final Deque<Page> outputPages = new ArrayDeque<>();

    public JoinPageBuilder(JoinType joinType, List<Type> leftTypes, List<Type> rightTypes, long maxPageSizeInBytes)
    {
        this.joinType = requireNonNull(joinType, "joinType is null");
        this.leftTypes = ImmutableList.copyOf(requireNonNull(leftTypes, "leftTypes is null"));
        this.rightTypes = ImmutableList.copyOf(requireNonNull(rightTypes, "rightTypes is null"));
        checkArgument(maxPageSizeInBytes > 0 && maxPageSizeInBytes <= Integer.MAX_VALUE, "invalid maxPageSizeInBytes: %s", maxPageSizeInBytes);

        ImmutableList.Builder<Type> outputTypes = ImmutableList.builder();
        if (joinType.outputsSide(LEFT)) {
            outputTypes.addAll(this.leftTypes);
        }
        if (joinType.outputsSide(RIGHT)) {
            outputTypes.addAll(this.rightTypes);
        }
        this.outputTypes = outputTypes.build();
        this.rightOutputOffset = joinType.outputsSide(LEFT) ? this.leftTypes.size() : 0;
        this.pageBuilder = PageBuilder.withMaxPageSize((int) maxPageSizeInBytes, this.outputTypes);
    }

    public List<Type> getOutputTypes()
    {
        return outputTypes;
    }

    /**
     * Appends a matched pair, given as a row of the build side and a row of the probe side.
     */
    public void appendMatch(JoinSide buildSide, RowBuffer buildRows, int buildPosition, Page probePage, int probePosition)
    {
        if (buildSide == LEFT) {
            appendBufferedColumns(buildRows, buildPosition, 0);
            appendPageColumns(probePage, probePosition, rightTypes, rightOutputOffset);
        }
        else {
            appendPageColumns(probePage, probePosition, leftTypes, 0);
            appendBufferedColumns(buildRows, buildPosition, rightOutputOffset);
        }
        declarePosition();
    }

    /**
     * Appends a buffered row of {@code side} on its own, with nulls for the columns of
     * the other side when the output has them.
     */
    public void appendUnmatched(JoinSide side, RowBuffer rows, int position)
    {
        checkArgument(joinType.outputsSide(side), "%s join does not output the %s side", joinType, side);
        JoinSide otherSide = side.negate();
        int offset = side == LEFT ? 0 : rightOutputOffset;
        appendBufferedColumns(rows, position, offset);
        if (joinType.outputsSide(otherSide)) {
            List<Type> otherTypes = otherSide == LEFT ? leftTypes : rightTypes;
            int otherOffset = otherSide == LEFT ? 0 : rightOutputOffset;
            for (int channel = 0; channel < otherTypes.size(); channel++) {
                pageBuilder.getBlockBuilder(otherOffset + channel).appendNull();
            }
        }
        declarePosition();
    }

    private void appendBufferedColumns(RowBuffer rows, int position, int outputOffset)
    {
        for (int channel = 0; channel < rows.getTypes().size(); channel++) {
            rows.appendTo(channel, position, pageBuilder.getBlockBuilder(outputOffset + channel));
        }
    }

    private void appendPageColumns(Page page, int position, List<Type> types, int outputOffset)
    {
        for (int channel = 0; channel < types.size(); channel++) {
            types.get(channel).appendTo(page.getBlock(channel), position, pageBuilder.getBlockBuilder(outputOffset + channel));
        }
    }

    private void declarePosition()
    {
        pageBuilder.declarePosition();
        if (pageBuilder.isFull()) {
            flush();
        }
    }

    /**
     * Moves the rows appended so far into a queued page.
     */
    public void flush()
    {
        if (pageBuilder.isEmpty()) {
            return;
        }
        outputPages.add(pageBuilder.build());
        pageBuilder.reset();
    }

    /**
     * Queues a page without rows, for rounds that produced no output.
     */
    public void addEmptyPage()
    {
        outputPages.add(new PageBuilder(outputTypes).build());
    }

    @Nullable
    public Page pollPage()
    {
        return outputPages.poll();
    }

    public boolean hasOutput()
    {
        return !outputPages.isEmpty();
    }

    public boolean isEmpty()
    {
        return outputPages.isEmpty() && pageBuilder.isEmpty();
    }

    public void reset()
    {
        outputPages.clear();
        pageBuilder.reset();
    }
}
