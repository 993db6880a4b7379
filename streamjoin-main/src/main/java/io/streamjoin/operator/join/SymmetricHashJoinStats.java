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

import io.streamjoin.spi.plan.JoinSide;

import javax.annotation.concurrent.NotThreadSafe;

import static com.google.common.base.MoreObjects.toStringHelper;

/**
 * Counters of a single join stream.
 */
@NotThreadSafe
public class SymmetricHashJoinStats
{
    private final long[] inputPages = new long[2];
    private final long[] inputRows = new long[2];
    private final long[] prunedRows = new long[2];
    private final long[] bufferedRows = new long[2];
    private final long[] peakBufferedRows = new long[2];
    private long outputPages;
    private long outputRows;
    private long rounds;

    public void recordInput(JoinSide side, int rows)
    {
        inputPages[side.ordinal()]++;
        inputRows[side.ordinal()] += rows;
    }

    public void recordPruned(JoinSide side, int rows)
    {
        prunedRows[side.ordinal()] += rows;
    }

    public void recordBuffered(JoinSide side, int rows)
    {
        bufferedRows[side.ordinal()] = rows;
        peakBufferedRows[side.ordinal()] = Math.max(peakBufferedRows[side.ordinal()], rows);
    }

    public void recordOutput(int rows)
    {
        outputPages++;
        outputRows += rows;
    }

    public void recordRound()
    {
        rounds++;
    }

    public long getInputPages(JoinSide side)
    {
        return inputPages[side.ordinal()];
    }

    public long getInputRows(JoinSide side)
    {
        return inputRows[side.ordinal()];
    }

    public long getPrunedRows(JoinSide side)
    {
        return prunedRows[side.ordinal()];
    }

    public long getBufferedRows(JoinSide side)
    {
        return bufferedRows[side.ordinal()];
    }

    public long getPeakBufferedRows(JoinSide side)
    {
        return peakBufferedRows[side.ordinal()];
    }

    public long getOutputPages()
    {
        return outputPages;
    }

    public long getOutputRows()
    {
        return outputRows;
    }

    public long getRounds()
    {
        return rounds;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("leftInputRows", inputRows[0])
                .add("rightInputRows", inputRows[1])
                .add("leftPrunedRows", prunedRows[0])
                .add("rightPrunedRows", prunedRows[1])
                .add("leftPeakBufferedRows", peakBufferedRows[0])
                .add("rightPeakBufferedRows", peakBufferedRows[1])
                .add("outputPages", outputPages)
                .add("outputRows", outputRows)
                .add("rounds", rounds)
                .toString();
    }
}
