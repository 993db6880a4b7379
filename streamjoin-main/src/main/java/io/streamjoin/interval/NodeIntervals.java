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
package io.streamjoin.interval;

import javax.annotation.concurrent.NotThreadSafe;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

/**
 * The mutable interval of every node of an {@link ExpressionIntervalGraph}, indexed
 * by node handle. Each join stream owns its own instance.
 */
@NotThreadSafe
public final class NodeIntervals
{
    private final Interval[] intervals;

    NodeIntervals(int nodeCount)
    {
        intervals = new Interval[nodeCount];
        Arrays.fill(intervals, Interval.unbounded());
    }

    public int size()
    {
        return intervals.length;
    }

    public Interval get(int node)
    {
        checkElementIndex(node, intervals.length, "node");
        return intervals[node];
    }

    void set(int node, Interval interval)
    {
        intervals[node] = requireNonNull(interval, "interval is null");
    }

    @Override
    public String toString()
    {
        return Arrays.toString(intervals);
    }
}
