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
import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Closer;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import io.streamjoin.execution.SymmetricJoinConfig;
import io.streamjoin.interval.ExpressionIntervalGraph;
import io.streamjoin.interval.Interval;
import io.streamjoin.interval.NodeIntervals;
import io.streamjoin.interval.PropagationResult;
import io.streamjoin.interval.SortedFilterExpression;
import io.streamjoin.operator.JoinFilterFunction;
import io.streamjoin.spi.PageStream;
import io.streamjoin.spi.plan.JoinSide;
import io.streamjoin.spi.plan.JoinType;
import io.streamjoin.sql.relational.RowExpressionInterpreter;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static io.streamjoin.spi.plan.JoinSide.LEFT;
import static io.streamjoin.spi.plan.JoinSide.RIGHT;
import static java.util.Objects.requireNonNull;

/**
 * Joins one partition of two inputs that are both ordered by an expression the join
 * filter constrains.
 * <p>
 * Each input keeps its own {@link OneSideHashJoiner}. A page from one input is added to
 * that input's joiner and then probes the joiner of the other input. The values seen so
 * far on both inputs bound, through the join filter, the values the other input can
 * still match with; rows of the other input outside that bound are removed, emitting
 * the rows the join type requires for them. When both inputs end, every row still
 * buffered is settled the same way.
 */
@NotThreadSafe
public class SymmetricHashJoinStream
        implements PageStream
{
    private static final Logger log = Logger.get(SymmetricHashJoinStream.class);

    private enum State
    {
        DRAINING,
        FINALIZING,
        DONE,
    }

    private final PageStream leftInput;
    private final PageStream rightInput;
    private final OneSideHashJoiner leftJoiner;
    private final OneSideHashJoiner rightJoiner;
    private final ExpressionIntervalGraph graph;
    private final NodeIntervals intervals;
    private final JoinPageBuilder output;
    private final boolean pruningEnabled;
    private final SymmetricHashJoinStats stats = new SymmetricHashJoinStats();

    // inputs that returned no page on their last poll
    private final boolean[] pending = new boolean[2];

    private State state = State.DRAINING;
    private JoinSide preferredSide = LEFT;
    private boolean closed;

    public SymmetricHashJoinStream(
            PageStream leftInput,
            PageStream rightInput,
            JoinType joinType,
            List<Type> leftTypes,
            List<Type> rightTypes,
            List<Integer> leftKeyChannels,
            List<Integer> rightKeyChannels,
            boolean nullEqualsNull,
            JoinFilterFunction filterFunction,
            ExpressionIntervalGraph graph,
            SortedFilterExpression leftSortedExpression,
            SortedFilterExpression rightSortedExpression,
            SymmetricJoinConfig config)
    {
        this.leftInput = requireNonNull(leftInput, "leftInput is null");
        this.rightInput = requireNonNull(rightInput, "rightInput is null");
        this.graph = requireNonNull(graph, "graph is null");
        requireNonNull(config, "config is null");

        this.leftJoiner = new OneSideHashJoiner(
                LEFT,
                joinType,
                leftTypes,
                leftKeyChannels,
                nullEqualsNull,
                leftSortedExpression,
                filterFunction,
                config.isCheckInputOrder(),
                config.getExpectedPositions());
        this.rightJoiner = new OneSideHashJoiner(
                RIGHT,
                joinType,
                rightTypes,
                rightKeyChannels,
                nullEqualsNull,
                rightSortedExpression,
                filterFunction,
                config.isCheckInputOrder(),
                config.getExpectedPositions());
        this.intervals = graph.createIntervals();
        this.output = new JoinPageBuilder(joinType, leftTypes, rightTypes, config.getOutputPageSize().toBytes());
        this.pruningEnabled = config.isPruningEnabled();
    }

    public List<Type> getOutputTypes()
    {
        return output.getOutputTypes();
    }

    public SymmetricHashJoinStats getStats()
    {
        return stats;
    }

    @Override
    public Page getNextPage()
    {
        try {
            return processNextPage();
        }
        catch (RuntimeException e) {
            closeAfterFailure(e);
            throw e;
        }
    }

    private Page processNextPage()
    {
        while (true) {
            Page page = output.pollPage();
            if (page != null) {
                stats.recordOutput(page.getPositionCount());
                return page;
            }

            switch (state) {
                case DRAINING:
                    if (!drain()) {
                        return null;
                    }
                    break;
                case FINALIZING:
                    finishJoin();
                    break;
                case DONE:
                    return null;
                default:
                    throw new IllegalStateException("Unknown state: " + state);
            }
        }
    }

    /**
     * Polls the preferred input, then the other one, until a round is processed or an
     * input ends. Returns false when no live input has a page ready.
     */
    private boolean drain()
    {
        JoinSide side = preferredSide;
        for (int attempt = 0; attempt < 2; attempt++, side = side.negate()) {
            OneSideHashJoiner joiner = joiner(side);
            if (joiner.isExhausted()) {
                continue;
            }
            PageStream input = input(side);

            Page page = input.isFinished() ? null : input.getNextPage();
            if (page == null) {
                if (input.isFinished()) {
                    inputFinished(side);
                    return true;
                }
                pending[side.ordinal()] = true;
                continue;
            }
            pending[side.ordinal()] = false;

            processRound(side, page);

            JoinSide otherSide = side.negate();
            boolean otherBlocked = pending[otherSide.ordinal()] && !input(otherSide).isBlocked().isDone();
            preferredSide = joiner(otherSide).isExhausted() || otherBlocked ? side : otherSide;
            return true;
        }
        return false;
    }

    private void inputFinished(JoinSide side)
    {
        joiner(side).setExhausted();
        pending[side.ordinal()] = false;
        preferredSide = side.negate();
        log.debug("%s input finished after %s rows", side, stats.getInputRows(side));
        if (leftJoiner.isExhausted() && rightJoiner.isExhausted()) {
            state = State.FINALIZING;
        }
    }

    private void processRound(JoinSide side, Page page)
    {
        OneSideHashJoiner joiner = joiner(side);
        OneSideHashJoiner otherJoiner = joiner(side.negate());
        stats.recordInput(side, page.getPositionCount());
        stats.recordRound();

        joiner.ingest(page);
        otherJoiner.probe(page, joiner, output);

        if (pruningEnabled) {
            int pruneLength = computePruneLength(joiner, otherJoiner, page);
            if (pruneLength > 0) {
                otherJoiner.prune(pruneLength, output);
                stats.recordPruned(otherJoiner.getSide(), pruneLength);
            }
            if (otherJoiner.isExhausted() && joiner.getBufferedRowCount() > 0) {
                // every row of this side has already met the whole other input
                int bufferedRows = joiner.getBufferedRowCount();
                joiner.prune(bufferedRows, output);
                stats.recordPruned(side, bufferedRows);
            }
        }
        stats.recordBuffered(LEFT, leftJoiner.getBufferedRowCount());
        stats.recordBuffered(RIGHT, rightJoiner.getBufferedRowCount());

        output.flush();
        if (!output.hasOutput()) {
            output.addEmptyPage();
        }
    }

    /**
     * Number of leading rows of {@code buildSide} that cannot match any row the
     * {@code probeSide} input has yet to produce.
     */
    private int computePruneLength(OneSideHashJoiner probeSide, OneSideHashJoiner buildSide, Page probePage)
    {
        if (buildSide.getBufferedRowCount() == 0) {
            return 0;
        }

        Map<Integer, Interval> observations = new HashMap<>();
        SortedFilterExpression buildExpression = buildSide.getSortedExpression();
        Long buildValue = buildSide.getFirstSortValue();
        if (buildValue != null) {
            observe(observations, buildExpression, buildValue);
        }
        SortedFilterExpression probeExpression = probeSide.getSortedExpression();
        Long probeValue = getLastSortValue(probeExpression, probePage);
        if (probeValue != null) {
            observe(observations, probeExpression, probeValue);
        }

        PropagationResult result = graph.updateIntervals(intervals, observations);
        switch (result) {
            case INFEASIBLE:
                log.debug("Filter cannot hold for the %s side, pruning all %s rows", buildSide.getSide(), buildSide.getBufferedRowCount());
                return buildSide.getBufferedRowCount();
            case CANNOT_PROPAGATE:
                return 0;
            case SUCCESS:
                Interval interval = buildExpression.getInterval(intervals);
                if (buildExpression.getSortOrder().isAscending()) {
                    return interval.hasLower() ? buildSide.computePruneLength(interval.getLower()) : 0;
                }
                return interval.hasUpper() ? buildSide.computePruneLength(interval.getUpper()) : 0;
            default:
                throw new IllegalStateException("Unknown propagation result: " + result);
        }
    }

    private static void observe(Map<Integer, Interval> observations, SortedFilterExpression expression, long value)
    {
        Interval observed = expression.observe(value);
        Interval existing = observations.get(expression.getNode());
        if (existing != null) {
            // both inputs sorted by the same filter expression
            observed = existing.intersect(observed).orElse(existing);
        }
        observations.put(expression.getNode(), observed);
    }

    @Nullable
    private static Long getLastSortValue(SortedFilterExpression expression, Page page)
    {
        for (int position = page.getPositionCount() - 1; position >= 0; position--) {
            Long value = RowExpressionInterpreter.evaluateLong(expression.getOriginExpression(), page, position);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private void finishJoin()
    {
        checkState(state == State.FINALIZING, "join is not finalizing");
        for (OneSideHashJoiner joiner : ImmutableList.of(leftJoiner, rightJoiner)) {
            int remaining = joiner.finish(output);
            stats.recordPruned(joiner.getSide(), remaining);
            stats.recordBuffered(joiner.getSide(), 0);
        }
        output.flush();
        state = State.DONE;
        log.debug("Join finished: %s", stats);
        closeInputs();
    }

    @Override
    public boolean isFinished()
    {
        return state == State.DONE && !output.hasOutput();
    }

    @Override
    public ListenableFuture<?> isBlocked()
    {
        if (output.hasOutput() || state != State.DRAINING) {
            return NOT_BLOCKED;
        }
        List<ListenableFuture<?>> blockedFutures = new ArrayList<>();
        for (JoinSide side : JoinSide.values()) {
            if (joiner(side).isExhausted()) {
                continue;
            }
            ListenableFuture<?> blocked = input(side).isBlocked();
            if (blocked.isDone()) {
                return NOT_BLOCKED;
            }
            blockedFutures.add(blocked);
        }
        if (blockedFutures.isEmpty()) {
            return NOT_BLOCKED;
        }
        return firstFinishedFuture(blockedFutures);
    }

    private static ListenableFuture<?> firstFinishedFuture(List<ListenableFuture<?>> futures)
    {
        if (futures.size() == 1) {
            return futures.get(0);
        }

        SettableFuture<?> result = SettableFuture.create();

        for (ListenableFuture<?> future : futures) {
            future.addListener(() -> result.set(null), directExecutor());
        }

        return result;
    }

    @Override
    public void close()
    {
        state = State.DONE;
        output.reset();
        closeInputs();
    }

    private void closeAfterFailure(RuntimeException failure)
    {
        try {
            close();
        }
        catch (RuntimeException e) {
            if (e != failure) {
                failure.addSuppressed(e);
            }
            log.warn(e, "Error closing join inputs after failure");
        }
    }

    private void closeInputs()
    {
        if (closed) {
            return;
        }
        closed = true;

        try (Closer closer = Closer.create()) {
            // closed in reverse order of registration
            closer.register(rightInput::close);
            closer.register(leftInput::close);
            closer.register(rightJoiner::close);
            closer.register(leftJoiner::close);
        }
        catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    private OneSideHashJoiner joiner(JoinSide side)
    {
        return side == LEFT ? leftJoiner : rightJoiner;
    }

    private PageStream input(JoinSide side)
    {
        return side == LEFT ? leftInput : rightInput;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("state", state)
                .add("preferredSide", preferredSide)
                .add("left", leftJoiner)
                .add("right", rightJoiner)
                .add("stats", stats)
                .toString();
    }
}
