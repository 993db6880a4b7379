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
package io.streamjoin.spi.plan;

import static java.util.Objects.requireNonNull;

/**
 * Join types supported by the symmetric hash join, together with the rules deciding
 * which rows each type emits. Matched pairs are emitted while probing; rows that must
 * be emitted on their own (null padded for outer joins, alone for semi and anti joins)
 * are emitted when they leave a side's buffer.
 */
public enum JoinType
{
    INNER,
    LEFT,
    RIGHT,
    FULL,
    LEFT_SEMI,
    LEFT_ANTI,
    RIGHT_SEMI,
    RIGHT_ANTI;

    /**
     * Must rows of {@code side} be tracked as visited so that they can be emitted when they leave the buffer?
     */
    public boolean requiresCompleteness(JoinSide side)
    {
        requireNonNull(side, "side is null");
        switch (this) {
            case INNER:
                return false;
            case FULL:
                return true;
            case LEFT:
            case LEFT_SEMI:
            case LEFT_ANTI:
                return side == JoinSide.LEFT;
            case RIGHT:
            case RIGHT_SEMI:
            case RIGHT_ANTI:
                return side == JoinSide.RIGHT;
            default:
                throw new IllegalStateException("Unknown join type: " + this);
        }
    }

    /**
     * Rows of {@code side} are emitted alone, once, if they matched at least once.
     */
    public boolean emitsOnlyVisited(JoinSide side)
    {
        return (this == LEFT_SEMI && side == JoinSide.LEFT) || (this == RIGHT_SEMI && side == JoinSide.RIGHT);
    }

    /**
     * Rows of {@code side} are emitted once if they never matched: null padded for outer
     * joins, alone for anti joins.
     */
    public boolean emitsOnlyUnvisited(JoinSide side)
    {
        switch (this) {
            case FULL:
                return true;
            case LEFT:
            case LEFT_ANTI:
                return side == JoinSide.LEFT;
            case RIGHT:
            case RIGHT_ANTI:
                return side == JoinSide.RIGHT;
            default:
                return false;
        }
    }

    /**
     * Regular joins emit every matching pair; semi and anti joins only use matches for bookkeeping.
     */
    public boolean producesMatchedPairs()
    {
        return this == INNER || this == LEFT || this == RIGHT || this == FULL;
    }

    /**
     * Are the columns of {@code side} part of the output?
     */
    public boolean outputsSide(JoinSide side)
    {
        switch (this) {
            case LEFT_SEMI:
            case LEFT_ANTI:
                return side == JoinSide.LEFT;
            case RIGHT_SEMI:
            case RIGHT_ANTI:
                return side == JoinSide.RIGHT;
            default:
                return true;
        }
    }

    /**
     * Can the columns of {@code side} be null because a row of the other side was emitted unmatched?
     */
    public boolean isNullPadded(JoinSide side)
    {
        return producesMatchedPairs() && emitsOnlyUnvisited(side.negate());
    }
}
