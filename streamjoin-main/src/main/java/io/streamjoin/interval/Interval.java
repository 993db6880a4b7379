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

import io.streamjoin.spi.relation.OperatorType;

import javax.annotation.concurrent.Immutable;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * A closed range of long values. Either bound may be absent, in which case the range
 * is unbounded on that side. Arithmetic that overflows a bound drops the bound, so
 * the result is always a superset of the exact result.
 * <p>
 * Boolean values are represented as the range {@code [0, 1]}: {@link #TRUE} is
 * {@code [1, 1]}, {@link #FALSE} is {@code [0, 0]} and {@link #UNCERTAIN} is {@code [0, 1]}.
 */
@Immutable
public final class Interval
{
    private static final Interval UNBOUNDED = new Interval(OptionalLong.empty(), OptionalLong.empty());

    public static final Interval TRUE = point(1);
    public static final Interval FALSE = point(0);
    public static final Interval UNCERTAIN = closed(0, 1);

    private final OptionalLong lower;
    private final OptionalLong upper;

    private Interval(OptionalLong lower, OptionalLong upper)
    {
        this.lower = requireNonNull(lower, "lower is null");
        this.upper = requireNonNull(upper, "upper is null");
        if (lower.isPresent() && upper.isPresent()) {
            checkArgument(lower.getAsLong() <= upper.getAsLong(), "lower bound %s is greater than upper bound %s", lower.getAsLong(), upper.getAsLong());
        }
    }

    public static Interval unbounded()
    {
        return UNBOUNDED;
    }

    public static Interval point(long value)
    {
        return closed(value, value);
    }

    public static Interval closed(long lower, long upper)
    {
        return new Interval(OptionalLong.of(lower), OptionalLong.of(upper));
    }

    public static Interval atLeast(long lower)
    {
        return new Interval(OptionalLong.of(lower), OptionalLong.empty());
    }

    public static Interval atMost(long upper)
    {
        return new Interval(OptionalLong.empty(), OptionalLong.of(upper));
    }

    public static Interval of(boolean value)
    {
        return value ? TRUE : FALSE;
    }

    public boolean hasLower()
    {
        return lower.isPresent();
    }

    public boolean hasUpper()
    {
        return upper.isPresent();
    }

    public long getLower()
    {
        checkState(lower.isPresent(), "interval has no lower bound");
        return lower.getAsLong();
    }

    public long getUpper()
    {
        checkState(upper.isPresent(), "interval has no upper bound");
        return upper.getAsLong();
    }

    public boolean isUnbounded()
    {
        return !lower.isPresent() && !upper.isPresent();
    }

    public boolean isPoint()
    {
        return lower.isPresent() && upper.isPresent() && lower.getAsLong() == upper.getAsLong();
    }

    public boolean contains(long value)
    {
        return (!lower.isPresent() || lower.getAsLong() <= value) &&
                (!upper.isPresent() || value <= upper.getAsLong());
    }

    public boolean contains(Interval other)
    {
        boolean lowerContained = !lower.isPresent() || (other.lower.isPresent() && lower.getAsLong() <= other.lower.getAsLong());
        boolean upperContained = !upper.isPresent() || (other.upper.isPresent() && other.upper.getAsLong() <= upper.getAsLong());
        return lowerContained && upperContained;
    }

    public Interval add(Interval other)
    {
        return new Interval(addBounds(lower, other.lower), addBounds(upper, other.upper));
    }

    /**
     * {@code [a, b] - [c, d] = [a - d, b - c]}
     */
    public Interval subtract(Interval other)
    {
        return new Interval(subtractBounds(lower, other.upper), subtractBounds(upper, other.lower));
    }

    public Interval negate()
    {
        return new Interval(negateBound(upper), negateBound(lower));
    }

    /**
     * Returns the values contained in both intervals, or empty if there are none.
     */
    public Optional<Interval> intersect(Interval other)
    {
        OptionalLong newLower = max(lower, other.lower);
        OptionalLong newUpper = min(upper, other.upper);
        if (newLower.isPresent() && newUpper.isPresent() && newLower.getAsLong() > newUpper.getAsLong()) {
            return Optional.empty();
        }
        if (newLower.equals(lower) && newUpper.equals(upper)) {
            return Optional.of(this);
        }
        return Optional.of(new Interval(newLower, newUpper));
    }

    /**
     * Evaluates {@code this <operator> other} for every pair of values drawn from
     * the two intervals, and returns the boolean interval of the outcomes.
     */
    public Interval compare(OperatorType operator, Interval other)
    {
        switch (operator) {
            case LESS_THAN:
                if (upper.isPresent() && other.lower.isPresent() && upper.getAsLong() < other.lower.getAsLong()) {
                    return TRUE;
                }
                if (lower.isPresent() && other.upper.isPresent() && lower.getAsLong() >= other.upper.getAsLong()) {
                    return FALSE;
                }
                return UNCERTAIN;
            case LESS_THAN_OR_EQUAL:
                if (upper.isPresent() && other.lower.isPresent() && upper.getAsLong() <= other.lower.getAsLong()) {
                    return TRUE;
                }
                if (lower.isPresent() && other.upper.isPresent() && lower.getAsLong() > other.upper.getAsLong()) {
                    return FALSE;
                }
                return UNCERTAIN;
            case GREATER_THAN:
            case GREATER_THAN_OR_EQUAL:
                return other.compare(operator.flip(), this);
            case EQUAL:
                if (isPoint() && equals(other)) {
                    return TRUE;
                }
                if (!intersect(other).isPresent()) {
                    return FALSE;
                }
                return UNCERTAIN;
            case NOT_EQUAL:
                return compare(OperatorType.EQUAL, other).not();
            default:
                throw new IllegalArgumentException("Not a comparison operator: " + operator);
        }
    }

    public boolean isCertainlyTrue()
    {
        return equals(TRUE);
    }

    public boolean isCertainlyFalse()
    {
        return equals(FALSE);
    }

    /**
     * Logical conjunction of two boolean intervals.
     */
    public Interval and(Interval other)
    {
        if (isCertainlyFalse() || other.isCertainlyFalse()) {
            return FALSE;
        }
        if (isCertainlyTrue() && other.isCertainlyTrue()) {
            return TRUE;
        }
        return UNCERTAIN;
    }

    /**
     * Logical disjunction of two boolean intervals.
     */
    public Interval or(Interval other)
    {
        if (isCertainlyTrue() || other.isCertainlyTrue()) {
            return TRUE;
        }
        if (isCertainlyFalse() && other.isCertainlyFalse()) {
            return FALSE;
        }
        return UNCERTAIN;
    }

    public Interval not()
    {
        if (isCertainlyTrue()) {
            return FALSE;
        }
        if (isCertainlyFalse()) {
            return TRUE;
        }
        return UNCERTAIN;
    }

    private static OptionalLong addBounds(OptionalLong left, OptionalLong right)
    {
        if (!left.isPresent() || !right.isPresent()) {
            return OptionalLong.empty();
        }
        long a = left.getAsLong();
        long b = right.getAsLong();
        long result = a + b;
        // overflow iff both operands have the same sign and the result has a different one
        if (((a ^ result) & (b ^ result)) < 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(result);
    }

    private static OptionalLong subtractBounds(OptionalLong left, OptionalLong right)
    {
        if (!left.isPresent() || !right.isPresent()) {
            return OptionalLong.empty();
        }
        long a = left.getAsLong();
        long b = right.getAsLong();
        long result = a - b;
        if (((a ^ b) & (a ^ result)) < 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(result);
    }

    private static OptionalLong negateBound(OptionalLong bound)
    {
        if (!bound.isPresent() || bound.getAsLong() == Long.MIN_VALUE) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(-bound.getAsLong());
    }

    // absent means unbounded, so the tighter of the two is the present one
    private static OptionalLong max(OptionalLong left, OptionalLong right)
    {
        if (!left.isPresent()) {
            return right;
        }
        if (!right.isPresent()) {
            return left;
        }
        return OptionalLong.of(Math.max(left.getAsLong(), right.getAsLong()));
    }

    private static OptionalLong min(OptionalLong left, OptionalLong right)
    {
        if (!left.isPresent()) {
            return right;
        }
        if (!right.isPresent()) {
            return left;
        }
        return OptionalLong.of(Math.min(left.getAsLong(), right.getAsLong()));
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Interval that = (Interval) o;
        return lower.equals(that.lower) && upper.equals(that.upper);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(lower, upper);
    }

    @Override
    public String toString()
    {
        return "[" + (lower.isPresent() ? String.valueOf(lower.getAsLong()) : "-inf") +
                ", " + (upper.isPresent() ? String.valueOf(upper.getAsLong()) : "+inf") + "]";
    }
}
