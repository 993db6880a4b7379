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

import javax.annotation.concurrent.Immutable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Location of a join filter input: a channel of one of the join inputs.
 */
@Immutable
public final class ColumnIndex
{
    private final int channel;
    private final JoinSide side;

    public ColumnIndex(int channel, JoinSide side)
    {
        this.channel = channel;
        this.side = requireNonNull(side, "side is null");
    }

    public int getChannel()
    {
        return channel;
    }

    public JoinSide getSide()
    {
        return side;
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
        ColumnIndex that = (ColumnIndex) o;
        return channel == that.channel && side == that.side;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(channel, side);
    }

    @Override
    public String toString()
    {
        return side + "#" + channel;
    }
}
