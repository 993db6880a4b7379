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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An equality condition between a channel of the left input and a channel of the right input.
 */
@Immutable
public final class EquiJoinClause
{
    private final int leftChannel;
    private final int rightChannel;

    public EquiJoinClause(int leftChannel, int rightChannel)
    {
        checkArgument(leftChannel >= 0, "leftChannel is negative");
        checkArgument(rightChannel >= 0, "rightChannel is negative");
        this.leftChannel = leftChannel;
        this.rightChannel = rightChannel;
    }

    public int getLeftChannel()
    {
        return leftChannel;
    }

    public int getRightChannel()
    {
        return rightChannel;
    }

    public int getChannel(JoinSide side)
    {
        return side == JoinSide.LEFT ? leftChannel : rightChannel;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        EquiJoinClause other = (EquiJoinClause) obj;
        return this.leftChannel == other.leftChannel &&
                this.rightChannel == other.rightChannel;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(leftChannel, rightChannel);
    }

    @Override
    public String toString()
    {
        return "#" + leftChannel + " = #" + rightChannel;
    }
}
