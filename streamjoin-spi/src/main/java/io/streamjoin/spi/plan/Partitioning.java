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

import com.google.common.collect.ImmutableList;

import javax.annotation.concurrent.Immutable;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

/**
 * How the output rows of a node are spread across its partitions.
 */
@Immutable
public final class Partitioning
{
    public enum Kind
    {
        SINGLE,
        HASH,
        UNKNOWN,
    }

    private final Kind kind;
    private final List<Integer> hashChannels;
    private final int partitionCount;

    private Partitioning(Kind kind, List<Integer> hashChannels, int partitionCount)
    {
        this.kind = requireNonNull(kind, "kind is null");
        this.hashChannels = ImmutableList.copyOf(requireNonNull(hashChannels, "hashChannels is null"));
        checkArgument(partitionCount > 0, "partitionCount must be positive");
        checkArgument(kind != Kind.SINGLE || partitionCount == 1, "single partitioning must have one partition");
        checkArgument(kind == Kind.HASH || this.hashChannels.isEmpty(), "only hash partitioning has hash channels");
        this.partitionCount = partitionCount;
    }

    public static Partitioning single()
    {
        return new Partitioning(Kind.SINGLE, ImmutableList.of(), 1);
    }

    public static Partitioning hash(List<Integer> hashChannels, int partitionCount)
    {
        checkArgument(!hashChannels.isEmpty(), "hashChannels is empty");
        return new Partitioning(Kind.HASH, hashChannels, partitionCount);
    }

    public static Partitioning unknown(int partitionCount)
    {
        return new Partitioning(Kind.UNKNOWN, ImmutableList.of(), partitionCount);
    }

    public Kind getKind()
    {
        return kind;
    }

    public List<Integer> getHashChannels()
    {
        return hashChannels;
    }

    public int getPartitionCount()
    {
        return partitionCount;
    }

    /**
     * Returns this partitioning with every hash channel moved by {@code offset}.
     */
    public Partitioning shiftChannels(int offset)
    {
        if (kind != Kind.HASH) {
            return this;
        }
        return new Partitioning(kind, hashChannels.stream().map(channel -> channel + offset).collect(toImmutableList()), partitionCount);
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
        Partitioning that = (Partitioning) o;
        return partitionCount == that.partitionCount &&
                kind == that.kind &&
                hashChannels.equals(that.hashChannels);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, hashChannels, partitionCount);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("kind", kind)
                .add("hashChannels", hashChannels)
                .add("partitionCount", partitionCount)
                .toString();
    }
}
