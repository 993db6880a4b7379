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
import static java.util.Objects.requireNonNull;

/**
 * The distribution a node requires of one of its inputs.
 */
@Immutable
public final class Distribution
{
    public enum Kind
    {
        SINGLE_PARTITION,
        HASH_PARTITIONED,
        UNSPECIFIED,
    }

    private final Kind kind;
    private final List<Integer> hashChannels;

    private Distribution(Kind kind, List<Integer> hashChannels)
    {
        this.kind = requireNonNull(kind, "kind is null");
        this.hashChannels = ImmutableList.copyOf(requireNonNull(hashChannels, "hashChannels is null"));
        checkArgument((kind == Kind.HASH_PARTITIONED) != this.hashChannels.isEmpty(), "hash channels must be present exactly for hash distribution");
    }

    public static Distribution singlePartition()
    {
        return new Distribution(Kind.SINGLE_PARTITION, ImmutableList.of());
    }

    public static Distribution hashPartitioned(List<Integer> hashChannels)
    {
        return new Distribution(Kind.HASH_PARTITIONED, hashChannels);
    }

    public static Distribution unspecified()
    {
        return new Distribution(Kind.UNSPECIFIED, ImmutableList.of());
    }

    public Kind getKind()
    {
        return kind;
    }

    public List<Integer> getHashChannels()
    {
        return hashChannels;
    }

    /**
     * Does a node with the given partitioning meet this requirement?
     */
    public boolean isSatisfiedBy(Partitioning partitioning)
    {
        switch (kind) {
            case SINGLE_PARTITION:
                return partitioning.getPartitionCount() == 1;
            case HASH_PARTITIONED:
                return partitioning.getPartitionCount() == 1 ||
                        (partitioning.getKind() == Partitioning.Kind.HASH && partitioning.getHashChannels().equals(hashChannels));
            case UNSPECIFIED:
                return true;
            default:
                throw new IllegalStateException("Unknown distribution: " + kind);
        }
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
        Distribution that = (Distribution) o;
        return kind == that.kind && hashChannels.equals(that.hashChannels);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, hashChannels);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("kind", kind)
                .add("hashChannels", hashChannels)
                .toString();
    }
}
