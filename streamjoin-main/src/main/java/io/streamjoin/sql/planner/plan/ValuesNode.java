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
package io.streamjoin.sql.planner.plan;

import com.facebook.presto.common.Page;
import com.google.common.collect.ImmutableList;
import io.streamjoin.operator.FixedPageStream;
import io.streamjoin.spi.PageStream;
import io.streamjoin.spi.plan.Field;
import io.streamjoin.spi.plan.Ordering;
import io.streamjoin.spi.plan.Partitioning;
import io.streamjoin.spi.plan.PlanNode;
import io.streamjoin.spi.plan.PlanNodeId;

import javax.annotation.concurrent.Immutable;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

/**
 * Leaf node producing pages held in memory, a list per partition.
 */
@Immutable
public final class ValuesNode
        extends PlanNode
{
    private final List<Field> outputFields;
    private final List<List<Page>> partitions;
    private final Optional<Ordering> ordering;
    private final Partitioning partitioning;

    public ValuesNode(PlanNodeId id, List<Field> outputFields, List<Page> pages, Optional<Ordering> ordering)
    {
        this(id, outputFields, ImmutableList.of(pages), ordering, Partitioning.single());
    }

    public ValuesNode(PlanNodeId id, List<Field> outputFields, List<List<Page>> partitions, Optional<Ordering> ordering, Partitioning partitioning)
    {
        super(id);
        this.outputFields = ImmutableList.copyOf(requireNonNull(outputFields, "outputFields is null"));
        this.partitions = requireNonNull(partitions, "partitions is null").stream()
                .map(ImmutableList::copyOf)
                .collect(toImmutableList());
        this.ordering = requireNonNull(ordering, "ordering is null");
        this.partitioning = requireNonNull(partitioning, "partitioning is null");
        checkArgument(this.partitions.size() == partitioning.getPartitionCount(), "%s partitions of pages for %s", this.partitions.size(), partitioning);
        for (List<Page> pages : this.partitions) {
            for (Page page : pages) {
                checkArgument(page.getChannelCount() == this.outputFields.size(), "page has %s channels, expected %s", page.getChannelCount(), this.outputFields.size());
            }
        }
    }

    public List<List<Page>> getPartitions()
    {
        return partitions;
    }

    @Override
    public List<PlanNode> getSources()
    {
        return ImmutableList.of();
    }

    @Override
    public List<Field> getOutputFields()
    {
        return outputFields;
    }

    @Override
    public Optional<Ordering> getOutputOrdering()
    {
        return ordering;
    }

    @Override
    public Partitioning getOutputPartitioning()
    {
        return partitioning;
    }

    @Override
    public PageStream execute(int partition)
    {
        checkArgument(partition >= 0 && partition < partitions.size(), "partition %s does not exist, node has %s partitions", partition, partitions.size());
        return new FixedPageStream(partitions.get(partition));
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("id", getId())
                .add("outputFields", outputFields)
                .add("partitions", partitions.size())
                .add("ordering", ordering)
                .add("partitioning", partitioning)
                .toString();
    }
}
