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

import io.streamjoin.spi.PageStream;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The basic component of an execution plan. A plan is a tree of nodes, each node
 * describing its output schema, the ordering and partitioning of its output, and
 * how to produce the pages of one of its partitions.
 */
public abstract class PlanNode
{
    private final PlanNodeId id;

    protected PlanNode(PlanNodeId id)
    {
        requireNonNull(id, "id is null");
        this.id = id;
    }

    public PlanNodeId getId()
    {
        return id;
    }

    /**
     * Get the upstream nodes (i.e., children) of this node.
     */
    public abstract List<PlanNode> getSources();

    /**
     * The schema of the pages produced by this node, one field per channel.
     */
    public abstract List<Field> getOutputFields();

    /**
     * The order every partition of this node produces its rows in, if any is guaranteed.
     */
    public abstract Optional<Ordering> getOutputOrdering();

    public abstract Partitioning getOutputPartitioning();

    public int getPartitionCount()
    {
        return getOutputPartitioning().getPartitionCount();
    }

    /**
     * Creates a new stream producing the pages of the given partition. Every call
     * returns an independent stream.
     *
     * @throws IllegalArgumentException if the partition does not exist
     */
    public abstract PageStream execute(int partition);
}
