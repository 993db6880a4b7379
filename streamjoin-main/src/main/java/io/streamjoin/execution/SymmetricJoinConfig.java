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
package io.streamjoin.execution;

import com.facebook.airlift.configuration.Config;
import com.facebook.airlift.configuration.ConfigDescription;
import io.airlift.units.DataSize;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

import static io.airlift.units.DataSize.Unit.MEGABYTE;

public class SymmetricJoinConfig
{
    private DataSize outputPageSize = new DataSize(1, MEGABYTE);
    private int expectedPositions = 10_000;
    private boolean pruningEnabled = true;
    private boolean checkInputOrder = true;

    @NotNull
    public DataSize getOutputPageSize()
    {
        return outputPageSize;
    }

    @Config("symmetric-join.output-page-size")
    @ConfigDescription("Maximum size of a page produced by a symmetric hash join")
    public SymmetricJoinConfig setOutputPageSize(DataSize outputPageSize)
    {
        this.outputPageSize = outputPageSize;
        return this;
    }

    @Min(1)
    public int getExpectedPositions()
    {
        return expectedPositions;
    }

    @Config("symmetric-join.expected-positions")
    @ConfigDescription("Initial capacity of the hash table of each join input")
    public SymmetricJoinConfig setExpectedPositions(int expectedPositions)
    {
        this.expectedPositions = expectedPositions;
        return this;
    }

    public boolean isPruningEnabled()
    {
        return pruningEnabled;
    }

    @Config("symmetric-join.pruning-enabled")
    @ConfigDescription("Drop buffered rows that can no longer match")
    public SymmetricJoinConfig setPruningEnabled(boolean pruningEnabled)
    {
        this.pruningEnabled = pruningEnabled;
        return this;
    }

    public boolean isCheckInputOrder()
    {
        return checkInputOrder;
    }

    @Config("symmetric-join.check-input-order")
    @ConfigDescription("Fail when an input is not ordered as its plan declares")
    public SymmetricJoinConfig setCheckInputOrder(boolean checkInputOrder)
    {
        this.checkInputOrder = checkInputOrder;
        return this;
    }
}
