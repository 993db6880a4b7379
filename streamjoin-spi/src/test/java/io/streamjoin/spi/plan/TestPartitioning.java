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
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

public class TestPartitioning
{
    @Test
    public void testShiftChannels()
    {
        Partitioning partitioning = Partitioning.hash(ImmutableList.of(0, 2), 4);
        assertEquals(partitioning.shiftChannels(3), Partitioning.hash(ImmutableList.of(3, 5), 4));

        Partitioning unknown = Partitioning.unknown(4);
        assertSame(unknown.shiftChannels(3), unknown);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testHashWithoutChannels()
    {
        Partitioning.hash(ImmutableList.of(), 2);
    }

    @Test
    public void testDistributionSatisfiedBy()
    {
        Distribution hash = Distribution.hashPartitioned(ImmutableList.of(1));
        assertTrue(hash.isSatisfiedBy(Partitioning.hash(ImmutableList.of(1), 8)));
        assertTrue(hash.isSatisfiedBy(Partitioning.single()));
        assertFalse(hash.isSatisfiedBy(Partitioning.hash(ImmutableList.of(0), 8)));
        assertFalse(hash.isSatisfiedBy(Partitioning.unknown(8)));

        assertTrue(Distribution.singlePartition().isSatisfiedBy(Partitioning.single()));
        assertFalse(Distribution.singlePartition().isSatisfiedBy(Partitioning.unknown(2)));
        assertTrue(Distribution.unspecified().isSatisfiedBy(Partitioning.unknown(2)));
    }
}
