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
package io.streamjoin.operator.join;

import com.facebook.presto.common.Page;
import com.facebook.presto.common.block.Block;
import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Hashing and comparison of the equality key of one join input. Both inputs of a
 * join have a strategy over the same key types, possibly on different channels.
 */
public class JoinHashStrategy
{
    private static final long NULL_HASH_CODE = 0;

    private final List<Type> keyTypes;
    private final int[] keyChannels;

    public JoinHashStrategy(List<Type> keyTypes, List<Integer> keyChannels)
    {
        this.keyTypes = ImmutableList.copyOf(requireNonNull(keyTypes, "keyTypes is null"));
        this.keyChannels = Ints.toArray(requireNonNull(keyChannels, "keyChannels is null"));
        checkArgument(this.keyTypes.size() == this.keyChannels.length, "keyTypes and keyChannels have different sizes");
    }

    public int getKeyCount()
    {
        return keyChannels.length;
    }

    public long hashRow(int position, Page page)
    {
        long result = 0;
        for (int i = 0; i < keyChannels.length; i++) {
            Block block = page.getBlock(keyChannels[i]);
            long hash = block.isNull(position) ? NULL_HASH_CODE : keyTypes.get(i).hash(block, position);
            result = 31 * result + hash;
        }
        return result;
    }

    public boolean isAnyKeyNull(int position, Page page)
    {
        for (int channel : keyChannels) {
            if (page.getBlock(channel).isNull(position)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Compares the key of a row of this input with the key of a row of the other
     * input. Null keys are equal to each other only if {@code nullEqualsNull} is set.
     */
    public boolean rowEqualsRow(int position, Page page, JoinHashStrategy otherStrategy, int otherPosition, Page otherPage, boolean nullEqualsNull)
    {
        for (int i = 0; i < keyChannels.length; i++) {
            Block block = page.getBlock(keyChannels[i]);
            Block otherBlock = otherPage.getBlock(otherStrategy.keyChannels[i]);
            boolean isNull = block.isNull(position);
            boolean otherIsNull = otherBlock.isNull(otherPosition);
            if (isNull || otherIsNull) {
                if (!(isNull && otherIsNull && nullEqualsNull)) {
                    return false;
                }
                continue;
            }
            if (!keyTypes.get(i).equalTo(block, position, otherBlock, otherPosition)) {
                return false;
            }
        }
        return true;
    }
}
