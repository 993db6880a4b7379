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

import com.facebook.presto.common.block.SortOrder;
import com.google.common.collect.ImmutableList;
import io.streamjoin.spi.relation.RowExpression;

import javax.annotation.concurrent.Immutable;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Lexicographic ordering of a node's output. The first item is the leading sort key.
 */
@Immutable
public final class Ordering
{
    private final List<SortItem> sortItems;

    public Ordering(List<SortItem> sortItems)
    {
        requireNonNull(sortItems, "sortItems is null");
        checkArgument(!sortItems.isEmpty(), "sortItems is empty");
        this.sortItems = ImmutableList.copyOf(sortItems);
    }

    public static Ordering of(RowExpression expression, SortOrder sortOrder)
    {
        return new Ordering(ImmutableList.of(new SortItem(expression, sortOrder)));
    }

    public List<SortItem> getSortItems()
    {
        return sortItems;
    }

    public SortItem getLeadingItem()
    {
        return sortItems.get(0);
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
        return sortItems.equals(((Ordering) o).sortItems);
    }

    @Override
    public int hashCode()
    {
        return sortItems.hashCode();
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("sortItems", sortItems)
                .toString();
    }

    @Immutable
    public static final class SortItem
    {
        private final RowExpression expression;
        private final SortOrder sortOrder;

        public SortItem(RowExpression expression, SortOrder sortOrder)
        {
            this.expression = requireNonNull(expression, "expression is null");
            this.sortOrder = requireNonNull(sortOrder, "sortOrder is null");
        }

        public RowExpression getExpression()
        {
            return expression;
        }

        public SortOrder getSortOrder()
        {
            return sortOrder;
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
            SortItem that = (SortItem) o;
            return expression.equals(that.expression) && sortOrder == that.sortOrder;
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(expression, sortOrder);
        }

        @Override
        public String toString()
        {
            return expression + " " + sortOrder;
        }
    }
}
