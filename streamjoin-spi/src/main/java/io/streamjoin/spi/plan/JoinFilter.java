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
import io.streamjoin.spi.relation.RowExpression;

import javax.annotation.concurrent.Immutable;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * A non-equality join condition. The expression reads an intermediate schema whose
 * fields are taken from both join inputs; field {@code i} of that schema is the
 * channel described by {@code columnIndices.get(i)}.
 */
@Immutable
public final class JoinFilter
{
    private final RowExpression expression;
    private final List<Field> intermediateFields;
    private final List<ColumnIndex> columnIndices;

    public JoinFilter(RowExpression expression, List<Field> intermediateFields, List<ColumnIndex> columnIndices)
    {
        this.expression = requireNonNull(expression, "expression is null");
        this.intermediateFields = ImmutableList.copyOf(requireNonNull(intermediateFields, "intermediateFields is null"));
        this.columnIndices = ImmutableList.copyOf(requireNonNull(columnIndices, "columnIndices is null"));
    }

    public RowExpression getExpression()
    {
        return expression;
    }

    public List<Field> getIntermediateFields()
    {
        return intermediateFields;
    }

    public List<ColumnIndex> getColumnIndices()
    {
        return columnIndices;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("expression", expression)
                .add("columnIndices", columnIndices)
                .toString();
    }
}
