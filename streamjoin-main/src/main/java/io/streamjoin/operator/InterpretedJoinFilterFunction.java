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
package io.streamjoin.operator;

import com.facebook.presto.common.Page;
import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;
import io.streamjoin.spi.plan.ColumnIndex;
import io.streamjoin.spi.plan.Field;
import io.streamjoin.spi.plan.JoinFilter;
import io.streamjoin.spi.plan.JoinSide;
import io.streamjoin.spi.relation.RowExpression;

import java.util.List;

import static io.streamjoin.sql.relational.RowExpressionInterpreter.evaluate;
import static io.streamjoin.sql.relational.RowExpressionInterpreter.readValue;
import static java.util.Objects.requireNonNull;

/**
 * Evaluates a {@link JoinFilter} by interpreting its expression, reading every
 * intermediate field from the left or right row its column index points to.
 */
public class InterpretedJoinFilterFunction
        implements JoinFilterFunction
{
    private final RowExpression expression;
    private final List<ColumnIndex> columnIndices;
    private final List<Type> fieldTypes;

    public InterpretedJoinFilterFunction(JoinFilter filter)
    {
        requireNonNull(filter, "filter is null");
        this.expression = filter.getExpression();
        this.columnIndices = filter.getColumnIndices();
        this.fieldTypes = filter.getIntermediateFields().stream()
                .map(Field::getType)
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public boolean filter(int leftPosition, Page leftPage, int rightPosition, Page rightPage)
    {
        Object result = evaluate(expression, reference -> {
            ColumnIndex columnIndex = columnIndices.get(reference.getField());
            if (columnIndex.getSide() == JoinSide.LEFT) {
                return readValue(fieldTypes.get(reference.getField()), leftPage.getBlock(columnIndex.getChannel()), leftPosition);
            }
            return readValue(fieldTypes.get(reference.getField()), rightPage.getBlock(columnIndex.getChannel()), rightPosition);
        });
        return Boolean.TRUE.equals(result);
    }
}
