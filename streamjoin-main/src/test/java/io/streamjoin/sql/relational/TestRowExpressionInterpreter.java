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
package io.streamjoin.sql.relational;

import com.facebook.presto.common.Page;
import io.streamjoin.spi.StreamJoinException;
import io.streamjoin.spi.relation.RowExpression;
import org.testng.annotations.Test;

import static com.facebook.presto.common.type.BigintType.BIGINT;
import static com.facebook.presto.common.type.BooleanType.BOOLEAN;
import static com.facebook.presto.common.type.IntegerType.INTEGER;
import static com.facebook.presto.common.type.VarcharType.VARCHAR;
import static io.streamjoin.RowPagesBuilder.rowPagesBuilder;
import static io.streamjoin.spi.StandardErrorCode.NUMERIC_VALUE_OUT_OF_RANGE;
import static io.streamjoin.spi.relation.Expressions.add;
import static io.streamjoin.spi.relation.Expressions.and;
import static io.streamjoin.spi.relation.Expressions.between;
import static io.streamjoin.spi.relation.Expressions.call;
import static io.streamjoin.spi.relation.Expressions.constant;
import static io.streamjoin.spi.relation.Expressions.constantNull;
import static io.streamjoin.spi.relation.Expressions.equal;
import static io.streamjoin.spi.relation.Expressions.field;
import static io.streamjoin.spi.relation.Expressions.lessThan;
import static io.streamjoin.spi.relation.Expressions.multiply;
import static io.streamjoin.spi.relation.Expressions.not;
import static io.streamjoin.spi.relation.Expressions.or;
import static io.streamjoin.spi.relation.Expressions.subtract;
import static io.streamjoin.spi.relation.OperatorType.NEGATION;
import static io.streamjoin.sql.relational.RowExpressionInterpreter.evaluate;
import static io.streamjoin.sql.relational.RowExpressionInterpreter.evaluateLong;
import static io.streamjoin.sql.relational.RowExpressionInterpreter.isLongType;
import static io.streamjoin.sql.relational.RowExpressionInterpreter.isSupportedType;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class TestRowExpressionInterpreter
{
    private static final RowExpression TRUE = constant(true, BOOLEAN);
    private static final RowExpression FALSE = constant(false, BOOLEAN);
    private static final RowExpression NULL_BOOLEAN = constantNull(BOOLEAN);

    @Test
    public void testArithmetic()
    {
        Page page = rowPagesBuilder(BIGINT, BIGINT).row(7L, 3L).build().get(0);
        assertEquals(evaluateLong(add(field(0, BIGINT), field(1, BIGINT)), page, 0), Long.valueOf(10));
        assertEquals(evaluateLong(subtract(field(0, BIGINT), field(1, BIGINT)), page, 0), Long.valueOf(4));
        assertEquals(evaluateLong(multiply(field(0, BIGINT), constant(-2L, BIGINT)), page, 0), Long.valueOf(-14));
        assertEquals(evaluateLong(call(NEGATION, BIGINT, field(1, BIGINT)), page, 0), Long.valueOf(-3));
        // small integer constants are widened
        assertEquals(evaluateLong(add(field(0, BIGINT), constant(1, BIGINT)), page, 0), Long.valueOf(8));
    }

    @Test
    public void testNullPropagation()
    {
        Page page = rowPagesBuilder(BIGINT, BIGINT).row(null, 3L).build().get(0);
        assertNull(evaluateLong(add(field(0, BIGINT), field(1, BIGINT)), page, 0));
        assertNull(evaluate(lessThan(field(0, BIGINT), field(1, BIGINT)), page, 0));
        assertNull(evaluate(between(field(0, BIGINT), constant(0L, BIGINT), constant(5L, BIGINT)), page, 0));
        assertEquals(evaluate(between(field(1, BIGINT), constant(0L, BIGINT), constant(5L, BIGINT)), page, 0), true);
    }

    @Test
    public void testThreeValuedLogic()
    {
        Page page = rowPagesBuilder(BIGINT).row(1L).build().get(0);
        assertEquals(evaluate(and(TRUE, NULL_BOOLEAN), page, 0), null);
        assertEquals(evaluate(and(FALSE, NULL_BOOLEAN), page, 0), false);
        assertEquals(evaluate(or(TRUE, NULL_BOOLEAN), page, 0), true);
        assertEquals(evaluate(or(FALSE, NULL_BOOLEAN), page, 0), null);
        assertEquals(evaluate(not(NULL_BOOLEAN), page, 0), null);
        assertEquals(evaluate(not(FALSE), page, 0), true);
        assertEquals(evaluate(equal(TRUE, TRUE), page, 0), true);
    }

    @Test
    public void testOverflow()
    {
        Page page = rowPagesBuilder(BIGINT, INTEGER).row(Long.MAX_VALUE, (long) Integer.MAX_VALUE).build().get(0);
        assertOutOfRange(add(field(0, BIGINT), constant(1L, BIGINT)), page);
        assertOutOfRange(call(NEGATION, BIGINT, constant(Long.MIN_VALUE, BIGINT)), page);
        assertOutOfRange(add(field(1, INTEGER), constant(1L, INTEGER)), page);
    }

    @Test
    public void testSupportedTypes()
    {
        assertTrue(isLongType(BIGINT));
        assertTrue(isLongType(INTEGER));
        assertFalse(isLongType(BOOLEAN));
        assertTrue(isSupportedType(BOOLEAN));
        assertFalse(isSupportedType(VARCHAR));
    }

    private static void assertOutOfRange(RowExpression expression, Page page)
    {
        try {
            evaluate(expression, page, 0);
            fail("expected exception");
        }
        catch (StreamJoinException e) {
            assertEquals(e.getErrorCode(), NUMERIC_VALUE_OUT_OF_RANGE.toErrorCode());
        }
    }
}
