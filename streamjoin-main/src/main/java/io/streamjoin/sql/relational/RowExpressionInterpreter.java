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
import com.facebook.presto.common.block.Block;
import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableSet;
import io.streamjoin.spi.StreamJoinException;
import io.streamjoin.spi.relation.CallExpression;
import io.streamjoin.spi.relation.ConstantExpression;
import io.streamjoin.spi.relation.InputReferenceExpression;
import io.streamjoin.spi.relation.OperatorType;
import io.streamjoin.spi.relation.RowExpression;
import io.streamjoin.spi.relation.RowExpressionVisitor;
import io.streamjoin.spi.relation.SpecialFormExpression;

import javax.annotation.Nullable;

import java.util.List;
import java.util.Set;

import static com.facebook.presto.common.type.BigintType.BIGINT;
import static com.facebook.presto.common.type.BooleanType.BOOLEAN;
import static com.facebook.presto.common.type.DateType.DATE;
import static com.facebook.presto.common.type.IntegerType.INTEGER;
import static com.facebook.presto.common.type.SmallintType.SMALLINT;
import static com.facebook.presto.common.type.TimestampType.TIMESTAMP;
import static com.facebook.presto.common.type.TinyintType.TINYINT;
import static io.streamjoin.spi.StandardErrorCode.NOT_SUPPORTED;
import static io.streamjoin.spi.StandardErrorCode.NUMERIC_VALUE_OUT_OF_RANGE;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Evaluates row expressions one row at a time. Values of long-backed types are
 * {@link Long}, booleans are {@link Boolean}, and SQL null is {@code null}: arithmetic
 * and comparisons on null produce null, and AND / OR / NOT follow three-valued logic.
 */
public final class RowExpressionInterpreter
{
    private static final Set<Type> LONG_TYPES = ImmutableSet.of(BIGINT, INTEGER, SMALLINT, TINYINT, DATE, TIMESTAMP);

    private static final Visitor VISITOR = new Visitor();

    private RowExpressionInterpreter()
    {
    }

    /**
     * Supplies the value of an input reference for the row being evaluated.
     */
    public interface InputResolver
    {
        @Nullable
        Object getValue(InputReferenceExpression reference);
    }

    public static boolean isLongType(Type type)
    {
        return LONG_TYPES.contains(type);
    }

    public static boolean isSupportedType(Type type)
    {
        return isLongType(type) || BOOLEAN.equals(type);
    }

    @Nullable
    public static Object evaluate(RowExpression expression, InputResolver resolver)
    {
        return expression.accept(VISITOR, requireNonNull(resolver, "resolver is null"));
    }

    /**
     * Evaluates {@code expression} against a row of {@code page}; field {@code i} of the expression reads channel {@code i}.
     */
    @Nullable
    public static Object evaluate(RowExpression expression, Page page, int position)
    {
        return evaluate(expression, reference -> readValue(reference.getType(), page.getBlock(reference.getField()), position));
    }

    /**
     * Evaluates a long-valued expression, returning null for SQL null.
     */
    @Nullable
    public static Long evaluateLong(RowExpression expression, Page page, int position)
    {
        return (Long) evaluate(expression, page, position);
    }

    @Nullable
    public static Object readValue(Type type, Block block, int position)
    {
        if (block.isNull(position)) {
            return null;
        }
        if (BOOLEAN.equals(type)) {
            return type.getBoolean(block, position);
        }
        if (isLongType(type)) {
            return type.getLong(block, position);
        }
        throw new StreamJoinException(NOT_SUPPORTED, "Unsupported type in expression: " + type);
    }

    private static class Visitor
            implements RowExpressionVisitor<Object, InputResolver>
    {
        @Override
        public Object visitInputReference(InputReferenceExpression reference, InputResolver context)
        {
            return context.getValue(reference);
        }

        @Override
        public Object visitConstant(ConstantExpression literal, InputResolver context)
        {
            Object value = literal.getValue();
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            return value;
        }

        @Override
        public Object visitCall(CallExpression call, InputResolver context)
        {
            List<RowExpression> arguments = call.getArguments();
            Object left = arguments.get(0).accept(this, context);
            if (call.getOperator() == OperatorType.NEGATION) {
                if (left == null) {
                    return null;
                }
                return arithmetic(call.getOperator(), call.getType(), 0, (Long) left);
            }
            Object right = arguments.get(1).accept(this, context);
            if (left == null || right == null) {
                return null;
            }
            if (call.getOperator().isComparisonOperator()) {
                return compare(call.getOperator(), toLong(left), toLong(right));
            }
            return arithmetic(call.getOperator(), call.getType(), (Long) left, (Long) right);
        }

        @Override
        public Object visitSpecialForm(SpecialFormExpression specialForm, InputResolver context)
        {
            switch (specialForm.getForm()) {
                case AND: {
                    boolean hasNull = false;
                    for (RowExpression argument : specialForm.getArguments()) {
                        Boolean value = (Boolean) argument.accept(this, context);
                        if (value == null) {
                            hasNull = true;
                        }
                        else if (!value) {
                            return false;
                        }
                    }
                    return hasNull ? null : true;
                }
                case OR: {
                    boolean hasNull = false;
                    for (RowExpression argument : specialForm.getArguments()) {
                        Boolean value = (Boolean) argument.accept(this, context);
                        if (value == null) {
                            hasNull = true;
                        }
                        else if (value) {
                            return true;
                        }
                    }
                    return hasNull ? null : false;
                }
                case NOT: {
                    Boolean value = (Boolean) specialForm.getArguments().get(0).accept(this, context);
                    return value == null ? null : !value;
                }
                default:
                    throw new StreamJoinException(NOT_SUPPORTED, "Unsupported special form: " + specialForm.getForm());
            }
        }

        private static long toLong(Object value)
        {
            if (value instanceof Boolean) {
                return ((Boolean) value) ? 1 : 0;
            }
            return (Long) value;
        }

        private static boolean compare(OperatorType operator, long left, long right)
        {
            switch (operator) {
                case EQUAL:
                    return left == right;
                case NOT_EQUAL:
                    return left != right;
                case LESS_THAN:
                    return left < right;
                case LESS_THAN_OR_EQUAL:
                    return left <= right;
                case GREATER_THAN:
                    return left > right;
                case GREATER_THAN_OR_EQUAL:
                    return left >= right;
                default:
                    throw new IllegalArgumentException("Not a comparison operator: " + operator);
            }
        }

        private static long arithmetic(OperatorType operator, Type type, long left, long right)
        {
            long result;
            try {
                switch (operator) {
                    case ADD:
                        result = Math.addExact(left, right);
                        break;
                    case SUBTRACT:
                        result = Math.subtractExact(left, right);
                        break;
                    case MULTIPLY:
                        result = Math.multiplyExact(left, right);
                        break;
                    case NEGATION:
                        result = Math.negateExact(right);
                        break;
                    default:
                        throw new IllegalArgumentException("Not an arithmetic operator: " + operator);
                }
            }
            catch (ArithmeticException e) {
                throw new StreamJoinException(NUMERIC_VALUE_OUT_OF_RANGE, format("%s %s %s overflows %s", left, operator.getOperator(), right, type), e);
            }
            checkRange(type, result);
            return result;
        }

        private static void checkRange(Type type, long value)
        {
            long min;
            long max;
            if (INTEGER.equals(type) || DATE.equals(type)) {
                min = Integer.MIN_VALUE;
                max = Integer.MAX_VALUE;
            }
            else if (SMALLINT.equals(type)) {
                min = Short.MIN_VALUE;
                max = Short.MAX_VALUE;
            }
            else if (TINYINT.equals(type)) {
                min = Byte.MIN_VALUE;
                max = Byte.MAX_VALUE;
            }
            else {
                return;
            }
            if (value < min || value > max) {
                throw new StreamJoinException(NUMERIC_VALUE_OUT_OF_RANGE, format("Value %s is out of range for %s", value, type));
            }
        }
    }
}
