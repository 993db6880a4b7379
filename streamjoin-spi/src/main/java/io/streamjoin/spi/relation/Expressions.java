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
package io.streamjoin.spi.relation;

import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static com.facebook.presto.common.type.BooleanType.BOOLEAN;
import static io.streamjoin.spi.relation.OperatorType.ADD;
import static io.streamjoin.spi.relation.OperatorType.EQUAL;
import static io.streamjoin.spi.relation.OperatorType.GREATER_THAN;
import static io.streamjoin.spi.relation.OperatorType.GREATER_THAN_OR_EQUAL;
import static io.streamjoin.spi.relation.OperatorType.LESS_THAN;
import static io.streamjoin.spi.relation.OperatorType.LESS_THAN_OR_EQUAL;
import static io.streamjoin.spi.relation.OperatorType.MULTIPLY;
import static io.streamjoin.spi.relation.OperatorType.SUBTRACT;
import static io.streamjoin.spi.relation.SpecialFormExpression.Form.AND;
import static io.streamjoin.spi.relation.SpecialFormExpression.Form.OR;

public final class Expressions
{
    private Expressions()
    {
    }

    public static InputReferenceExpression field(int field, Type type)
    {
        return new InputReferenceExpression(field, type);
    }

    public static ConstantExpression constant(Object value, Type type)
    {
        return new ConstantExpression(value, type);
    }

    public static ConstantExpression constantNull(Type type)
    {
        return new ConstantExpression(null, type);
    }

    public static CallExpression call(OperatorType operator, Type returnType, RowExpression... arguments)
    {
        return new CallExpression(operator, returnType, ImmutableList.copyOf(arguments));
    }

    public static CallExpression add(RowExpression left, RowExpression right)
    {
        return call(ADD, left.getType(), left, right);
    }

    public static CallExpression subtract(RowExpression left, RowExpression right)
    {
        return call(SUBTRACT, left.getType(), left, right);
    }

    public static CallExpression multiply(RowExpression left, RowExpression right)
    {
        return call(MULTIPLY, left.getType(), left, right);
    }

    public static CallExpression comparison(OperatorType operator, RowExpression left, RowExpression right)
    {
        return call(operator, BOOLEAN, left, right);
    }

    public static CallExpression equal(RowExpression left, RowExpression right)
    {
        return comparison(EQUAL, left, right);
    }

    public static CallExpression lessThan(RowExpression left, RowExpression right)
    {
        return comparison(LESS_THAN, left, right);
    }

    public static CallExpression lessThanOrEqual(RowExpression left, RowExpression right)
    {
        return comparison(LESS_THAN_OR_EQUAL, left, right);
    }

    public static CallExpression greaterThan(RowExpression left, RowExpression right)
    {
        return comparison(GREATER_THAN, left, right);
    }

    public static CallExpression greaterThanOrEqual(RowExpression left, RowExpression right)
    {
        return comparison(GREATER_THAN_OR_EQUAL, left, right);
    }

    public static SpecialFormExpression and(RowExpression... arguments)
    {
        return new SpecialFormExpression(AND, BOOLEAN, ImmutableList.copyOf(arguments));
    }

    public static SpecialFormExpression or(RowExpression... arguments)
    {
        return new SpecialFormExpression(OR, BOOLEAN, ImmutableList.copyOf(arguments));
    }

    public static SpecialFormExpression not(RowExpression argument)
    {
        return new SpecialFormExpression(SpecialFormExpression.Form.NOT, BOOLEAN, ImmutableList.of(argument));
    }

    /**
     * {@code value BETWEEN min AND max}, expressed as {@code value >= min AND value <= max}.
     */
    public static SpecialFormExpression between(RowExpression value, RowExpression min, RowExpression max)
    {
        return and(greaterThanOrEqual(value, min), lessThanOrEqual(value, max));
    }

    /**
     * Returns all distinct sub-expressions of {@code expression}, including itself, in pre-order.
     */
    public static List<RowExpression> subExpressions(RowExpression expression)
    {
        Set<RowExpression> result = new LinkedHashSet<>();
        Deque<RowExpression> stack = new ArrayDeque<>();
        stack.push(expression);
        while (!stack.isEmpty()) {
            RowExpression current = stack.pop();
            result.add(current);
            List<RowExpression> children = current.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return ImmutableList.copyOf(result);
    }

    /**
     * Returns the distinct input references used by {@code expression}, in order of first appearance.
     */
    public static List<InputReferenceExpression> inputReferences(RowExpression expression)
    {
        return subExpressions(expression).stream()
                .filter(InputReferenceExpression.class::isInstance)
                .map(InputReferenceExpression.class::cast)
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Rebuilds {@code expression} bottom-up, replacing every input reference with the result of {@code rewriter}.
     */
    public static RowExpression rewriteInputReferences(RowExpression expression, Function<InputReferenceExpression, RowExpression> rewriter)
    {
        return expression.accept(new RowExpressionVisitor<RowExpression, Void>()
        {
            @Override
            public RowExpression visitInputReference(InputReferenceExpression reference, Void context)
            {
                return rewriter.apply(reference);
            }

            @Override
            public RowExpression visitConstant(ConstantExpression literal, Void context)
            {
                return literal;
            }

            @Override
            public RowExpression visitCall(CallExpression call, Void context)
            {
                ImmutableList.Builder<RowExpression> arguments = ImmutableList.builder();
                for (RowExpression argument : call.getArguments()) {
                    arguments.add(argument.accept(this, context));
                }
                return new CallExpression(call.getOperator(), call.getType(), arguments.build());
            }

            @Override
            public RowExpression visitSpecialForm(SpecialFormExpression specialForm, Void context)
            {
                ImmutableList.Builder<RowExpression> arguments = ImmutableList.builder();
                for (RowExpression argument : specialForm.getArguments()) {
                    arguments.add(argument.accept(this, context));
                }
                return new SpecialFormExpression(specialForm.getForm(), specialForm.getType(), arguments.build());
            }
        }, null);
    }
}
