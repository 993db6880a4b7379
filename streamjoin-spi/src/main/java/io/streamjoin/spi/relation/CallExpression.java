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

import javax.annotation.concurrent.Immutable;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

@Immutable
public final class CallExpression
        extends RowExpression
{
    private final OperatorType operator;
    private final Type returnType;
    private final List<RowExpression> arguments;

    public CallExpression(OperatorType operator, Type returnType, List<RowExpression> arguments)
    {
        this.operator = requireNonNull(operator, "operator is null");
        this.returnType = requireNonNull(returnType, "returnType is null");
        this.arguments = ImmutableList.copyOf(requireNonNull(arguments, "arguments is null"));
        if (operator == OperatorType.NEGATION) {
            checkArgument(this.arguments.size() == 1, "%s expects one argument", operator);
        }
        else {
            checkArgument(this.arguments.size() == 2, "%s expects two arguments", operator);
        }
    }

    public OperatorType getOperator()
    {
        return operator;
    }

    @Override
    public Type getType()
    {
        return returnType;
    }

    public List<RowExpression> getArguments()
    {
        return arguments;
    }

    @Override
    public List<RowExpression> getChildren()
    {
        return arguments;
    }

    @Override
    public String toString()
    {
        if (arguments.size() == 1) {
            return operator.getOperator() + arguments.get(0);
        }
        return arguments.stream()
                .map(Object::toString)
                .collect(joining(" " + operator.getOperator() + " ", "(", ")"));
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(operator, returnType, arguments);
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        CallExpression other = (CallExpression) obj;
        return this.operator == other.operator &&
                Objects.equals(this.returnType, other.returnType) &&
                Objects.equals(this.arguments, other.arguments);
    }

    @Override
    public <R, C> R accept(RowExpressionVisitor<R, C> visitor, C context)
    {
        return visitor.visitCall(this, context);
    }
}
