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

public enum OperatorType
{
    ADD("+", false),
    SUBTRACT("-", false),
    MULTIPLY("*", false),
    NEGATION("-", false),
    EQUAL("=", true),
    NOT_EQUAL("<>", true),
    LESS_THAN("<", true),
    LESS_THAN_OR_EQUAL("<=", true),
    GREATER_THAN(">", true),
    GREATER_THAN_OR_EQUAL(">=", true);

    private final String operator;
    private final boolean comparisonOperator;

    OperatorType(String operator, boolean comparisonOperator)
    {
        this.operator = operator;
        this.comparisonOperator = comparisonOperator;
    }

    public String getOperator()
    {
        return operator;
    }

    public boolean isComparisonOperator()
    {
        return comparisonOperator;
    }

    public boolean isArithmeticOperator()
    {
        return !comparisonOperator;
    }

    /**
     * Returns the operator that holds when the operands are swapped, e.g. {@code a < b} iff {@code b > a}.
     */
    public OperatorType flip()
    {
        switch (this) {
            case EQUAL:
            case NOT_EQUAL:
                return this;
            case LESS_THAN:
                return GREATER_THAN;
            case LESS_THAN_OR_EQUAL:
                return GREATER_THAN_OR_EQUAL;
            case GREATER_THAN:
                return LESS_THAN;
            case GREATER_THAN_OR_EQUAL:
                return LESS_THAN_OR_EQUAL;
            default:
                throw new UnsupportedOperationException("Operator can not be flipped: " + this);
        }
    }
}
