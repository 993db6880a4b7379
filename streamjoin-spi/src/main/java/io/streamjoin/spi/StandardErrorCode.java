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
package io.streamjoin.spi;

import static io.streamjoin.spi.ErrorType.INTERNAL_ERROR;
import static io.streamjoin.spi.ErrorType.USER_ERROR;

public enum StandardErrorCode
        implements ErrorCodeSupplier
{
    INVALID_JOIN_CRITERIA(0x0000_0000, USER_ERROR),
    TYPE_MISMATCH(0x0000_0001, USER_ERROR),
    MISSING_INPUT_ORDERING(0x0000_0002, USER_ERROR),
    INVALID_JOIN_FILTER(0x0000_0003, USER_ERROR),
    INVALID_PLAN(0x0000_0004, USER_ERROR),
    NUMERIC_VALUE_OUT_OF_RANGE(0x0000_0005, USER_ERROR),
    NOT_SUPPORTED(0x0000_0006, USER_ERROR),

    GENERIC_INTERNAL_ERROR(0x0001_0000, INTERNAL_ERROR),
    INPUT_ORDER_VIOLATION(0x0001_0001, INTERNAL_ERROR),
    /**/;

    private final ErrorCode errorCode;

    StandardErrorCode(int code, ErrorType type)
    {
        errorCode = new ErrorCode(code, name(), type);
    }

    @Override
    public ErrorCode toErrorCode()
    {
        return errorCode;
    }
}
