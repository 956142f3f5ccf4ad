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
package io.blockagg.spi;

import static io.blockagg.spi.ErrorType.INTERNAL_ERROR;
import static io.blockagg.spi.ErrorType.USER_ERROR;

public enum StandardErrorCode
        implements ErrorCodeSupplier
{
    TYPE_MISMATCH(1, USER_ERROR),
    NUMERIC_VALUE_OUT_OF_RANGE(2, USER_ERROR),
    INVALID_CHUNK(3, USER_ERROR),

    GENERIC_INTERNAL_ERROR(65536, INTERNAL_ERROR),
    INVALID_ACCUMULATOR_ARITY(65537, INTERNAL_ERROR),
    UNKNOWN_ACCUMULATOR_FUNCTION(65538, INTERNAL_ERROR),
    KEY_SHAPE_MISMATCH(65539, INTERNAL_ERROR),
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
