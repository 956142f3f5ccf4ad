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
package io.blockagg.spi.value;

import java.math.BigDecimal;

public final class Int64Value
        extends NumericValue
{
    private final long value;

    private Int64Value(long value)
    {
        this.value = value;
    }

    public static Int64Value of(long value)
    {
        return new Int64Value(value);
    }

    public long getValue()
    {
        return value;
    }

    @Override
    public ValueTag getTag()
    {
        return ValueTag.INT64;
    }

    @Override
    public double doubleValue()
    {
        return value;
    }

    @Override
    public BigDecimal toBigDecimal()
    {
        return BigDecimal.valueOf(value);
    }

    @Override
    public boolean equals(Object obj)
    {
        return obj instanceof Int64Value && ((Int64Value) obj).value == value;
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode(value);
    }

    @Override
    public String toString()
    {
        return value + "L";
    }
}
