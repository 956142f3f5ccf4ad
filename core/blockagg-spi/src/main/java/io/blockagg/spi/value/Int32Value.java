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

public final class Int32Value
        extends NumericValue
{
    private final int value;

    private Int32Value(int value)
    {
        this.value = value;
    }

    public static Int32Value of(int value)
    {
        return new Int32Value(value);
    }

    public int getValue()
    {
        return value;
    }

    @Override
    public ValueTag getTag()
    {
        return ValueTag.INT32;
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
        return obj instanceof Int32Value && ((Int32Value) obj).value == value;
    }

    @Override
    public int hashCode()
    {
        return Integer.hashCode(value);
    }

    @Override
    public String toString()
    {
        return String.valueOf(value);
    }
}
