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

import static java.util.Objects.requireNonNull;

public final class DecimalValue
        extends NumericValue
{
    private final BigDecimal value;

    private DecimalValue(BigDecimal value)
    {
        this.value = requireNonNull(value, "value is null");
    }

    public static DecimalValue of(BigDecimal value)
    {
        return new DecimalValue(value);
    }

    public static DecimalValue of(String value)
    {
        return new DecimalValue(new BigDecimal(value));
    }

    public BigDecimal getValue()
    {
        return value;
    }

    @Override
    public ValueTag getTag()
    {
        return ValueTag.DECIMAL;
    }

    @Override
    public double doubleValue()
    {
        return value.doubleValue();
    }

    @Override
    public BigDecimal toBigDecimal()
    {
        return value;
    }

    @Override
    public boolean equals(Object obj)
    {
        // scale sensitive: 1.0 and 1.00 are different payloads
        return obj instanceof DecimalValue && ((DecimalValue) obj).value.equals(value);
    }

    @Override
    public int hashCode()
    {
        return value.hashCode();
    }

    @Override
    public String toString()
    {
        return value.toPlainString() + "m";
    }
}
