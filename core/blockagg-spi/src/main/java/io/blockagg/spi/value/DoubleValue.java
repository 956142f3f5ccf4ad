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

import io.blockagg.spi.BlockaggException;

import java.math.BigDecimal;

import static io.blockagg.spi.StandardErrorCode.NUMERIC_VALUE_OUT_OF_RANGE;
import static java.lang.String.format;

public final class DoubleValue
        extends NumericValue
{
    private final double value;

    private DoubleValue(double value)
    {
        this.value = value;
    }

    public static DoubleValue of(double value)
    {
        return new DoubleValue(value);
    }

    public double getValue()
    {
        return value;
    }

    @Override
    public ValueTag getTag()
    {
        return ValueTag.DOUBLE;
    }

    @Override
    public double doubleValue()
    {
        return value;
    }

    @Override
    public BigDecimal toBigDecimal()
    {
        if (!isFinite()) {
            throw new BlockaggException(NUMERIC_VALUE_OUT_OF_RANGE, format("%s has no decimal representation", value));
        }
        return new BigDecimal(value);
    }

    @Override
    public boolean isFinite()
    {
        return Double.isFinite(value);
    }

    @Override
    public boolean isNaN()
    {
        return Double.isNaN(value);
    }

    @Override
    public boolean equals(Object obj)
    {
        return obj instanceof DoubleValue && Double.compare(((DoubleValue) obj).value, value) == 0;
    }

    @Override
    public int hashCode()
    {
        return Double.hashCode(value);
    }

    @Override
    public String toString()
    {
        return value + "d";
    }
}
