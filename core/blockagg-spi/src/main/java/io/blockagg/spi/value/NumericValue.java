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

/**
 * Common view over the numeric variants.
 */
public abstract class NumericValue
        extends TaggedValue
{
    NumericValue() {}

    public abstract double doubleValue();

    /**
     * Exact decimal representation. Only defined for finite values.
     */
    public abstract BigDecimal toBigDecimal();

    public boolean isFinite()
    {
        return true;
    }

    public boolean isNaN()
    {
        return false;
    }

    @Override
    public NumericValue asNumeric()
    {
        return this;
    }
}
