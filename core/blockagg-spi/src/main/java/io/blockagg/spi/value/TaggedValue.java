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

import static io.blockagg.spi.StandardErrorCode.TYPE_MISMATCH;
import static java.lang.String.format;

/**
 * A dynamically typed scalar. The set of variants is closed: every subclass lives in this package.
 * <p>
 * {@link #equals(Object)} and {@link #hashCode()} are strict: two values are equal only if they are
 * the same variant with the same payload. Use {@link TaggedValues} or {@link TaggedValueHashStrategy}
 * for value-system equality, where {@code Int32(1)} and {@code Double(1.0)} are the same key.
 */
public abstract class TaggedValue
{
    TaggedValue() {}

    public abstract ValueTag getTag();

    public final boolean isNull()
    {
        return getTag() == ValueTag.NULL;
    }

    public final boolean isNumeric()
    {
        return getTag().isNumeric();
    }

    public NumericValue asNumeric()
    {
        throw new BlockaggException(TYPE_MISMATCH, format("Expected a numeric value but got %s", getTag()));
    }

    public boolean asBoolean()
    {
        throw new BlockaggException(TYPE_MISMATCH, format("Expected a boolean value but got %s", getTag()));
    }

    public String asString()
    {
        throw new BlockaggException(TYPE_MISMATCH, format("Expected a string value but got %s", getTag()));
    }
}
