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

import static java.util.Objects.requireNonNull;

public final class StringValue
        extends TaggedValue
{
    private final String value;

    private StringValue(String value)
    {
        this.value = requireNonNull(value, "value is null");
    }

    public static StringValue of(String value)
    {
        return new StringValue(value);
    }

    public String getValue()
    {
        return value;
    }

    @Override
    public ValueTag getTag()
    {
        return ValueTag.STRING;
    }

    @Override
    public String asString()
    {
        return value;
    }

    @Override
    public boolean equals(Object obj)
    {
        return obj instanceof StringValue && ((StringValue) obj).value.equals(value);
    }

    @Override
    public int hashCode()
    {
        return value.hashCode();
    }

    @Override
    public String toString()
    {
        return '"' + value + '"';
    }
}
