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

public final class BooleanValue
        extends TaggedValue
{
    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    private final boolean value;

    private BooleanValue(boolean value)
    {
        this.value = value;
    }

    public static BooleanValue of(boolean value)
    {
        return value ? TRUE : FALSE;
    }

    public boolean getValue()
    {
        return value;
    }

    @Override
    public ValueTag getTag()
    {
        return ValueTag.BOOLEAN;
    }

    @Override
    public boolean asBoolean()
    {
        return value;
    }

    @Override
    public boolean equals(Object obj)
    {
        return obj instanceof BooleanValue && ((BooleanValue) obj).value == value;
    }

    @Override
    public int hashCode()
    {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString()
    {
        return String.valueOf(value);
    }
}
