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
package io.blockagg.spi.block;

import com.google.common.collect.ImmutableList;
import io.blockagg.spi.value.TaggedValue;
import org.openjdk.jol.info.ClassLayout;

import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkElementIndex;
import static io.airlift.slice.SizeOf.sizeOf;
import static java.util.Objects.requireNonNull;

public class ArrayValueBlock
        implements ValueBlock
{
    private static final long INSTANCE_SIZE = ClassLayout.parseClass(ArrayValueBlock.class).instanceSize();

    private final TaggedValue[] values;

    public ArrayValueBlock(TaggedValue[] values)
    {
        requireNonNull(values, "values is null");
        for (int i = 0; i < values.length; i++) {
            requireNonNull(values[i], "values contains null");
        }
        this.values = values;
    }

    public static ArrayValueBlock of(TaggedValue... values)
    {
        return new ArrayValueBlock(values.clone());
    }

    public static ArrayValueBlock of(List<? extends TaggedValue> values)
    {
        return new ArrayValueBlock(values.toArray(new TaggedValue[0]));
    }

    /**
     * A block of length one, the shape every output field is delivered in.
     */
    public static ArrayValueBlock singleton(TaggedValue value)
    {
        return new ArrayValueBlock(new TaggedValue[] {value});
    }

    @Override
    public int getPositionCount()
    {
        return values.length;
    }

    @Override
    public TaggedValue getValue(int position)
    {
        checkElementIndex(position, values.length);
        return values[position];
    }

    @Override
    public List<TaggedValue> extract()
    {
        return ImmutableList.copyOf(values);
    }

    @Override
    public long getRetainedSizeInBytes()
    {
        return INSTANCE_SIZE + sizeOf(values);
    }

    @Override
    public String toString()
    {
        return Arrays.toString(values);
    }
}
