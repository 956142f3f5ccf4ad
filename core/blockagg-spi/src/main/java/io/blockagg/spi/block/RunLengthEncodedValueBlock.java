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

import io.blockagg.spi.value.TaggedValue;
import org.openjdk.jol.info.ClassLayout;

import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A block holding the same value at every position.
 */
public class RunLengthEncodedValueBlock
        implements ValueBlock
{
    private static final long INSTANCE_SIZE = ClassLayout.parseClass(RunLengthEncodedValueBlock.class).instanceSize();

    private final TaggedValue value;
    private final int positionCount;

    public RunLengthEncodedValueBlock(TaggedValue value, int positionCount)
    {
        this.value = requireNonNull(value, "value is null");
        checkArgument(positionCount >= 0, "positionCount is negative");
        this.positionCount = positionCount;
    }

    public TaggedValue getValue()
    {
        return value;
    }

    @Override
    public int getPositionCount()
    {
        return positionCount;
    }

    @Override
    public TaggedValue getValue(int position)
    {
        checkElementIndex(position, positionCount);
        return value;
    }

    @Override
    public List<TaggedValue> extract()
    {
        return Collections.nCopies(positionCount, value);
    }

    @Override
    public long getRetainedSizeInBytes()
    {
        return INSTANCE_SIZE;
    }

    @Override
    public String toString()
    {
        return format("RLE{value=%s, positionCount=%s}", value, positionCount);
    }
}
