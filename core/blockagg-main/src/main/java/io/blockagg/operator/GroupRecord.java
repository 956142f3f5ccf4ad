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
package io.blockagg.operator;

import com.google.common.collect.ImmutableList;
import io.blockagg.spi.block.ValueBlock;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Output record for one group: the group key followed by one field per accumulator. Every field is
 * a block with a single position.
 */
public final class GroupRecord
{
    private final List<ValueBlock> fields;

    public GroupRecord(List<ValueBlock> fields)
    {
        this.fields = ImmutableList.copyOf(requireNonNull(fields, "fields is null"));
        checkArgument(!this.fields.isEmpty(), "record has no key field");
        for (ValueBlock field : this.fields) {
            checkArgument(field.getPositionCount() == 1, "record fields must have a single position, but got %s", field.getPositionCount());
        }
    }

    public ValueBlock getKey()
    {
        return fields.get(0);
    }

    public ValueBlock getAccumulatorField(int accumulatorIndex)
    {
        return fields.get(accumulatorIndex + 1);
    }

    public int getFieldCount()
    {
        return fields.size();
    }

    public ValueBlock getField(int index)
    {
        return fields.get(index);
    }

    public List<ValueBlock> getFields()
    {
        return fields;
    }

    @Override
    public String toString()
    {
        return fields.toString();
    }
}
