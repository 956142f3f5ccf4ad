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
import io.blockagg.spi.block.RunLengthEncodedValueBlock;
import io.blockagg.spi.block.SelectionMask;
import io.blockagg.spi.block.ValueBlock;
import io.blockagg.spi.value.TaggedValue;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenCustomHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectMap;

import java.util.List;

import static io.blockagg.spi.value.TaggedValueHashStrategy.TAGGED_VALUE_HASH_STRATEGY;

public class BlockKeyPartitioner
        implements ChunkPartitioner
{
    private final boolean runLengthKeyShortcut;

    public BlockKeyPartitioner(boolean runLengthKeyShortcut)
    {
        this.runLengthKeyShortcut = runLengthKeyShortcut;
    }

    @Override
    public List<GroupPartition> partition(Chunk chunk)
    {
        SelectionMask mask = chunk.getMask();
        if (!mask.hasActivePositions()) {
            return ImmutableList.of();
        }

        ValueBlock keys = chunk.getKeyBlock();
        if (runLengthKeyShortcut && keys instanceof RunLengthEncodedValueBlock) {
            // every row has the same key
            return ImmutableList.of(new GroupPartition(((RunLengthEncodedValueBlock) keys).getValue(), mask));
        }

        // keys are registered in order of their first active row
        int positionCount = chunk.getPositionCount();
        Object2ObjectLinkedOpenCustomHashMap<TaggedValue, boolean[]> matchesByKey = new Object2ObjectLinkedOpenCustomHashMap<>(TAGGED_VALUE_HASH_STRATEGY);
        for (int position : mask.getActivePositions()) {
            TaggedValue key = keys.getValue(position);
            if (!matchesByKey.containsKey(key)) {
                matchesByKey.put(key, new boolean[positionCount]);
            }
        }
        for (int position = 0; position < positionCount; position++) {
            boolean[] matches = matchesByKey.get(keys.getValue(position));
            if (matches != null) {
                matches[position] = true;
            }
        }

        ImmutableList.Builder<GroupPartition> partitions = ImmutableList.builderWithExpectedSize(matchesByKey.size());
        for (Object2ObjectMap.Entry<TaggedValue, boolean[]> entry : matchesByKey.object2ObjectEntrySet()) {
            partitions.add(new GroupPartition(entry.getKey(), mask.and(SelectionMask.wrap(entry.getValue()))));
        }
        return partitions.build();
    }
}
