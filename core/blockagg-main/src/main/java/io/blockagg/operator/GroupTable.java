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

import io.blockagg.operator.aggregation.AccumulatorState;
import io.blockagg.operator.aggregation.RowCombiner;
import io.blockagg.spi.BlockaggException;
import io.blockagg.spi.value.TaggedValue;
import it.unimi.dsi.fastutil.Hash;
import it.unimi.dsi.fastutil.objects.Object2IntOpenCustomHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.openjdk.jol.info.ClassLayout;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;
import static io.airlift.slice.SizeOf.sizeOfIntArray;
import static io.airlift.slice.SizeOf.sizeOfObjectArray;
import static io.blockagg.spi.StandardErrorCode.GENERIC_INTERNAL_ERROR;
import static io.blockagg.spi.value.TaggedValueHashStrategy.TAGGED_VALUE_HASH_STRATEGY;
import static it.unimi.dsi.fastutil.HashCommon.arraySize;
import static java.lang.Math.max;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps each group key to the running states of its accumulators. Groups are created on their
 * first contribution and receive dense ids in creation order. There is no capacity bound: memory
 * grows with the number of distinct keys.
 */
public class GroupTable
{
    private static final long INSTANCE_SIZE = ClassLayout.parseClass(GroupTable.class).instanceSize();

    private final RowCombiner[] combiners;
    private final int expectedGroups;

    private final Object2IntOpenCustomHashMap<TaggedValue> groupIdsByKey;
    // reverse index from the groupId back to the key
    private final ObjectArrayList<TaggedValue> keysByGroupId;
    private final ObjectArrayList<AccumulatorState[]> statesByGroupId;

    private boolean frozen;

    public GroupTable(List<RowCombiner> combiners, int expectedGroups)
    {
        requireNonNull(combiners, "combiners is null");
        checkArgument(expectedGroups > 0, "expectedGroups must be greater than zero");
        this.combiners = combiners.toArray(new RowCombiner[0]);
        this.expectedGroups = expectedGroups;
        this.groupIdsByKey = new Object2IntOpenCustomHashMap<>(expectedGroups, Hash.DEFAULT_LOAD_FACTOR, TAGGED_VALUE_HASH_STRATEGY);
        this.groupIdsByKey.defaultReturnValue(-1);
        this.keysByGroupId = new ObjectArrayList<>(expectedGroups);
        this.statesByGroupId = new ObjectArrayList<>(expectedGroups);
    }

    public int getAccumulatorCount()
    {
        return combiners.length;
    }

    public int getGroupCount()
    {
        return keysByGroupId.size();
    }

    /**
     * Combines {@code partial} into the state of accumulator {@code accumulatorIndex} of the
     * group {@code key}, creating the group if this is its first contribution.
     */
    public void contribute(TaggedValue key, int accumulatorIndex, TaggedValue partial)
    {
        checkElementIndex(accumulatorIndex, combiners.length, "accumulatorIndex");
        requireNonNull(partial, "partial is null");
        int groupId = getOrCreateGroupId(key);
        combine(groupId, accumulatorIndex, partial);
    }

    /**
     * Combines one partial per accumulator into the states of the group {@code key}.
     */
    public void contribute(TaggedValue key, TaggedValue[] partials)
    {
        checkArgument(partials.length == combiners.length, "expected %s partials, but got %s", combiners.length, partials.length);
        int groupId = getOrCreateGroupId(key);
        for (int i = 0; i < partials.length; i++) {
            combine(groupId, i, requireNonNull(partials[i], "partial is null"));
        }
    }

    public Optional<GroupEntry> getGroup(TaggedValue key)
    {
        int groupId = groupIdsByKey.getInt(requireNonNull(key, "key is null"));
        if (groupId < 0) {
            return Optional.empty();
        }
        return Optional.of(getEntry(groupId));
    }

    public GroupEntry getEntry(int groupId)
    {
        checkElementIndex(groupId, getGroupCount(), "groupId");
        return new GroupEntry(keysByGroupId.get(groupId), Arrays.asList(statesByGroupId.get(groupId)));
    }

    public TaggedValue getKey(int groupId)
    {
        checkElementIndex(groupId, getGroupCount(), "groupId");
        return keysByGroupId.get(groupId);
    }

    public AccumulatorState getState(int groupId, int accumulatorIndex)
    {
        checkElementIndex(groupId, getGroupCount(), "groupId");
        checkElementIndex(accumulatorIndex, combiners.length, "accumulatorIndex");
        return statesByGroupId.get(groupId)[accumulatorIndex];
    }

    /**
     * Makes the table read-only. Called once accumulation is complete.
     */
    public void freeze()
    {
        frozen = true;
    }

    public boolean isFrozen()
    {
        return frozen;
    }

    public long getEstimatedSize()
    {
        int hashCapacity = arraySize(max(groupIdsByKey.size(), expectedGroups), Hash.DEFAULT_LOAD_FACTOR);
        long hashSize = sizeOfIntArray(hashCapacity) + sizeOfObjectArray(hashCapacity);
        long statesSize = (long) statesByGroupId.size() * sizeOfObjectArray(combiners.length);
        return INSTANCE_SIZE +
                hashSize +
                sizeOfObjectArray(keysByGroupId.size()) +
                sizeOfObjectArray(statesByGroupId.size()) +
                statesSize;
    }

    private int getOrCreateGroupId(TaggedValue key)
    {
        checkState(!frozen, "group table is frozen");
        requireNonNull(key, "key is null");
        int groupId = groupIdsByKey.getInt(key);
        if (groupId >= 0) {
            return groupId;
        }

        groupId = keysByGroupId.size();
        AccumulatorState[] states = new AccumulatorState[combiners.length];
        Arrays.fill(states, AccumulatorState.absent());
        keysByGroupId.add(key);
        statesByGroupId.add(states);
        groupIdsByKey.put(key, groupId);
        return groupId;
    }

    private void combine(int groupId, int accumulatorIndex, TaggedValue partial)
    {
        AccumulatorState[] states = statesByGroupId.get(groupId);
        AccumulatorState state = combiners[accumulatorIndex].combine(states[accumulatorIndex], partial);
        if (state == null || state.isAbsent()) {
            throw new BlockaggException(GENERIC_INTERNAL_ERROR, format("Row combiner %s produced no state for key %s", accumulatorIndex, keysByGroupId.get(groupId)));
        }
        states[accumulatorIndex] = state;
    }
}
