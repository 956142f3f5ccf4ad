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
import io.blockagg.operator.aggregation.AccumulatorState;
import io.blockagg.spi.block.ArrayValueBlock;
import io.blockagg.spi.block.ValueBlock;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Verify.verify;
import static java.util.Objects.requireNonNull;

/**
 * Materializes a finished {@link GroupTable} into a {@link GroupedResult}. Can be built only once;
 * building freezes the table.
 */
public class GroupedResultBuilder
{
    private final GroupTable groupTable;
    private boolean built;

    public GroupedResultBuilder(GroupTable groupTable)
    {
        this.groupTable = requireNonNull(groupTable, "groupTable is null");
    }

    public GroupedResult build()
    {
        checkState(!built, "grouped result has already been built");
        built = true;
        groupTable.freeze();

        int accumulatorCount = groupTable.getAccumulatorCount();
        ImmutableList.Builder<GroupRecord> records = ImmutableList.builderWithExpectedSize(groupTable.getGroupCount());
        for (int groupId = 0; groupId < groupTable.getGroupCount(); groupId++) {
            ImmutableList.Builder<ValueBlock> fields = ImmutableList.builderWithExpectedSize(accumulatorCount + 1);
            fields.add(ArrayValueBlock.singleton(groupTable.getKey(groupId)));
            for (int accumulator = 0; accumulator < accumulatorCount; accumulator++) {
                AccumulatorState state = groupTable.getState(groupId, accumulator);
                // every partition contributes to every accumulator
                verify(state.isPresent(), "accumulator %s of group %s has no state", accumulator, groupTable.getKey(groupId));
                fields.add(ArrayValueBlock.singleton(state.getValue()));
            }
            records.add(new GroupRecord(fields.build()));
        }
        return new GroupedResult(records.build());
    }
}
