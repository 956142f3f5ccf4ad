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
package io.blockagg.operator.aggregation;

import com.google.common.collect.ImmutableList;
import io.blockagg.operator.Chunk;
import io.blockagg.operator.GroupPartition;
import io.blockagg.operator.GroupTable;
import io.blockagg.spi.BlockaggException;
import io.blockagg.spi.block.ValueBlock;
import io.blockagg.spi.value.TaggedValue;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Verify.verify;
import static io.blockagg.spi.StandardErrorCode.GENERIC_INTERNAL_ERROR;
import static io.blockagg.spi.StandardErrorCode.INVALID_ACCUMULATOR_ARITY;
import static java.lang.String.format;

/**
 * Runs the block reducers of every accumulator over the partitions of a chunk and feeds the
 * partials to the group table.
 */
public class AccumulatorInvoker
{
    private final List<AccumulatorSpec> accumulators;
    private final int dataInputCount;

    public AccumulatorInvoker(List<AccumulatorSpec> accumulators)
    {
        this.accumulators = ImmutableList.copyOf(accumulators);
        this.dataInputCount = (int) this.accumulators.stream()
                .filter(AccumulatorSpec::needsData)
                .count();
    }

    public List<AccumulatorSpec> getAccumulators()
    {
        return accumulators;
    }

    /**
     * Number of data blocks every chunk must carry.
     */
    public int getDataInputCount()
    {
        return dataInputCount;
    }

    public void processChunk(Chunk chunk, List<GroupPartition> partitions, GroupTable groupTable)
    {
        List<Optional<ValueBlock>> inputs = assignDataBlocks(chunk);
        for (GroupPartition partition : partitions) {
            verify(partition.mask().hasActivePositions(), "partition for key %s has no active positions", partition.key());
            TaggedValue[] partials = new TaggedValue[accumulators.size()];
            for (int i = 0; i < partials.length; i++) {
                AccumulatorSpec accumulator = accumulators.get(i);
                TaggedValue partial = accumulator.getBlockReducer().reduce(partition.mask(), inputs.get(i));
                if (partial == null) {
                    throw new BlockaggException(GENERIC_INTERNAL_ERROR, format("Block reducer of accumulator '%s' returned no value", accumulator.getName()));
                }
                partials[i] = partial;
            }
            groupTable.contribute(partition.key(), partials);
        }
    }

    /**
     * Returns the data block of each accumulator, in registration order. Accumulators that need
     * data take the next unconsumed block of the chunk; the others get none.
     */
    public List<Optional<ValueBlock>> assignDataBlocks(Chunk chunk)
    {
        if (chunk.getDataCount() != dataInputCount) {
            throw new BlockaggException(INVALID_ACCUMULATOR_ARITY, format(
                    "Chunk has %s data blocks, but %s accumulators of %s consume data",
                    chunk.getDataCount(),
                    dataInputCount,
                    accumulators.size()));
        }

        ImmutableList.Builder<Optional<ValueBlock>> inputs = ImmutableList.builderWithExpectedSize(accumulators.size());
        int nextDataBlock = 0;
        for (AccumulatorSpec accumulator : accumulators) {
            if (accumulator.needsData()) {
                inputs.add(Optional.of(chunk.getData(nextDataBlock)));
                nextDataBlock++;
            }
            else {
                inputs.add(Optional.empty());
            }
        }
        return inputs.build();
    }
}
