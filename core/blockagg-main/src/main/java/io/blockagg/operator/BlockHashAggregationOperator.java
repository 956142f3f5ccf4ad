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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.blockagg.operator.aggregation.AccumulatorInvoker;
import io.blockagg.operator.aggregation.AccumulatorSpec;
import io.blockagg.operator.aggregation.RowCombiner;
import io.blockagg.spi.BlockaggException;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.blockagg.spi.StandardErrorCode.KEY_SHAPE_MISMATCH;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Blocking hash aggregation over chunks with a selection mask. The operator pulls every chunk from
 * its source on the first {@link #getNext()} call, partitions the active rows of each chunk by key,
 * reduces each partition per accumulator and combines the partials into a {@link GroupTable}. The
 * whole table is then returned as one {@link GroupedResult}, after which the operator is exhausted.
 */
public class BlockHashAggregationOperator
        implements Closeable
{
    private static final Logger log = Logger.get(BlockHashAggregationOperator.class);

    public static class BlockHashAggregationOperatorFactory
    {
        private final KeyShape keyShape;
        private final List<AccumulatorSpec> accumulators;
        private final int expectedGroups;
        private final boolean runLengthKeyShortcut;

        public BlockHashAggregationOperatorFactory(KeyShape keyShape, List<AccumulatorSpec> accumulators, BlockHashAggregationConfig config)
        {
            this(keyShape, accumulators, config.getExpectedGroups(), config.isRunLengthKeyShortcut());
        }

        public BlockHashAggregationOperatorFactory(KeyShape keyShape, List<AccumulatorSpec> accumulators, int expectedGroups, boolean runLengthKeyShortcut)
        {
            this.keyShape = requireNonNull(keyShape, "keyShape is null");
            this.accumulators = ImmutableList.copyOf(requireNonNull(accumulators, "accumulators is null"));
            checkArgument(expectedGroups > 0, "expectedGroups must be positive but got %s", expectedGroups);
            this.expectedGroups = expectedGroups;
            this.runLengthKeyShortcut = runLengthKeyShortcut;
        }

        public KeyShape getKeyShape()
        {
            return keyShape;
        }

        public List<AccumulatorSpec> getAccumulators()
        {
            return accumulators;
        }

        public BlockHashAggregationOperator createOperator(ChunkSource source)
        {
            return new BlockHashAggregationOperator(
                    source,
                    keyShape,
                    ChunkPartitioner.create(keyShape, runLengthKeyShortcut),
                    accumulators,
                    expectedGroups);
        }
    }

    public enum State
    {
        UNINITIALIZED,
        ACCUMULATING,
        DRAINED,
        EXHAUSTED,
        FAILED,
        CLOSED,
    }

    private final ChunkSource source;
    private final KeyShape keyShape;
    private final ChunkPartitioner partitioner;
    private final AccumulatorInvoker invoker;
    private final List<RowCombiner> combiners;
    private final int expectedGroups;

    private State state = State.UNINITIALIZED;
    private GroupTable groupTable;
    private GroupedResult result;
    private BlockHashAggregationStats stats = new BlockHashAggregationStats();

    public BlockHashAggregationOperator(
            ChunkSource source,
            KeyShape keyShape,
            ChunkPartitioner partitioner,
            List<AccumulatorSpec> accumulators,
            int expectedGroups)
    {
        this.source = requireNonNull(source, "source is null");
        this.keyShape = requireNonNull(keyShape, "keyShape is null");
        this.partitioner = requireNonNull(partitioner, "partitioner is null");
        this.invoker = new AccumulatorInvoker(requireNonNull(accumulators, "accumulators is null"));
        this.combiners = accumulators.stream()
                .map(AccumulatorSpec::getRowCombiner)
                .collect(toImmutableList());
        checkArgument(expectedGroups > 0, "expectedGroups must be positive but got %s", expectedGroups);
        this.expectedGroups = expectedGroups;
    }

    public void open()
    {
        checkState(state == State.UNINITIALIZED, "operator is already open");
        source.open();
        groupTable = new GroupTable(combiners, expectedGroups);
        stats = new BlockHashAggregationStats();
        state = State.ACCUMULATING;
        log.debug("Opened block hash aggregation with %s accumulators and %s key", combiners.size(), keyShape);
    }

    /**
     * Returns the grouped result on the first call and empty afterwards. The first call consumes
     * the whole input.
     */
    public Optional<GroupedResult> getNext()
    {
        checkState(state != State.UNINITIALIZED, "operator is not open");
        checkState(state != State.CLOSED, "operator is closed");
        checkState(state != State.FAILED, "operator failed");

        if (state == State.ACCUMULATING) {
            try {
                accumulate();
                drain();
            }
            catch (Throwable t) {
                log.debug(t, "Dropping group table with %s groups", groupTable.getGroupCount());
                groupTable = null;
                result = null;
                state = State.FAILED;
                throw t;
            }
        }
        if (state == State.DRAINED) {
            GroupedResult output = result;
            result = null;
            state = State.EXHAUSTED;
            return Optional.of(output);
        }
        return Optional.empty();
    }

    @Override
    public void close()
    {
        if (state == State.CLOSED) {
            return;
        }
        State previous = state;
        state = State.CLOSED;
        groupTable = null;
        result = null;
        log.debug("Closing block hash aggregation in state %s", previous);
        source.close();
    }

    public State getState()
    {
        return state;
    }

    public BlockHashAggregationStats getStats()
    {
        return stats;
    }

    public long getEstimatedSize()
    {
        return groupTable == null ? 0 : groupTable.getEstimatedSize();
    }

    @VisibleForTesting
    int getGroupCount()
    {
        return groupTable == null ? 0 : groupTable.getGroupCount();
    }

    private void accumulate()
    {
        while (true) {
            Optional<Chunk> chunk = source.getNextChunk();
            if (chunk.isEmpty()) {
                break;
            }
            addChunk(chunk.get());
        }
    }

    private void addChunk(Chunk chunk)
    {
        if (chunk.getKeyShape() != keyShape) {
            throw new BlockaggException(KEY_SHAPE_MISMATCH, format("Expected a chunk with a %s key, but got %s", keyShape, chunk.getKeyShape()));
        }
        List<GroupPartition> partitions = partitioner.partition(chunk);
        invoker.processChunk(chunk, partitions, groupTable);
        stats.recordChunk(chunk, partitions.size());
    }

    private void drain()
    {
        result = new GroupedResultBuilder(groupTable).build();
        state = State.DRAINED;
        log.debug("Drained %s groups: %s", result.getRecordCount(), stats);
    }
}
