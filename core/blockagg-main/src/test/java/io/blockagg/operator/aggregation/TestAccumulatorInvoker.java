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
import io.blockagg.operator.ChunkPartitioner;
import io.blockagg.operator.GroupTable;
import io.blockagg.operator.KeyShape;
import io.blockagg.spi.block.SelectionMask;
import io.blockagg.spi.block.ValueBlock;
import io.blockagg.spi.value.Int32Value;
import io.blockagg.spi.value.Int64Value;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Optional;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.blockagg.block.BlockAssertions.createInt32sBlock;
import static io.blockagg.operator.aggregation.AccumulatorFunctions.standardFunctions;
import static io.blockagg.spi.StandardErrorCode.GENERIC_INTERNAL_ERROR;
import static io.blockagg.spi.StandardErrorCode.INVALID_ACCUMULATOR_ARITY;
import static io.blockagg.testing.BlockaggAssertions.assertBlockaggExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

public class TestAccumulatorInvoker
{
    private static final AccumulatorSpec MIN = standardFunctions().resolve("min", "min", "min");
    private static final AccumulatorSpec COUNT = standardFunctions().resolve("count", "count", "sum");
    private static final AccumulatorSpec SUM = standardFunctions().resolve("sum", "sum", "sum");

    @Test
    public void testDataBlockAssignment()
    {
        AccumulatorInvoker invoker = new AccumulatorInvoker(ImmutableList.of(MIN, COUNT, SUM));
        assertThat(invoker.getDataInputCount()).isEqualTo(2);
        assertThat(invoker.getAccumulators()).containsExactly(MIN, COUNT, SUM);

        ValueBlock first = createInt32sBlock(1, 2);
        ValueBlock second = createInt32sBlock(3, 4);
        Chunk chunk = Chunk.withScalarKey(Int32Value.of(0), SelectionMask.allActive(2), first, second);

        List<Optional<ValueBlock>> inputs = invoker.assignDataBlocks(chunk);
        assertThat(inputs).containsExactly(Optional.of(first), Optional.empty(), Optional.of(second));
    }

    @Test
    public void testArityMismatch()
    {
        AccumulatorInvoker invoker = new AccumulatorInvoker(ImmutableList.of(MIN, COUNT));
        Chunk chunk = Chunk.withScalarKey(Int32Value.of(0), SelectionMask.allInactive(2));

        assertBlockaggExceptionThrownBy(() -> invoker.assignDataBlocks(chunk), INVALID_ACCUMULATOR_ARITY)
                .hasMessage("Chunk has 0 data blocks, but 1 accumulators of 2 consume data");
    }

    @Test
    public void testProcessChunk()
    {
        AccumulatorInvoker invoker = new AccumulatorInvoker(ImmutableList.of(SUM, COUNT));
        GroupTable table = new GroupTable(combiners(invoker), 4);
        Chunk chunk = Chunk.withBlockKey(
                createInt32sBlock(1, 2, 1, 2, 3),
                SelectionMask.of(true, true, true, false, false),
                createInt32sBlock(10, 20, 30, 40, 50));

        invoker.processChunk(chunk, ChunkPartitioner.create(KeyShape.BLOCK, true).partition(chunk), table);
        invoker.processChunk(chunk, ChunkPartitioner.create(KeyShape.BLOCK, true).partition(chunk), table);

        assertThat(table.getGroupCount()).isEqualTo(2);
        assertThat(table.getGroup(Int32Value.of(1)).orElseThrow().states()).containsExactly(
                AccumulatorState.of(Int32Value.of(80)),
                AccumulatorState.of(Int64Value.of(4)));
        assertThat(table.getGroup(Int32Value.of(2)).orElseThrow().states()).containsExactly(
                AccumulatorState.of(Int32Value.of(40)),
                AccumulatorState.of(Int64Value.of(2)));
        assertThat(table.getGroup(Int32Value.of(3))).isEmpty();
    }

    @Test
    public void testReducerWithoutValue()
    {
        AccumulatorSpec broken = new AccumulatorSpec("broken", false, (mask, data) -> null, StandardAccumulators.SUM_COMBINER);
        AccumulatorInvoker invoker = new AccumulatorInvoker(ImmutableList.of(broken));
        GroupTable table = new GroupTable(combiners(invoker), 1);
        Chunk chunk = Chunk.withScalarKey(Int32Value.of(0), SelectionMask.allActive(1));

        assertBlockaggExceptionThrownBy(() -> invoker.processChunk(chunk, ChunkPartitioner.create(KeyShape.SCALAR, true).partition(chunk), table), GENERIC_INTERNAL_ERROR)
                .hasMessage("Block reducer of accumulator 'broken' returned no value");
        assertThat(table.getGroupCount()).isEqualTo(0);
    }

    private static List<RowCombiner> combiners(AccumulatorInvoker invoker)
    {
        return invoker.getAccumulators().stream()
                .map(AccumulatorSpec::getRowCombiner)
                .collect(toImmutableList());
    }
}
