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

import com.google.common.collect.ImmutableMap;
import io.blockagg.spi.BlockaggException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static io.blockagg.spi.StandardErrorCode.UNKNOWN_ACCUMULATOR_FUNCTION;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Registry of named block reducers and row combiners. An accumulator is wired as a
 * (block reducer, row combiner) pair, for example {@code ("min", "min")} or {@code ("count", "sum")}.
 */
public final class AccumulatorFunctions
{
    private static final AccumulatorFunctions STANDARD_FUNCTIONS = builder()
            .addBlockReducer("min", true, StandardAccumulators.MIN_REDUCER)
            .addBlockReducer("max", true, StandardAccumulators.MAX_REDUCER)
            .addBlockReducer("sum", true, StandardAccumulators.SUM_REDUCER)
            .addBlockReducer("count", false, StandardAccumulators.COUNT_REDUCER)
            .addRowCombiner("min", StandardAccumulators.MIN_COMBINER)
            .addRowCombiner("max", StandardAccumulators.MAX_COMBINER)
            .addRowCombiner("sum", StandardAccumulators.SUM_COMBINER)
            .build();

    private final Map<String, RegisteredBlockReducer> blockReducers;
    private final Map<String, RowCombiner> rowCombiners;

    private AccumulatorFunctions(Map<String, RegisteredBlockReducer> blockReducers, Map<String, RowCombiner> rowCombiners)
    {
        this.blockReducers = ImmutableMap.copyOf(blockReducers);
        this.rowCombiners = ImmutableMap.copyOf(rowCombiners);
    }

    public static AccumulatorFunctions standardFunctions()
    {
        return STANDARD_FUNCTIONS;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public Set<String> getBlockReducerNames()
    {
        return blockReducers.keySet();
    }

    public Set<String> getRowCombinerNames()
    {
        return rowCombiners.keySet();
    }

    /**
     * Resolves an accumulator from the names of its block reducer and row combiner.
     *
     * @throws BlockaggException with {@code UNKNOWN_ACCUMULATOR_FUNCTION} if either name is not registered
     */
    public AccumulatorSpec resolve(String name, String blockReducerName, String rowCombinerName)
    {
        RegisteredBlockReducer blockReducer = blockReducers.get(requireNonNull(blockReducerName, "blockReducerName is null"));
        if (blockReducer == null) {
            throw new BlockaggException(UNKNOWN_ACCUMULATOR_FUNCTION, format("Unknown block reducer '%s' for accumulator '%s'", blockReducerName, name));
        }
        RowCombiner rowCombiner = rowCombiners.get(requireNonNull(rowCombinerName, "rowCombinerName is null"));
        if (rowCombiner == null) {
            throw new BlockaggException(UNKNOWN_ACCUMULATOR_FUNCTION, format("Unknown row combiner '%s' for accumulator '%s'", rowCombinerName, name));
        }
        return new AccumulatorSpec(name, blockReducer.needsData(), blockReducer.reducer(), rowCombiner);
    }

    private record RegisteredBlockReducer(boolean needsData, BlockReducer reducer) {}

    public static class Builder
    {
        private final Map<String, RegisteredBlockReducer> blockReducers = new LinkedHashMap<>();
        private final Map<String, RowCombiner> rowCombiners = new LinkedHashMap<>();

        private Builder() {}

        public Builder addBlockReducer(String name, boolean needsData, BlockReducer reducer)
        {
            requireNonNull(name, "name is null");
            requireNonNull(reducer, "reducer is null");
            checkArgument(!blockReducers.containsKey(name), "Block reducer '%s' is already registered", name);
            blockReducers.put(name, new RegisteredBlockReducer(needsData, reducer));
            return this;
        }

        public Builder addRowCombiner(String name, RowCombiner combiner)
        {
            requireNonNull(name, "name is null");
            requireNonNull(combiner, "combiner is null");
            checkArgument(!rowCombiners.containsKey(name), "Row combiner '%s' is already registered", name);
            rowCombiners.put(name, combiner);
            return this;
        }

        public AccumulatorFunctions build()
        {
            return new AccumulatorFunctions(blockReducers, rowCombiners);
        }
    }
}
