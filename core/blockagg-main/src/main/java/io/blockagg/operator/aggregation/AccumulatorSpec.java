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

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * One output column of the aggregation: a block-level reducer and the row-level combiner that
 * merges its partials. Accumulators that need data consume the data blocks of a chunk in
 * registration order.
 */
public final class AccumulatorSpec
{
    private final String name;
    private final boolean needsData;
    private final BlockReducer blockReducer;
    private final RowCombiner rowCombiner;

    public AccumulatorSpec(String name, boolean needsData, BlockReducer blockReducer, RowCombiner rowCombiner)
    {
        this.name = requireNonNull(name, "name is null");
        this.needsData = needsData;
        this.blockReducer = requireNonNull(blockReducer, "blockReducer is null");
        this.rowCombiner = requireNonNull(rowCombiner, "rowCombiner is null");
    }

    public String getName()
    {
        return name;
    }

    public boolean needsData()
    {
        return needsData;
    }

    public BlockReducer getBlockReducer()
    {
        return blockReducer;
    }

    public RowCombiner getRowCombiner()
    {
        return rowCombiner;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("name", name)
                .add("needsData", needsData)
                .toString();
    }
}
