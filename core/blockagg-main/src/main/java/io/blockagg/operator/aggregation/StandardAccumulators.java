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

import io.blockagg.spi.BlockaggException;
import io.blockagg.spi.block.SelectionMask;
import io.blockagg.spi.block.ValueBlock;
import io.blockagg.spi.value.Int32Value;
import io.blockagg.spi.value.Int64Value;
import io.blockagg.spi.value.NullValue;
import io.blockagg.spi.value.TaggedValue;
import io.blockagg.spi.value.TaggedValues;

import java.util.Optional;
import java.util.function.BinaryOperator;

import static io.blockagg.spi.StandardErrorCode.GENERIC_INTERNAL_ERROR;

/**
 * Block reducers and row combiners behind the standard accumulator functions.
 * Null values are skipped by min, max and sum.
 */
public final class StandardAccumulators
{
    public static final BlockReducer MIN_REDUCER = (mask, data) -> reduceIgnoringNulls(mask, data, TaggedValues::min);
    public static final BlockReducer MAX_REDUCER = (mask, data) -> reduceIgnoringNulls(mask, data, TaggedValues::max);
    public static final BlockReducer SUM_REDUCER = StandardAccumulators::sum;
    public static final BlockReducer COUNT_REDUCER = (mask, data) -> Int64Value.of(mask.getActiveCount());

    public static final RowCombiner MIN_COMBINER = RowCombiner.fromOperator(ignoringNulls(TaggedValues::min));
    public static final RowCombiner MAX_COMBINER = RowCombiner.fromOperator(ignoringNulls(TaggedValues::max));
    public static final RowCombiner SUM_COMBINER = RowCombiner.fromOperator(TaggedValues::add);

    private StandardAccumulators() {}

    private static TaggedValue reduceIgnoringNulls(SelectionMask mask, Optional<ValueBlock> data, BinaryOperator<TaggedValue> operator)
    {
        ValueBlock block = requireData(data);
        TaggedValue result = NullValue.NULL;
        for (int position : mask.getActivePositions()) {
            TaggedValue value = block.getValue(position);
            if (value.isNull()) {
                continue;
            }
            result = result.isNull() ? value : operator.apply(result, value);
        }
        return result;
    }

    private static TaggedValue sum(SelectionMask mask, Optional<ValueBlock> data)
    {
        ValueBlock block = requireData(data);
        TaggedValue sum = Int32Value.of(0);
        for (int position : mask.getActivePositions()) {
            sum = TaggedValues.add(sum, block.getValue(position));
        }
        return sum;
    }

    private static BinaryOperator<TaggedValue> ignoringNulls(BinaryOperator<TaggedValue> operator)
    {
        return (left, right) -> {
            if (left.isNull()) {
                return right;
            }
            if (right.isNull()) {
                return left;
            }
            return operator.apply(left, right);
        };
    }

    private static ValueBlock requireData(Optional<ValueBlock> data)
    {
        return data.orElseThrow(() -> new BlockaggException(GENERIC_INTERNAL_ERROR, "Block reducer requires a data block"));
    }
}
