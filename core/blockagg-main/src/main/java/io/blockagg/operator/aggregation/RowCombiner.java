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

import io.blockagg.spi.value.TaggedValue;

import java.util.function.BinaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * Merges a partial aggregate into the running state of a group.
 * <p>
 * Implementations must satisfy {@code combine(absent(), partial).getValue() == partial} and must be
 * associative and commutative over the partials they receive, as chunks may arrive in any order.
 */
@FunctionalInterface
public interface RowCombiner
{
    AccumulatorState combine(AccumulatorState state, TaggedValue partial);

    /**
     * Lifts a binary operator into a combiner. The first partial becomes the state as is.
     */
    static RowCombiner fromOperator(BinaryOperator<TaggedValue> operator)
    {
        requireNonNull(operator, "operator is null");
        return (state, partial) -> {
            if (state.isAbsent()) {
                return AccumulatorState.of(partial);
            }
            return AccumulatorState.of(operator.apply(state.getValue(), partial));
        };
    }
}
