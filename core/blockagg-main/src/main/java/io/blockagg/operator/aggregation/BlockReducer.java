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

import io.blockagg.spi.block.SelectionMask;
import io.blockagg.spi.block.ValueBlock;
import io.blockagg.spi.value.TaggedValue;

import java.util.Optional;

/**
 * Block-level partial reduction over the active rows of a mask.
 */
@FunctionalInterface
public interface BlockReducer
{
    /**
     * @param mask the rows to reduce, with at least one active position
     * @param data the data block assigned to the accumulator, or empty if it consumes none
     */
    TaggedValue reduce(SelectionMask mask, Optional<ValueBlock> data);
}
