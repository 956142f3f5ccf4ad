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
package io.blockagg.spi.block;

import io.blockagg.spi.value.TaggedValue;

import java.util.List;

/**
 * A fixed-length column of dynamically typed values, one per row of a chunk.
 */
public interface ValueBlock
{
    /**
     * Returns the number of positions in this block.
     */
    int getPositionCount();

    /**
     * Returns the value at {@code position}.
     */
    TaggedValue getValue(int position);

    /**
     * Extracts all positions into a list, in position order.
     */
    List<TaggedValue> extract();

    /**
     * Returns the retained size of this block in memory, including over-allocations.
     */
    long getRetainedSizeInBytes();
}
