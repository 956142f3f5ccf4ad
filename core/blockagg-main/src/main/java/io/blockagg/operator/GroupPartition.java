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

import io.blockagg.spi.block.SelectionMask;
import io.blockagg.spi.value.TaggedValue;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * The active rows of one chunk that share a group-by key.
 */
public record GroupPartition(TaggedValue key, SelectionMask mask)
{
    public GroupPartition
    {
        requireNonNull(key, "key is null");
        requireNonNull(mask, "mask is null");
        checkArgument(mask.hasActivePositions(), "partition mask has no active positions");
    }
}
