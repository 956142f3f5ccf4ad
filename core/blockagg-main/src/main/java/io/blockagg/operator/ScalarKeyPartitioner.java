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

import com.google.common.collect.ImmutableList;
import io.blockagg.spi.block.SelectionMask;

import java.util.List;

public class ScalarKeyPartitioner
        implements ChunkPartitioner
{
    @Override
    public List<GroupPartition> partition(Chunk chunk)
    {
        SelectionMask mask = chunk.getMask();
        if (!mask.hasActivePositions()) {
            return ImmutableList.of();
        }
        return ImmutableList.of(new GroupPartition(chunk.getScalarKey(), mask));
    }
}
