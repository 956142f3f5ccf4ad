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

import static com.google.common.base.MoreObjects.toStringHelper;

public class BlockHashAggregationStats
{
    private long chunks;
    private long inputPositions;
    private long activePositions;
    private long partitions;

    public void recordChunk(Chunk chunk, int partitionCount)
    {
        chunks++;
        inputPositions += chunk.getPositionCount();
        activePositions += chunk.getMask().getActiveCount();
        partitions += partitionCount;
    }

    public long getChunks()
    {
        return chunks;
    }

    public long getInputPositions()
    {
        return inputPositions;
    }

    public long getActivePositions()
    {
        return activePositions;
    }

    public long getPartitions()
    {
        return partitions;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("chunks", chunks)
                .add("inputPositions", inputPositions)
                .add("activePositions", activePositions)
                .add("partitions", partitions)
                .toString();
    }
}
