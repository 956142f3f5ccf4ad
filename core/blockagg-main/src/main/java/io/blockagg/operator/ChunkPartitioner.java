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

import java.util.List;

/**
 * Splits the active rows of a chunk by group-by key.
 */
public interface ChunkPartitioner
{
    /**
     * Returns one partition per distinct key that has at least one active row. The effective mask
     * of a partition is the chunk mask restricted to the rows carrying that key. A chunk without
     * active rows yields no partitions. The order of the returned partitions is unspecified.
     */
    List<GroupPartition> partition(Chunk chunk);

    static ChunkPartitioner create(KeyShape keyShape, boolean runLengthKeyShortcut)
    {
        switch (keyShape) {
            case SCALAR:
                return new ScalarKeyPartitioner();
            case BLOCK:
                return new BlockKeyPartitioner(runLengthKeyShortcut);
        }
        throw new IllegalArgumentException("Unsupported key shape: " + keyShape);
    }
}
