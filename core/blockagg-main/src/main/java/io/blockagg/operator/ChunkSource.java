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

import java.io.Closeable;
import java.util.Optional;

/**
 * Upstream producer of chunks. Pull based: the consumer calls {@link #open()} once, then
 * {@link #getNextChunk()} until it returns empty, then {@link #close()}.
 */
public interface ChunkSource
        extends Closeable
{
    void open();

    /**
     * Returns the next chunk, or empty once the source is exhausted.
     */
    Optional<Chunk> getNextChunk();

    @Override
    void close();
}
