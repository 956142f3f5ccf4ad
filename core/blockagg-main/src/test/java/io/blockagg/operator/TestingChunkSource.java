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

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Serves a fixed list of chunks, optionally failing after a number of them.
 */
public class TestingChunkSource
        implements ChunkSource
{
    private final List<Chunk> chunks;
    private final int failAfter;
    private final Supplier<RuntimeException> failure;

    private Iterator<Chunk> iterator;
    private int delivered;
    private boolean opened;
    private boolean closed;
    private int pulls;

    public TestingChunkSource(List<Chunk> chunks)
    {
        this(chunks, Integer.MAX_VALUE, () -> new IllegalStateException("not failing"));
    }

    private TestingChunkSource(List<Chunk> chunks, int failAfter, Supplier<RuntimeException> failure)
    {
        this.chunks = ImmutableList.copyOf(requireNonNull(chunks, "chunks is null"));
        this.failAfter = failAfter;
        this.failure = requireNonNull(failure, "failure is null");
    }

    public static TestingChunkSource failingAfter(List<Chunk> chunks, int failAfter, Supplier<RuntimeException> failure)
    {
        return new TestingChunkSource(chunks, failAfter, failure);
    }

    @Override
    public void open()
    {
        checkState(!opened, "source is already open");
        opened = true;
        iterator = chunks.iterator();
    }

    @Override
    public Optional<Chunk> getNextChunk()
    {
        checkState(opened, "source is not open");
        checkState(!closed, "source is closed");
        pulls++;
        if (delivered == failAfter) {
            throw failure.get();
        }
        if (!iterator.hasNext()) {
            return Optional.empty();
        }
        delivered++;
        return Optional.of(iterator.next());
    }

    @Override
    public void close()
    {
        closed = true;
    }

    public boolean isOpened()
    {
        return opened;
    }

    public boolean isClosed()
    {
        return closed;
    }

    public int getPulls()
    {
        return pulls;
    }
}
