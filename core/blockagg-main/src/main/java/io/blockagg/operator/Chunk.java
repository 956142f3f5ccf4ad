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
import io.blockagg.spi.BlockaggException;
import io.blockagg.spi.block.SelectionMask;
import io.blockagg.spi.block.ValueBlock;
import io.blockagg.spi.value.TaggedValue;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkState;
import static io.blockagg.spi.StandardErrorCode.INVALID_CHUNK;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One input record of the block hash aggregation: a group-by key, a selection mask and the data
 * blocks consumed by the accumulators. All blocks have the same position count as the mask.
 */
public final class Chunk
{
    private final KeyShape keyShape;
    private final TaggedValue scalarKey;
    private final ValueBlock keyBlock;
    private final SelectionMask mask;
    private final List<ValueBlock> data;

    private Chunk(KeyShape keyShape, TaggedValue scalarKey, ValueBlock keyBlock, SelectionMask mask, List<ValueBlock> data)
    {
        this.keyShape = keyShape;
        this.scalarKey = scalarKey;
        this.keyBlock = keyBlock;
        this.mask = requireNonNull(mask, "mask is null");
        this.data = ImmutableList.copyOf(requireNonNull(data, "data is null"));

        int positionCount = mask.getPositionCount();
        if (keyBlock != null && keyBlock.getPositionCount() != positionCount) {
            throw new BlockaggException(INVALID_CHUNK, format("Key block has %s positions, but mask has %s", keyBlock.getPositionCount(), positionCount));
        }
        for (int i = 0; i < this.data.size(); i++) {
            ValueBlock block = this.data.get(i);
            if (block.getPositionCount() != positionCount) {
                throw new BlockaggException(INVALID_CHUNK, format("Data block %s has %s positions, but mask has %s", i, block.getPositionCount(), positionCount));
            }
        }
    }

    public static Chunk withScalarKey(TaggedValue key, SelectionMask mask, List<ValueBlock> data)
    {
        return new Chunk(KeyShape.SCALAR, requireNonNull(key, "key is null"), null, mask, data);
    }

    public static Chunk withScalarKey(TaggedValue key, SelectionMask mask, ValueBlock... data)
    {
        return withScalarKey(key, mask, ImmutableList.copyOf(data));
    }

    public static Chunk withBlockKey(ValueBlock keys, SelectionMask mask, List<ValueBlock> data)
    {
        return new Chunk(KeyShape.BLOCK, null, requireNonNull(keys, "keys is null"), mask, data);
    }

    public static Chunk withBlockKey(ValueBlock keys, SelectionMask mask, ValueBlock... data)
    {
        return withBlockKey(keys, mask, ImmutableList.copyOf(data));
    }

    public KeyShape getKeyShape()
    {
        return keyShape;
    }

    public TaggedValue getScalarKey()
    {
        checkState(keyShape == KeyShape.SCALAR, "chunk has a block key");
        return scalarKey;
    }

    public ValueBlock getKeyBlock()
    {
        checkState(keyShape == KeyShape.BLOCK, "chunk has a scalar key");
        return keyBlock;
    }

    public SelectionMask getMask()
    {
        return mask;
    }

    public int getPositionCount()
    {
        return mask.getPositionCount();
    }

    public int getDataCount()
    {
        return data.size();
    }

    public ValueBlock getData(int index)
    {
        return data.get(index);
    }

    public List<ValueBlock> getData()
    {
        return data;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("key", keyShape == KeyShape.SCALAR ? scalarKey : keyBlock)
                .add("mask", mask)
                .add("data", data)
                .toString();
    }
}
