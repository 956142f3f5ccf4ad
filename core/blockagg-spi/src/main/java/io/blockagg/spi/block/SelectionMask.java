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

import io.blockagg.spi.BlockaggException;
import io.blockagg.spi.value.TaggedValue;
import org.openjdk.jol.info.ClassLayout;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static io.airlift.slice.SizeOf.sizeOf;
import static io.blockagg.spi.StandardErrorCode.TYPE_MISMATCH;
import static io.blockagg.spi.value.ValueTag.BOOLEAN;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Per-row selection bitmap of a chunk; {@code true} marks a row that contributes to aggregation.
 * Instances are immutable.
 */
public final class SelectionMask
{
    private static final long INSTANCE_SIZE = ClassLayout.parseClass(SelectionMask.class).instanceSize();

    private final boolean[] mask;
    private final int activeCount;

    private SelectionMask(boolean[] mask)
    {
        this.mask = requireNonNull(mask, "mask is null");
        int count = 0;
        for (boolean active : mask) {
            if (active) {
                count++;
            }
        }
        this.activeCount = count;
    }

    public static SelectionMask of(boolean... mask)
    {
        return new SelectionMask(mask.clone());
    }

    /**
     * Creates a mask backed by {@code mask}. The caller must not modify the array afterwards.
     */
    public static SelectionMask wrap(boolean[] mask)
    {
        return new SelectionMask(mask);
    }

    public static SelectionMask allActive(int positionCount)
    {
        boolean[] mask = new boolean[positionCount];
        Arrays.fill(mask, true);
        return new SelectionMask(mask);
    }

    public static SelectionMask allInactive(int positionCount)
    {
        return new SelectionMask(new boolean[positionCount]);
    }

    /**
     * Reads a mask from a block of booleans. Null positions are inactive.
     */
    public static SelectionMask fromBlock(ValueBlock block)
    {
        boolean[] mask = new boolean[block.getPositionCount()];
        for (int position = 0; position < mask.length; position++) {
            TaggedValue value = block.getValue(position);
            if (value.isNull()) {
                continue;
            }
            if (value.getTag() != BOOLEAN) {
                throw new BlockaggException(TYPE_MISMATCH, format("Selection mask position %s is %s, expected BOOLEAN", position, value.getTag()));
            }
            mask[position] = value.asBoolean();
        }
        return new SelectionMask(mask);
    }

    public int getPositionCount()
    {
        return mask.length;
    }

    public boolean isActive(int position)
    {
        checkElementIndex(position, mask.length);
        return mask[position];
    }

    public int getActiveCount()
    {
        return activeCount;
    }

    public boolean hasActivePositions()
    {
        return activeCount > 0;
    }

    public SelectionMask and(SelectionMask other)
    {
        checkArgument(other.mask.length == mask.length, "mask lengths differ: %s and %s", mask.length, other.mask.length);
        boolean[] result = new boolean[mask.length];
        for (int i = 0; i < mask.length; i++) {
            result[i] = mask[i] && other.mask[i];
        }
        return new SelectionMask(result);
    }

    public int[] getActivePositions()
    {
        int[] positions = new int[activeCount];
        int index = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                positions[index++] = i;
            }
        }
        return positions;
    }

    public boolean[] toBooleanArray()
    {
        return mask.clone();
    }

    public long getRetainedSizeInBytes()
    {
        return INSTANCE_SIZE + sizeOf(mask);
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Arrays.equals(mask, ((SelectionMask) obj).mask);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(mask);
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder(mask.length);
        for (boolean active : mask) {
            builder.append(active ? 'T' : 'F');
        }
        return builder.toString();
    }
}
