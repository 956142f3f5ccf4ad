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
import io.blockagg.spi.value.BooleanValue;
import io.blockagg.spi.value.Int32Value;
import org.testng.annotations.Test;

import static io.blockagg.spi.StandardErrorCode.TYPE_MISMATCH;
import static io.blockagg.spi.value.NullValue.NULL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestSelectionMask
{
    @Test
    public void testActivePositions()
    {
        SelectionMask mask = SelectionMask.of(true, false, true, true);
        assertThat(mask.getPositionCount()).isEqualTo(4);
        assertThat(mask.getActiveCount()).isEqualTo(3);
        assertThat(mask.hasActivePositions()).isTrue();
        assertThat(mask.getActivePositions()).containsExactly(0, 2, 3);
        assertThat(mask.isActive(1)).isFalse();
        assertThat(mask).hasToString("TFTT");

        assertThat(SelectionMask.allInactive(3).hasActivePositions()).isFalse();
        assertThat(SelectionMask.allActive(3).getActivePositions()).containsExactly(0, 1, 2);
        assertThat(SelectionMask.allInactive(0).getActivePositions()).isEmpty();
    }

    @Test
    public void testAnd()
    {
        SelectionMask left = SelectionMask.of(true, true, false, false);
        SelectionMask right = SelectionMask.of(true, false, true, false);
        assertThat(left.and(right)).isEqualTo(SelectionMask.of(true, false, false, false));
        assertThat(left.and(right).getActiveCount()).isEqualTo(1);

        assertThatThrownBy(() -> left.and(SelectionMask.allActive(3)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("mask lengths differ: 4 and 3");
    }

    @Test
    public void testCopies()
    {
        boolean[] values = {true, false};
        SelectionMask mask = SelectionMask.of(values);
        values[1] = true;
        assertThat(mask.getActiveCount()).isEqualTo(1);

        boolean[] copy = mask.toBooleanArray();
        copy[1] = true;
        assertThat(mask.isActive(1)).isFalse();
    }

    @Test
    public void testFromBlock()
    {
        ValueBlock block = ArrayValueBlock.of(BooleanValue.TRUE, NULL, BooleanValue.FALSE, BooleanValue.TRUE);
        assertThat(SelectionMask.fromBlock(block)).isEqualTo(SelectionMask.of(true, false, false, true));

        assertThatThrownBy(() -> SelectionMask.fromBlock(ArrayValueBlock.of(BooleanValue.TRUE, Int32Value.of(1))))
                .isInstanceOfSatisfying(BlockaggException.class, e -> assertThat(e.getErrorCode()).isEqualTo(TYPE_MISMATCH.toErrorCode()))
                .hasMessage("Selection mask position 1 is INT32, expected BOOLEAN");
    }

    @Test
    public void testRetainedSize()
    {
        assertThat(SelectionMask.allActive(1024).getRetainedSizeInBytes()).isGreaterThan(1024);
    }
}
