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
import io.blockagg.spi.value.Int32Value;
import org.testng.annotations.Test;

import static io.blockagg.block.BlockAssertions.createInt32sBlock;
import static io.blockagg.operator.ChunkTestUtils.mask;
import static io.blockagg.spi.StandardErrorCode.INVALID_CHUNK;
import static io.blockagg.testing.BlockaggAssertions.assertBlockaggExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestChunk
{
    @Test
    public void testScalarKey()
    {
        Chunk chunk = Chunk.withScalarKey(Int32Value.of(3), mask(true, false), createInt32sBlock(1, 2), createInt32sBlock(3, 4));
        assertThat(chunk.getKeyShape()).isEqualTo(KeyShape.SCALAR);
        assertThat(chunk.getScalarKey()).isEqualTo(Int32Value.of(3));
        assertThat(chunk.getPositionCount()).isEqualTo(2);
        assertThat(chunk.getDataCount()).isEqualTo(2);
        assertThat(chunk.getData(1).getValue(0)).isEqualTo(Int32Value.of(3));
        assertThatThrownBy(chunk::getKeyBlock)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("chunk has a scalar key");
    }

    @Test
    public void testBlockKey()
    {
        Chunk chunk = Chunk.withBlockKey(createInt32sBlock(5, 6, 7), SelectionMask.allActive(3));
        assertThat(chunk.getKeyShape()).isEqualTo(KeyShape.BLOCK);
        assertThat(chunk.getKeyBlock().getPositionCount()).isEqualTo(3);
        assertThat(chunk.getDataCount()).isEqualTo(0);
        assertThat(chunk.getData()).isEmpty();
        assertThatThrownBy(chunk::getScalarKey)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("chunk has a block key");
    }

    @Test
    public void testLengthMismatch()
    {
        assertBlockaggExceptionThrownBy(() -> Chunk.withBlockKey(createInt32sBlock(1, 2), mask(true, true, true)), INVALID_CHUNK)
                .hasMessage("Key block has 2 positions, but mask has 3");
        assertBlockaggExceptionThrownBy(() -> Chunk.withScalarKey(Int32Value.of(1), mask(true, true), createInt32sBlock(1, 2), createInt32sBlock(1)), INVALID_CHUNK)
                .hasMessage("Data block 1 has 1 positions, but mask has 2");
    }
}
