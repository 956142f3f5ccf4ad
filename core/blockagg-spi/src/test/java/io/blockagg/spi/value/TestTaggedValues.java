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
package io.blockagg.spi.value;

import io.blockagg.spi.BlockaggException;
import org.testng.annotations.Test;

import java.math.BigDecimal;

import static io.blockagg.spi.StandardErrorCode.NUMERIC_VALUE_OUT_OF_RANGE;
import static io.blockagg.spi.StandardErrorCode.TYPE_MISMATCH;
import static io.blockagg.spi.value.NullValue.NULL;
import static io.blockagg.spi.value.TaggedValueHashStrategy.TAGGED_VALUE_HASH_STRATEGY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestTaggedValues
{
    @Test
    public void testNumericEqualityAcrossVariants()
    {
        TaggedValue[] ones = {Int32Value.of(1), Int64Value.of(1), DoubleValue.of(1.0), DecimalValue.of("1.00")};
        for (TaggedValue left : ones) {
            for (TaggedValue right : ones) {
                assertThat(TaggedValues.isEqual(left, right)).as("%s == %s", left, right).isTrue();
                assertThat(TaggedValues.hash(left)).as("hash(%s) == hash(%s)", left, right).isEqualTo(TaggedValues.hash(right));
            }
        }

        // strict java equality keeps the variants apart
        assertThat(Int32Value.of(1)).isNotEqualTo(Int64Value.of(1));
        assertThat(DecimalValue.of("1.0")).isNotEqualTo(DecimalValue.of("1.00"));
    }

    @Test
    public void testHashConsistency()
    {
        assertConsistentHash(DoubleValue.of(0.5), DecimalValue.of("0.5"));
        assertConsistentHash(DoubleValue.of(-0.0), Int32Value.of(0));
        assertConsistentHash(DoubleValue.of(0x1.0p63), DecimalValue.of(new BigDecimal("9223372036854775808")));
        assertConsistentHash(DoubleValue.of(-0x1.0p63), Int64Value.of(Long.MIN_VALUE));
        assertConsistentHash(DecimalValue.of("0"), Int64Value.of(0));
        assertConsistentHash(DoubleValue.of(Double.NaN), DoubleValue.of(Double.NaN));
    }

    @Test
    public void testCanonicalOrder()
    {
        assertThat(TaggedValues.compare(NULL, Int32Value.of(-100))).isNegative();
        assertThat(TaggedValues.compare(Int32Value.of(100), StringValue.of(""))).isNegative();
        assertThat(TaggedValues.compare(StringValue.of("zzz"), BooleanValue.FALSE)).isNegative();
        assertThat(TaggedValues.compare(BooleanValue.FALSE, BooleanValue.TRUE)).isNegative();
        assertThat(TaggedValues.compare(NULL, NULL)).isZero();
    }

    @Test
    public void testNumericOrder()
    {
        assertThat(TaggedValues.compare(Int32Value.of(2), Int64Value.of(3))).isNegative();
        assertThat(TaggedValues.compare(DoubleValue.of(2.5), Int32Value.of(2))).isPositive();
        assertThat(TaggedValues.compare(DecimalValue.of("2.4999"), DoubleValue.of(2.5))).isNegative();
        assertThat(TaggedValues.compare(DoubleValue.of(Double.NaN), Int64Value.of(Long.MIN_VALUE))).isNegative();
        assertThat(TaggedValues.compare(DoubleValue.of(Double.NaN), DoubleValue.of(Double.NaN))).isZero();
        assertThat(TaggedValues.compare(DoubleValue.of(Double.NEGATIVE_INFINITY), DecimalValue.of("-1e400"))).isNegative();
        assertThat(TaggedValues.compare(Int64Value.of(Long.MAX_VALUE), DoubleValue.of(Double.POSITIVE_INFINITY))).isNegative();
        // Long.MAX_VALUE is not representable as a double
        assertThat(TaggedValues.compare(Int64Value.of(Long.MAX_VALUE), DoubleValue.of(0x1.0p63))).isNegative();
    }

    @Test
    public void testStringOrderUsesCodePoints()
    {
        // U+FF61 sorts below U+1F600 by code point, but above its surrogate pair by UTF-16 unit
        assertThat(TaggedValues.compare(StringValue.of("｡"), StringValue.of("😀"))).isNegative();
        assertThat(TaggedValues.compare(StringValue.of("ab"), StringValue.of("abc"))).isNegative();
        assertThat(TaggedValues.compare(StringValue.of("b"), StringValue.of("abc"))).isPositive();
    }

    @Test
    public void testMinMax()
    {
        assertThat(TaggedValues.min(Int32Value.of(5), DoubleValue.of(4.5))).isEqualTo(DoubleValue.of(4.5));
        assertThat(TaggedValues.max(Int32Value.of(5), DoubleValue.of(4.5))).isEqualTo(Int32Value.of(5));
        // ties keep the left operand
        assertThat(TaggedValues.min(Int32Value.of(1), Int64Value.of(1))).isEqualTo(Int32Value.of(1));
        assertThat(TaggedValues.max(Int32Value.of(1), Int64Value.of(1))).isEqualTo(Int32Value.of(1));
    }

    @Test
    public void testAdd()
    {
        assertThat(TaggedValues.add(Int32Value.of(1), Int32Value.of(2))).isEqualTo(Int32Value.of(3));
        assertThat(TaggedValues.add(Int32Value.of(Integer.MAX_VALUE), Int32Value.of(1))).isEqualTo(Int64Value.of(Integer.MAX_VALUE + 1L));
        assertThat(TaggedValues.add(Int64Value.of(Long.MAX_VALUE), Int32Value.of(1))).isEqualTo(DoubleValue.of(0x1.0p63));
        assertThat(TaggedValues.add(Int32Value.of(1), DoubleValue.of(0.5))).isEqualTo(DoubleValue.of(1.5));
        assertThat(TaggedValues.add(DecimalValue.of("0.1"), DoubleValue.of(0.5))).isEqualTo(DecimalValue.of("0.6"));
        assertThat(TaggedValues.add(DecimalValue.of("0.1"), Int64Value.of(2))).isEqualTo(DecimalValue.of("2.1"));
        assertThat(TaggedValues.add(DecimalValue.of("1"), DoubleValue.of(Double.POSITIVE_INFINITY))).isEqualTo(DoubleValue.of(Double.POSITIVE_INFINITY));
        assertThat(TaggedValues.add(NULL, Int32Value.of(7))).isEqualTo(Int32Value.of(7));
        assertThat(TaggedValues.add(Int32Value.of(7), NULL)).isEqualTo(Int32Value.of(7));
    }

    @Test
    public void testAddNonNumeric()
    {
        assertThatThrownBy(() -> TaggedValues.add(Int32Value.of(1), StringValue.of("a")))
                .isInstanceOfSatisfying(BlockaggException.class, e -> assertThat(e.getErrorCode()).isEqualTo(TYPE_MISMATCH.toErrorCode()))
                .hasMessage("Cannot add INT32 and STRING");
        assertThatThrownBy(() -> TaggedValues.add(NULL, BooleanValue.TRUE))
                .isInstanceOfSatisfying(BlockaggException.class, e -> assertThat(e.getErrorCode()).isEqualTo(TYPE_MISMATCH.toErrorCode()));
    }

    @Test
    public void testAccessorTypeMismatch()
    {
        assertThatThrownBy(() -> StringValue.of("x").asNumeric())
                .isInstanceOf(BlockaggException.class)
                .hasMessage("Expected a numeric value but got STRING");
        assertThatThrownBy(() -> Int32Value.of(1).asBoolean())
                .isInstanceOf(BlockaggException.class)
                .hasMessage("Expected a boolean value but got INT32");
    }

    @Test
    public void testNonFiniteDoubleHasNoDecimal()
    {
        assertThat(DoubleValue.of(0.5).toBigDecimal()).isEqualByComparingTo("0.5");
        assertThatThrownBy(() -> DoubleValue.of(Double.NaN).toBigDecimal())
                .isInstanceOfSatisfying(BlockaggException.class, e -> assertThat(e.getErrorCode()).isEqualTo(NUMERIC_VALUE_OUT_OF_RANGE.toErrorCode()))
                .hasMessage("NaN has no decimal representation");
    }

    @Test
    public void testHashStrategy()
    {
        assertThat(TAGGED_VALUE_HASH_STRATEGY.equals(Int32Value.of(3), DoubleValue.of(3.0))).isTrue();
        assertThat(TAGGED_VALUE_HASH_STRATEGY.equals(Int32Value.of(3), StringValue.of("3"))).isFalse();
        assertThat(TAGGED_VALUE_HASH_STRATEGY.equals(null, null)).isTrue();
        assertThat(TAGGED_VALUE_HASH_STRATEGY.equals(NULL, null)).isFalse();
        assertThat(TAGGED_VALUE_HASH_STRATEGY.hashCode(null)).isZero();
        assertThat(TAGGED_VALUE_HASH_STRATEGY.hashCode(Int64Value.of(3))).isEqualTo(TAGGED_VALUE_HASH_STRATEGY.hashCode(DecimalValue.of("3.000")));
    }

    private static void assertConsistentHash(TaggedValue left, TaggedValue right)
    {
        assertThat(TaggedValues.isEqual(left, right)).as("%s == %s", left, right).isTrue();
        assertThat(TaggedValues.hash(left)).as("hash(%s) == hash(%s)", left, right).isEqualTo(TaggedValues.hash(right));
    }
}
