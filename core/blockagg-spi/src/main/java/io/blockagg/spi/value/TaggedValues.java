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

import java.math.BigDecimal;

import static io.blockagg.spi.StandardErrorCode.TYPE_MISMATCH;
import static io.blockagg.spi.value.ValueTag.DECIMAL;
import static io.blockagg.spi.value.ValueTag.DOUBLE;
import static io.blockagg.spi.value.ValueTag.INT32;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Value-system operations over {@link TaggedValue}: comparison, equality, hashing and arithmetic.
 */
public final class TaggedValues
{
    private static final double TWO_TO_63 = 0x1.0p63;
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private TaggedValues() {}

    /**
     * Total order over all values. Values of different kinds are ordered by
     * {@link ValueTag#getCanonicalRank()}; numeric values compare by numeric value
     * regardless of their variant, with NaN below every other number.
     */
    public static int compare(TaggedValue left, TaggedValue right)
    {
        requireNonNull(left, "left is null");
        requireNonNull(right, "right is null");

        int rankComparison = Integer.compare(left.getTag().getCanonicalRank(), right.getTag().getCanonicalRank());
        if (rankComparison != 0) {
            return rankComparison;
        }
        switch (left.getTag()) {
            case NULL:
                return 0;
            case BOOLEAN:
                return Boolean.compare(left.asBoolean(), right.asBoolean());
            case STRING:
                return compareCodePoints(left.asString(), right.asString());
            default:
                return compareNumeric(left.asNumeric(), right.asNumeric());
        }
    }

    public static boolean isEqual(TaggedValue left, TaggedValue right)
    {
        return compare(left, right) == 0;
    }

    /**
     * Hash code consistent with {@link #isEqual(TaggedValue, TaggedValue)}.
     */
    public static int hash(TaggedValue value)
    {
        switch (value.getTag()) {
            case NULL:
                return 0;
            case BOOLEAN:
                return Boolean.hashCode(value.asBoolean());
            case STRING:
                return value.asString().hashCode();
            default:
                return hashNumeric(value.asNumeric());
        }
    }

    public static TaggedValue min(TaggedValue left, TaggedValue right)
    {
        return compare(right, left) < 0 ? right : left;
    }

    public static TaggedValue max(TaggedValue left, TaggedValue right)
    {
        return compare(right, left) > 0 ? right : left;
    }

    /**
     * Adds two values. Null operands are ignored. Int32 overflow widens to Int64 and Int64 overflow
     * widens to Double; a Double operand yields a Double and a Decimal operand yields a Decimal.
     */
    public static TaggedValue add(TaggedValue left, TaggedValue right)
    {
        if (left.isNull()) {
            return checkNumericOrNull(right);
        }
        if (right.isNull()) {
            return checkNumericOrNull(left);
        }
        if (!left.isNumeric() || !right.isNumeric()) {
            throw new BlockaggException(TYPE_MISMATCH, format("Cannot add %s and %s", left.getTag(), right.getTag()));
        }

        NumericValue leftNumber = left.asNumeric();
        NumericValue rightNumber = right.asNumeric();
        if (left.getTag() == DECIMAL || right.getTag() == DECIMAL) {
            if (leftNumber.isFinite() && rightNumber.isFinite()) {
                return DecimalValue.of(leftNumber.toBigDecimal().add(rightNumber.toBigDecimal()));
            }
            return DoubleValue.of(leftNumber.doubleValue() + rightNumber.doubleValue());
        }
        if (left.getTag() == DOUBLE || right.getTag() == DOUBLE) {
            return DoubleValue.of(leftNumber.doubleValue() + rightNumber.doubleValue());
        }

        long leftValue = longValue(leftNumber);
        long rightValue = longValue(rightNumber);
        if (left.getTag() == INT32 && right.getTag() == INT32) {
            long sum = leftValue + rightValue;
            if (sum == (int) sum) {
                return Int32Value.of((int) sum);
            }
            return Int64Value.of(sum);
        }
        try {
            return Int64Value.of(Math.addExact(leftValue, rightValue));
        }
        catch (ArithmeticException e) {
            return DoubleValue.of((double) leftValue + (double) rightValue);
        }
    }

    private static TaggedValue checkNumericOrNull(TaggedValue value)
    {
        if (!value.isNull() && !value.isNumeric()) {
            throw new BlockaggException(TYPE_MISMATCH, format("Cannot add %s to a number", value.getTag()));
        }
        return value;
    }

    private static long longValue(NumericValue value)
    {
        if (value instanceof Int32Value) {
            return ((Int32Value) value).getValue();
        }
        return ((Int64Value) value).getValue();
    }

    private static int compareNumeric(NumericValue left, NumericValue right)
    {
        if (left.isNaN() || right.isNaN()) {
            return Boolean.compare(!left.isNaN(), !right.isNaN());
        }
        if (isIntegral(left) && isIntegral(right)) {
            return Long.compare(longValue(left), longValue(right));
        }
        if (!left.isFinite() && !right.isFinite()) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        if (!left.isFinite()) {
            return left.doubleValue() > 0 ? 1 : -1;
        }
        if (!right.isFinite()) {
            return right.doubleValue() > 0 ? -1 : 1;
        }
        if (left.getTag() == DOUBLE && right.getTag() == DOUBLE) {
            double leftValue = left.doubleValue();
            double rightValue = right.doubleValue();
            // -0.0 and 0.0 are the same number
            if (leftValue == rightValue) {
                return 0;
            }
            return leftValue < rightValue ? -1 : 1;
        }
        return left.toBigDecimal().compareTo(right.toBigDecimal());
    }

    private static int hashNumeric(NumericValue value)
    {
        if (isIntegral(value)) {
            return Long.hashCode(longValue(value));
        }
        if (value.getTag() == DOUBLE) {
            double doubleValue = value.doubleValue();
            if (doubleValue == Math.rint(doubleValue) && doubleValue >= -TWO_TO_63 && doubleValue < TWO_TO_63) {
                return Long.hashCode((long) doubleValue);
            }
            return Double.hashCode(doubleValue);
        }

        BigDecimal decimal = value.toBigDecimal();
        if (decimal.signum() == 0) {
            return Long.hashCode(0);
        }
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() <= 0 && stripped.compareTo(LONG_MIN) >= 0 && stripped.compareTo(LONG_MAX) <= 0) {
            return Long.hashCode(stripped.longValueExact());
        }
        return Double.hashCode(decimal.doubleValue());
    }

    private static boolean isIntegral(NumericValue value)
    {
        return value instanceof Int32Value || value instanceof Int64Value;
    }

    private static int compareCodePoints(String left, String right)
    {
        int leftLength = left.length();
        int rightLength = right.length();
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < leftLength && rightIndex < rightLength) {
            int leftCodePoint = left.codePointAt(leftIndex);
            int rightCodePoint = right.codePointAt(rightIndex);
            if (leftCodePoint != rightCodePoint) {
                return Integer.compare(leftCodePoint, rightCodePoint);
            }
            leftIndex += Character.charCount(leftCodePoint);
            rightIndex += Character.charCount(rightCodePoint);
        }
        return Boolean.compare(leftIndex < leftLength, rightIndex < rightLength);
    }
}
