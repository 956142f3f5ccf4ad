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
package io.blockagg.operator.aggregation;

import io.blockagg.spi.value.TaggedValue;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Running value of one accumulator for one group: either absent, before any contribution, or a value.
 */
public final class AccumulatorState
{
    private static final AccumulatorState ABSENT = new AccumulatorState(null);

    private final TaggedValue value;

    private AccumulatorState(TaggedValue value)
    {
        this.value = value;
    }

    public static AccumulatorState absent()
    {
        return ABSENT;
    }

    public static AccumulatorState of(TaggedValue value)
    {
        return new AccumulatorState(requireNonNull(value, "value is null"));
    }

    public boolean isAbsent()
    {
        return value == null;
    }

    public boolean isPresent()
    {
        return value != null;
    }

    public TaggedValue getValue()
    {
        checkState(value != null, "accumulator state is absent");
        return value;
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
        return Objects.equals(value, ((AccumulatorState) obj).value);
    }

    @Override
    public int hashCode()
    {
        return Objects.hashCode(value);
    }

    @Override
    public String toString()
    {
        return value == null ? "<absent>" : value.toString();
    }
}
