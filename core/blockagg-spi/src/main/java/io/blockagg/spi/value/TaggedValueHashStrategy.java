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

import it.unimi.dsi.fastutil.Hash;

/**
 * Hash strategy that groups values by value-system equality rather than by variant.
 */
public final class TaggedValueHashStrategy
        implements Hash.Strategy<TaggedValue>
{
    public static final TaggedValueHashStrategy TAGGED_VALUE_HASH_STRATEGY = new TaggedValueHashStrategy();

    private TaggedValueHashStrategy() {}

    @Override
    public int hashCode(TaggedValue value)
    {
        if (value == null) {
            return 0;
        }
        return TaggedValues.hash(value);
    }

    @Override
    public boolean equals(TaggedValue left, TaggedValue right)
    {
        // fastutil probes with null keys
        if (left == null || right == null) {
            return left == right;
        }
        return TaggedValues.isEqual(left, right);
    }
}
