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

/**
 * Variant tags of {@link TaggedValue}. The canonical rank defines the order
 * between values of different kinds; all numeric kinds share one rank and
 * compare by numeric value.
 */
public enum ValueTag
{
    NULL(0, false),
    INT32(1, true),
    INT64(1, true),
    DOUBLE(1, true),
    DECIMAL(1, true),
    STRING(2, false),
    BOOLEAN(3, false);

    private final int canonicalRank;
    private final boolean numeric;

    ValueTag(int canonicalRank, boolean numeric)
    {
        this.canonicalRank = canonicalRank;
        this.numeric = numeric;
    }

    public int getCanonicalRank()
    {
        return canonicalRank;
    }

    public boolean isNumeric()
    {
        return numeric;
    }
}
