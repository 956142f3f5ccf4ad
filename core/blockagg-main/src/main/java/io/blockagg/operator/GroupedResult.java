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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The single output row of the block hash aggregation: one record per group, in no particular order.
 */
public final class GroupedResult
{
    private final List<GroupRecord> records;

    public GroupedResult(List<GroupRecord> records)
    {
        this.records = ImmutableList.copyOf(requireNonNull(records, "records is null"));
    }

    public List<GroupRecord> getRecords()
    {
        return records;
    }

    public int getRecordCount()
    {
        return records.size();
    }

    public boolean isEmpty()
    {
        return records.isEmpty();
    }

    @Override
    public String toString()
    {
        return records.toString();
    }
}
