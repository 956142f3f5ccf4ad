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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;

public class BlockHashAggregationConfig
{
    private int expectedGroups = 1024;
    private boolean runLengthKeyShortcut = true;

    public int getExpectedGroups()
    {
        return expectedGroups;
    }

    @Config("block-hash-aggregation.expected-groups")
    @ConfigDescription("Initial capacity of the group table")
    public BlockHashAggregationConfig setExpectedGroups(int expectedGroups)
    {
        this.expectedGroups = expectedGroups;
        return this;
    }

    public boolean isRunLengthKeyShortcut()
    {
        return runLengthKeyShortcut;
    }

    @Config("block-hash-aggregation.run-length-key-shortcut")
    @ConfigDescription("Treat run-length encoded key blocks as scalar keys")
    public BlockHashAggregationConfig setRunLengthKeyShortcut(boolean runLengthKeyShortcut)
    {
        this.runLengthKeyShortcut = runLengthKeyShortcut;
        return this;
    }
}
