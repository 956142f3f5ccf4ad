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

/**
 * How the group-by key of a chunk is represented. Fixed per operator at construction.
 */
public enum KeyShape
{
    /**
     * One key value shared by every row of the chunk.
     */
    SCALAR,
    /**
     * A block holding one key value per row.
     */
    BLOCK,
}
