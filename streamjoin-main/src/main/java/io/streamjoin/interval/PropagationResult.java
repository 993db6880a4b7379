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
package io.streamjoin.interval;

public enum PropagationResult
{
    /**
     * Every node interval is consistent with the observations and the filter being true.
     */
    SUCCESS,
    /**
     * No combination of values consistent with the observations can satisfy the filter.
     */
    INFEASIBLE,
    /**
     * The root of the graph is not a predicate the graph can constrain.
     */
    CANNOT_PROPAGATE,
}
