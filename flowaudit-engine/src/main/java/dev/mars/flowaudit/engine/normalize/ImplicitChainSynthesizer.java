/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
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

package dev.mars.flowaudit.engine.normalize;

import dev.mars.flowaudit.core.CanonicalEdge;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the sequential edges of a legacy workflow that declares no connections.
 *
 * <p>Control enters at the first trigger and runs through the actions in array order:
 * {@code trigger0 -> action0 -> action1 -> ...}. Other triggers get no edges. Without
 * triggers the chain starts at the first action; without actions there is no chain at all.</p>
 */
public final class ImplicitChainSynthesizer {

    private ImplicitChainSynthesizer() {
    }

    /**
     * @param triggerIds resolved trigger ids in document order
     * @param actionIds resolved action ids in document order
     * @return the chain edges, with ids of the form {@code edge_{source}_{target}}
     */
    public static List<CanonicalEdge> chain(List<String> triggerIds, List<String> actionIds) {
        List<CanonicalEdge> edges = new ArrayList<>();
        String previous = triggerIds.isEmpty() ? null : triggerIds.get(0);
        for (String actionId : actionIds) {
            if (previous != null) {
                edges.add(new CanonicalEdge("edge_" + previous + "_" + actionId, previous, actionId));
            }
            previous = actionId;
        }
        return edges;
    }
}
