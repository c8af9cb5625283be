/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.context.port.outbound;

import me.golemcore.context.domain.model.EntityType;
import me.golemcore.context.domain.model.SemanticSearchHit;

import java.util.List;

/**
 * Port for similarity search over the user's records. May be unavailable;
 * callers treat any exception as "no matches".
 */
public interface SemanticSearchPort {

    /**
     * @param entityTypes
     *            kinds to search, {@code null} or empty for all
     * @return hits sorted by score, descending
     */
    List<SemanticSearchHit> search(String userId, String query, List<EntityType> entityTypes, int limit,
            double minSimilarity);
}
