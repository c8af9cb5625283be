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

import me.golemcore.context.domain.model.ContextEntity;
import me.golemcore.context.domain.model.EntityType;
import me.golemcore.context.domain.model.Event;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the user's personal-data records. Implementations never
 * return soft-deleted records.
 */
public interface EntityStorePort {

    /**
     * Find records whose primary label (name or title) contains any of the given
     * names, case-insensitively.
     *
     * @param userId
     *            owner of the records
     * @param names
     *            mention texts to look for
     * @param type
     *            kind of record to search
     * @param limit
     *            maximum number of records
     * @return matching records, at most {@code limit}
     */
    List<ContextEntity> findByNames(String userId, List<String> names, EntityType type, int limit);

    /**
     * Find records whose time anchor (event start, task due date, deadline due
     * date) falls inside the window, earliest first. Only records still open are
     * returned: tasks pending or in progress, deadlines pending.
     *
     * @param from
     *            inclusive lower bound
     * @param until
     *            inclusive upper bound, or {@code null} for open-ended
     */
    List<ContextEntity> findUpcoming(String userId, EntityType type, Instant from, Instant until, int limit);

    /**
     * Find events starting at or after {@code from} whose description or notes
     * mention any of the names, earliest first.
     */
    List<Event> findEventsMentioning(String userId, List<String> names, Instant from, int limit);

    /**
     * All live records of one kind.
     */
    List<ContextEntity> listAll(String userId, EntityType type);
}
