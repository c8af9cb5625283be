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

package me.golemcore.context.domain.service;

import me.golemcore.context.domain.model.IntentCategory;
import lombok.Getter;

/**
 * Raised when a retrieval cannot produce a package: a required source failed
 * or the overall deadline passed.
 */
@Getter
public class ContextRetrievalException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Code {
        RETRIEVAL_FAILED, TIMEOUT
    }

    private final Code code;
    private final String userId;
    private final IntentCategory intentCategory;

    public ContextRetrievalException(Code code, String message, String userId, IntentCategory intentCategory,
            Throwable cause) {
        super(message, cause);
        this.code = code;
        this.userId = userId;
        this.intentCategory = intentCategory;
    }
}
