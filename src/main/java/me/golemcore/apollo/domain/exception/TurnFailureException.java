package me.golemcore.apollo.domain.exception;

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

import me.golemcore.apollo.domain.model.TurnFailureKind;

/**
 * Aborts a turn. Carries the classification shown to the user; the cause
 * stays in the server log.
 */
public class TurnFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final TurnFailureKind kind;

    public TurnFailureException(TurnFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public TurnFailureException(TurnFailureKind kind, String message) {
        this(kind, message, null);
    }

    public TurnFailureKind getKind() {
        return kind;
    }
}
