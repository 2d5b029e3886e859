package me.golemcore.mind.port.outbound;

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

/**
 * Failure of the external fact extraction backend.
 */
public class FactExtractionException extends Exception {

    private static final long serialVersionUID = 1L;
    private final boolean retryable;

    public FactExtractionException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public FactExtractionException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * Whether the same observation may succeed on a later run.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
