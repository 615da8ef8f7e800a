package me.golemcore.apollo.port.outbound;

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

import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Port for exact, model-specific tokenizers.
 */
public interface TokenizerPort {

    /**
     * Creates a token counting function for the model. Creation may be expensive;
     * callers are expected to cache the handle.
     *
     * @return the tokenizer, or empty when no exact tokenizer is known for the
     *         model
     */
    Optional<ToIntFunction<String>> createTokenizer(String model);
}
