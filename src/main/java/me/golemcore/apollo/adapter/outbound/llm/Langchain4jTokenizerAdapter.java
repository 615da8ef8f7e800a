package me.golemcore.apollo.adapter.outbound.llm;

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

import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.apollo.port.outbound.TokenizerPort;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Exact tokenizers backed by langchain4j's OpenAI token count estimator. Other
 * providers' models have no public tokenizer and resolve to empty.
 */
@Component
@Slf4j
public class Langchain4jTokenizerAdapter implements TokenizerPort {

    @Override
    public Optional<ToIntFunction<String>> createTokenizer(String model) {
        if (model == null || model.isBlank()) {
            return Optional.empty();
        }
        String modelName = stripProviderPrefix(model);
        try {
            OpenAiTokenCountEstimator estimator = new OpenAiTokenCountEstimator(modelName);
            // Unknown models only fail on first use
            estimator.estimateTokenCountInText("warmup");
            return Optional.of(estimator::estimateTokenCountInText);
        } catch (RuntimeException e) { // NOSONAR - unknown model
            log.debug("[LLM] No tokenizer for model {}: {}", modelName, e.getMessage());
            return Optional.empty();
        }
    }

    private String stripProviderPrefix(String model) {
        int slash = model.indexOf('/');
        return slash >= 0 ? model.substring(slash + 1) : model;
    }
}
