package me.golemcore.mind.adapter.outbound.extraction;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mind.domain.model.ExtractedFact;
import me.golemcore.mind.domain.model.LearningCategory;
import me.golemcore.mind.infrastructure.config.MindProperties;
import me.golemcore.mind.port.outbound.FactExtractionException;
import me.golemcore.mind.port.outbound.FactExtractionPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Fact extraction over HTTP.
 *
 * <p>
 * Sends {@code POST <url>/extract} with {@code {"text": "..."}} and expects
 * either a JSON array of facts or an object holding one under {@code facts}.
 * Each fact carries {@code category}, {@code statement}, {@code reasoning},
 * {@code confidence} and {@code excerpt}; free-form category labels are
 * normalized with {@link LearningCategory#fromLabel(String)}.
 *
 * <p>
 * Failures complete the future with a {@link FactExtractionException}:
 * connection errors, HTTP 429 and 5xx are retryable, other HTTP errors and
 * unparseable bodies are not.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code mind.extraction.enabled} - enable the backend
 * <li>{@code mind.extraction.url} - base URL
 * <li>{@code mind.extraction.api-key} - optional bearer token
 * <li>{@code mind.extraction.timeout-seconds} - call timeout
 * </ul>
 */
@Component
@Slf4j
public class HttpFactExtractionAdapter implements FactExtractionPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int TOO_MANY_REQUESTS = 429;
    private static final int SERVER_ERROR = 500;

    private final MindProperties.ExtractionProperties settings;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpFactExtractionAdapter(MindProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.settings = properties.getExtraction();
        this.objectMapper = objectMapper;

        int timeoutSeconds = settings.getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public CompletableFuture<List<ExtractedFact>> extract(String text) {
        if (!isAvailable()) {
            return CompletableFuture.failedFuture(
                    new FactExtractionException("Fact extraction backend is not configured", false));
        }
        if (text == null || text.isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }

        return CompletableFuture.supplyAsync(() -> {
            try {
                return call(text);
            } catch (FactExtractionException e) {
                throw new CompletionException(e);
            }
        });
    }

    @Override
    public boolean isAvailable() {
        return settings.isEnabled() && settings.getUrl() != null && !settings.getUrl().isBlank();
    }

    private List<ExtractedFact> call(String text) throws FactExtractionException {
        String body;
        try {
            body = objectMapper.writeValueAsString(new ExtractRequest(text));
        } catch (JsonProcessingException e) {
            throw new FactExtractionException("Failed to serialize extraction request", false, e);
        }

        Request.Builder requestBuilder = new Request.Builder()
                .url(stripTrailingSlash(settings.getUrl()) + "/extract")
                .post(RequestBody.create(body, JSON));
        String apiKey = settings.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful()) {
                boolean retryable = response.code() == TOO_MANY_REQUESTS || response.code() >= SERVER_ERROR;
                log.warn("[Extraction] Request failed: HTTP {}", response.code());
                throw new FactExtractionException("Extraction failed: HTTP " + response.code(), retryable);
            }
            String payload = responseBody != null ? responseBody.string() : "";
            List<ExtractedFact> facts = parseFacts(payload);
            log.debug("[Extraction] Extracted {} fact(s) from {} chars", facts.size(), text.length());
            return facts;
        } catch (IOException e) {
            throw new FactExtractionException("Extraction request failed: " + e.getMessage(), true, e);
        }
    }

    List<ExtractedFact> parseFacts(String payload) throws FactExtractionException {
        if (payload == null || payload.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new FactExtractionException("Unparseable extraction response", false, e);
        }
        JsonNode items = root.isArray() ? root : root.path("facts");
        List<ExtractedFact> facts = new ArrayList<>();
        for (JsonNode item : items) {
            String statement = item.path("statement").asText("");
            if (statement.isBlank()) {
                continue;
            }
            facts.add(ExtractedFact.builder()
                    .category(LearningCategory.fromLabel(item.path("category").asText(null)))
                    .statement(statement.trim())
                    .reasoning(item.path("reasoning").asText(null))
                    .confidence(item.path("confidence").asDouble(0))
                    .excerpt(item.path("excerpt").asText(null))
                    .build());
        }
        return facts;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    record ExtractRequest(String text) {
    }
}
