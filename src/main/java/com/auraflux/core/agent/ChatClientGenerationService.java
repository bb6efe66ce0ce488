package com.auraflux.core.agent;

import com.auraflux.core.dispatch.FailureKind;
import com.auraflux.core.dispatch.Lane;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * {@link GenerationService} backed by Spring AI's {@link ChatClient}.
 * <p>
 * The task payload is serialised as JSON into the user prompt together with format instructions
 * for the role's {@link ResultKind}; the model's reply is parsed back into a JSON object, except for
 * chat replies, which are plain text. Streaming roles forward every content chunk to the caller's
 * sink before the reply is parsed.
 */
@Service
public class ChatClientGenerationService implements GenerationService {

    private static final Logger log = LoggerFactory.getLogger(ChatClientGenerationService.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final GenerationClientHandle clientHandle;
    private final ObjectMapper mapper;
    private final Duration streamTimeout;

    @Autowired
    public ChatClientGenerationService(GenerationClientHandle clientHandle,
                                       @Value("${auraflux.agents.stream-timeout-seconds:120}") long streamTimeoutSeconds) {
        this.clientHandle = clientHandle;
        this.streamTimeout = Duration.ofSeconds(streamTimeoutSeconds);
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    @Override
    public Map<String, Object> generate(String taskType, Map<String, Object> payload, AgentRoleConfig role,
                                        Consumer<String> chunkSink) {
        if (payload == null || payload.isEmpty()) {
            throw GenerationException.permanentFailure("Task " + taskType + " has an empty payload");
        }
        String userPrompt = userPrompt(payload, role.resultKind());
        log.info("Generation started for {} (prompt {})", taskType, role.promptRef());
        long start = System.currentTimeMillis();

        String response;
        try {
            ChatClient.ChatClientRequestSpec spec = clientHandle.get().prompt()
                    .system(role.systemPrompt())
                    .user(userPrompt);
            ChatOptions options = chatOptions(role.modelParams());
            if (options != null) {
                spec = spec.options(options);
            }
            response = role.lane() == Lane.STREAM
                    ? streamContent(spec, chunkSink)
                    : spec.call().content();
        } catch (GenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            FailureKind kind = classify(e);
            log.warn("Generation for {} failed ({}): {}", taskType, kind, e.getMessage());
            throw new GenerationException(kind, "Generation failed: " + e.getMessage(), e);
        }

        long elapsed = System.currentTimeMillis() - start;
        log.info("Generation complete for {} ({}s)", taskType, String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw GenerationException.transientFailure("Model returned empty content for " + taskType, null);
        }
        if (role.resultKind() == ResultKind.CHAT_REPLY) {
            return Map.of("reply", response.trim());
        }
        return parse(taskType, response);
    }

    private String streamContent(ChatClient.ChatClientRequestSpec spec, Consumer<String> chunkSink) {
        List<String> chunks = spec.stream().content()
                .doOnNext(chunkSink)
                .collectList()
                .block(streamTimeout);
        return chunks == null ? null : String.join("", chunks);
    }

    /**
     * Maps a provider failure onto the retry taxonomy. Unrecognised errors are permanent.
     */
    static FailureKind classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof NonTransientAiException) {
                return FailureKind.PERMANENT;
            }
            if (t instanceof TransientAiException
                    || t instanceof TimeoutException
                    || t instanceof InterruptedException
                    || t instanceof IOException
                    || t instanceof ResourceAccessException
                    || t instanceof HttpServerErrorException) {
                return FailureKind.TRANSIENT;
            }
            if (t instanceof HttpClientErrorException e) {
                return e.getStatusCode().value() == 429 ? FailureKind.TRANSIENT : FailureKind.PERMANENT;
            }
        }
        return FailureKind.PERMANENT;
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private Map<String, Object> parse(String taskType, String response) {
        String cleaned = stripCodeFences(response);
        try {
            Map<String, Object> parsed = mapper.readValue(cleaned, MAP_TYPE);
            if (parsed == null) {
                throw GenerationException.transientFailure("Model returned null JSON for " + taskType, null);
            }
            return parsed;
        } catch (JsonProcessingException e) {
            log.error("Failed to parse model output for {}: {}", taskType, e.getOriginalMessage());
            log.debug("Raw model output: {}", response);
            throw GenerationException.transientFailure("Model output for " + taskType + " is not a JSON object", e);
        }
    }

    static String stripCodeFences(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    private String userPrompt(Map<String, Object> payload, ResultKind kind) {
        String input;
        try {
            input = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new GenerationException(FailureKind.PERMANENT, "Task payload is not serialisable", e);
        }
        return "Task input:\n" + input + "\n\n" + formatInstructions(kind);
    }

    static String formatInstructions(ResultKind kind) {
        if (kind == ResultKind.CHAT_REPLY) {
            return "Reply to the latest user_message in plain conversational text, taking the chat history, "
                    + "the research question and the locked keywords and scope elements into account.";
        }
        String shape = switch (kind) {
            case KEYWORDS -> "{\"keywords\": [\"keyword\", ...]}";
            case SCOPE_ELEMENTS -> "{\"scope_elements\": [{\"name\": \"...\", \"description\": \"...\"}, ...]}";
            case REFLECTION -> "{\"text\": \"...\"}";
            case QUESTION_TEXT -> "{\"question\": \"...\"}";
            case FEASIBILITY -> "{\"score\": 0-10, \"is_niche\": true|false, \"rationale\": \"...\"}";
            case CHAT_REPLY -> throw new IllegalStateException("Chat replies are plain text");
        };
        return "Respond with a single JSON object of the form " + shape + " and nothing else.";
    }

    static ChatOptions chatOptions(Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return null;
        }
        var builder = ChatOptions.builder();
        params.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            String text = value.toString();
            switch (key.toLowerCase(Locale.ROOT).replace('_', '-')) {
                case "model" -> builder.model(text);
                case "temperature" -> builder.temperature(Double.valueOf(text));
                case "top-p" -> builder.topP(Double.valueOf(text));
                case "max-tokens" -> builder.maxTokens(Integer.valueOf(text));
                default -> log.debug("Ignoring unsupported model parameter '{}'", key);
            }
        });
        return builder.build();
    }
}
