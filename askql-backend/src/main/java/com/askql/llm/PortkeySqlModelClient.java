package com.askql.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SqlModelClient} for an OpenAI-compatible chat completions API.
 *
 * This implementation targets the Portkey gateway by default and relies solely on HTTP requests
 * (no vendor SDK), so any provider reachable through the gateway (Gemini included) can be used.
 */
@Service
public class PortkeySqlModelClient implements SqlModelClient {

    private static final Logger log = LoggerFactory.getLogger(PortkeySqlModelClient.class);

    private static final String DEFAULT_PORTKEY_BASE_URL = "https://api.portkey.ai";
    private static final int DEFAULT_TIMEOUT_MS = 30000;

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Environment environment;

    /**
     * Create a new client.
     *
     * @param objectMapper Jackson object mapper
     * @param environment Spring environment for configuration
     */
    @Autowired
    public PortkeySqlModelClient(ObjectMapper objectMapper, Environment environment) {
        this(objectMapper, environment, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    PortkeySqlModelClient(ObjectMapper objectMapper, Environment environment, HttpClient httpClient) {
        this.objectMapper = objectMapper;
        this.environment = environment;
        this.httpClient = httpClient;
    }

    /**
     * Log whether the model gateway is configured. Keys are reported as present or missing, never printed.
     */
    @PostConstruct
    public void logAiConfigStatus() {
        PortkeyConfig config = PortkeyConfig.fromEnvironment(environment);
        if (config.isEnabled()) {
            log.info("Text-to-SQL model gateway is ENABLED (gateway_base_url={}, model={})", config.baseUrl(), config.model());
            return;
        }

        log.warn(
                "Text-to-SQL model gateway is DISABLED (gateway_base_url={}, api_key_configured={}, virtual_key_configured={}, model_configured={})",
                config.baseUrl(),
                config.apiKey() != null && !config.apiKey().isBlank(),
                config.virtualKey() != null && !config.virtualKey().isBlank(),
                config.model() != null && !config.model().isBlank()
        );
    }

    /**
     * Whether the gateway is fully configured.
     *
     * @return true when API key, virtual key and model are set
     */
    public boolean isEnabled() {
        return PortkeyConfig.fromEnvironment(environment).isEnabled();
    }

    @Override
    public String generate(String prompt, String systemInstruction, double temperature, int maxTokens) {
        return chat(List.of(ChatMessage.user(prompt)), systemInstruction, temperature, maxTokens);
    }

    @Override
    public String chat(List<ChatMessage> messages, String systemInstruction, double temperature, int maxTokens) {
        PortkeyConfig config = PortkeyConfig.fromEnvironment(environment);
        if (!config.isEnabled()) {
            throw new LlmException(config.disabledReason());
        }

        String body = buildPayload(config, messages, systemInstruction, temperature, maxTokens);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/v1/chat/completions"))
                .timeout(Duration.ofMillis(config.timeoutMs()))
                .header("Content-Type", "application/json")
                .header("x-portkey-api-key", config.apiKey())
                .header("x-portkey-virtual-key", config.virtualKey())
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Model request interrupted", e);
        } catch (IOException e) {
            throw new LlmException("Model request failed: " + e.getMessage(), e);
        }

        if (response.statusCode() >= 400) {
            log.warn(
                    "Model gateway request failed (status_code={}, gateway_base_url={}, model={})",
                    response.statusCode(),
                    config.baseUrl(),
                    config.model()
            );
            throw new LlmException("Model gateway error: HTTP " + response.statusCode() + " - " + response.body());
        }

        String content = readContent(response.body());
        if (content.isBlank()) {
            throw new LlmException("Empty response from model gateway");
        }
        return content.trim();
    }

    private String buildPayload(PortkeyConfig config, List<ChatMessage> messages, String systemInstruction,
                                double temperature, int maxTokens) {
        List<Map<String, Object>> wireMessages = new ArrayList<>();
        if (systemInstruction != null && !systemInstruction.isBlank()) {
            wireMessages.add(Map.of("role", "system", "content", systemInstruction));
        }
        for (ChatMessage message : messages) {
            if (message == null || message.content() == null) {
                continue;
            }
            wireMessages.add(Map.of("role", message.role().wireName(), "content", message.content()));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.model());
        payload.put("messages", wireMessages);
        payload.put("temperature", temperature);
        if (maxTokens > 0) {
            payload.put("max_tokens", maxTokens);
        }

        try {
            return objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new LlmException("Failed to encode model request: " + e.getMessage(), e);
        }
    }

    private String readContent(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
            return contentNode.isTextual() ? contentNode.asText() : "";
        } catch (IOException e) {
            throw new LlmException("Model gateway returned invalid JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Gateway settings: {@code askql.ai.portkey.*} properties, falling back to {@code PORTKEY_*}
     * environment variables.
     */
    record PortkeyConfig(String baseUrl, String apiKey, String virtualKey, String model, int timeoutMs) {

        static PortkeyConfig fromEnvironment(Environment environment) {
            String baseUrl = setting(environment, "base-url", "PORTKEY_BASE_URL");
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = DEFAULT_PORTKEY_BASE_URL;
            }
            if (baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }

            int timeoutMs = DEFAULT_TIMEOUT_MS;
            String timeoutRaw = setting(environment, "timeout-ms", "PORTKEY_TIMEOUT_MS");
            if (timeoutRaw != null && !timeoutRaw.isBlank()) {
                try {
                    timeoutMs = Integer.parseInt(timeoutRaw);
                } catch (NumberFormatException e) {
                    log.warn("Ignoring invalid model timeout '{}', using {} ms", timeoutRaw, DEFAULT_TIMEOUT_MS);
                }
            }

            return new PortkeyConfig(
                    baseUrl,
                    setting(environment, "api-key", "PORTKEY_API_KEY"),
                    setting(environment, "virtual-key", "PORTKEY_VIRTUAL_KEY"),
                    setting(environment, "model", "PORTKEY_MODEL"),
                    timeoutMs
            );
        }

        boolean isEnabled() {
            return hasText(apiKey) && hasText(virtualKey) && hasText(model);
        }

        String disabledReason() {
            return "Text-to-SQL is disabled: set PORTKEY_API_KEY, PORTKEY_VIRTUAL_KEY and PORTKEY_MODEL"
                    + " (or askql.ai.portkey.api-key, virtual-key and model)";
        }

        private static String setting(Environment environment, String name, String envKey) {
            String v = environment.getProperty("askql.ai.portkey." + name);
            if (!hasText(v)) {
                v = environment.getProperty(envKey);
            }
            return v != null ? v.trim() : null;
        }

        private static boolean hasText(String v) {
            return v != null && !v.isBlank();
        }
    }
}
