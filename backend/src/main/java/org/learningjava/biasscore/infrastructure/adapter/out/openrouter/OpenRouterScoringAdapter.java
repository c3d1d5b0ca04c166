package org.learningjava.biasscore.infrastructure.adapter.out.openrouter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.learningjava.biasscore.application.port.ScoringProviderPort;
import org.learningjava.biasscore.domain.error.ProviderErrorCategory;
import org.learningjava.biasscore.domain.error.ProviderException;
import org.learningjava.biasscore.domain.error.ScoringErrorKind;
import org.learningjava.biasscore.domain.error.ScoringException;
import org.learningjava.biasscore.domain.model.ProviderJudgment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenRouter-compatible chat-completions client that turns a prompt into a
 * {@link ProviderJudgment}.
 * <p>
 * A rate-limited primary key is retried once with the backup key; if that is absent or
 * also rate-limited the call fails with {@link ScoringErrorKind#BOTH_LLM_KEYS_RATE_LIMITED}.
 * Other failures (5xx, I/O, unparseable or zero-confidence answers) are retried with
 * linear backoff. 401 and 402 fail immediately.
 */
public class OpenRouterScoringAdapter implements ScoringProviderPort {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterScoringAdapter.class);

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final Pattern SECRET = Pattern.compile("(sk-|or-)[a-zA-Z0-9]{20,}");
    private static final Pattern FENCE = Pattern.compile("(?s)```(?:json)?\\s*(.*?)\\s*```");
    private static final Pattern SCORE_TEXT = Pattern.compile("Score: (-?\\d+\\.?\\d*)");
    private static final Pattern CONFIDENCE_TEXT = Pattern.compile("Confidence: (\\d+\\.?\\d*)");
    private static final Pattern REASONING_TEXT = Pattern.compile("Reasoning: (.+)");
    private static final double DEFAULT_TEXT_CONFIDENCE = 0.5;

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration d) throws InterruptedException;
    }

    private final OkHttpClient http;
    private final ObjectMapper om;
    private final String primaryKey;
    private final String backupKey;
    private final String url;
    private final String referer;
    private final String title;
    private final int maxTokens;
    private final double temperature;
    private final int maxRetries;
    private final Duration backoff;
    private final Sleeper sleeper;

    public OpenRouterScoringAdapter(OkHttpClient http,
                                    ObjectMapper om,
                                    String primaryKey,
                                    String backupKey,
                                    String baseUrl,
                                    String referer,
                                    String title,
                                    int maxTokens,
                                    double temperature,
                                    int maxRetries,
                                    Duration backoff,
                                    Sleeper sleeper) {
        this.http = Objects.requireNonNull(http, "http");
        this.om = om == null ? new ObjectMapper() : om;
        this.primaryKey = primaryKey == null ? "" : primaryKey.trim();
        this.backupKey = backupKey == null ? "" : backupKey.trim();
        this.url = completionsUrl(baseUrl);
        this.referer = referer == null ? "" : referer;
        this.title = title == null ? "" : title;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.maxRetries = Math.max(0, maxRetries);
        this.backoff = backoff == null ? Duration.ZERO : backoff;
        this.sleeper = sleeper == null ? d -> Thread.sleep(d.toMillis()) : sleeper;
        log.debug("OpenRouterScoringAdapter init: url={}, referer={}, title={}, backupKey={}, maxRetries={}",
                url, this.referer, this.title, this.backupKey.isBlank() ? "absent" : "present", this.maxRetries);
    }

    @Override
    public String provider() { return "openrouter"; }

    @Override
    public ProviderJudgment score(String model, String prompt) {
        if (primaryKey.isBlank()) {
            throw new IllegalStateException("LLM API key not configured. Set LLM_API_KEY or mount LLM_API_KEY_FILE.");
        }

        ProviderException last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) pause(backoff.multipliedBy(attempt));
            try {
                String body = callWithFallback(model, prompt);
                ProviderJudgment j = parse(body);
                if (j.confidence() <= 0.0) {
                    throw new UnparseableResponseException("zero confidence in response");
                }
                log.debug("Parsed response for model {}: score={}, confidence={}", model, j.score(), j.confidence());
                return j;
            } catch (ProviderException pe) {
                if (pe.category() == ProviderErrorCategory.AUTHENTICATION
                        || pe.category() == ProviderErrorCategory.INSUFFICIENT_CREDITS) {
                    log.error("LLM call for model '{}' failed without retry: {}", model, pe.getMessage());
                    throw pe;
                }
                last = pe;
            } catch (UnparseableResponseException ue) {
                last = new ProviderException(ProviderErrorCategory.UNKNOWN, 200,
                        "unparseable response: " + ue.getMessage(), Duration.ZERO, ue);
            } catch (IOException io) {
                last = new ProviderException(ProviderErrorCategory.UNKNOWN, 0,
                        "cannot reach " + url + ": " + sanitize(String.valueOf(io.getMessage())), Duration.ZERO, io);
            }
            log.warn("LLM call for model '{}' failed (attempt {}/{}): {}",
                    model, attempt + 1, maxRetries + 1, last.getMessage());
        }
        log.error("LLM call for model '{}' failed after {} attempts", model, maxRetries + 1);
        throw last;
    }

    // ---- HTTP ----

    private String callWithFallback(String model, String prompt) throws IOException {
        HttpOutcome r = call(model, prompt, primaryKey);
        if (isRateLimited(r)) {
            if (backupKey.isBlank()) {
                log.warn("Primary key rate limited for model '{}' and no backup key configured", model);
                throw new ScoringException(ScoringErrorKind.BOTH_LLM_KEYS_RATE_LIMITED,
                        "primary LLM key rate limited and no backup key configured");
            }
            log.warn("Primary key rate limited for model '{}'; retrying with backup key", model);
            r = call(model, prompt, backupKey);
            if (isRateLimited(r)) {
                log.error("Both LLM keys rate limited for model '{}'", model);
                throw new ScoringException(ScoringErrorKind.BOTH_LLM_KEYS_RATE_LIMITED);
            }
        }
        if (r.code() < 200 || r.code() >= 300) throw toProviderException(r);
        return r.body();
    }

    private HttpOutcome call(String model, String prompt, String key) throws IOException {
        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(Map.of("role", "user", "content", prompt)),
                "max_tokens", maxTokens,
                "temperature", temperature
        );

        Request req = new Request.Builder()
                .url(url)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + key)
                .header("HTTP-Referer", referer)
                .header("X-Title", title)
                .post(RequestBody.create(om.writeValueAsBytes(body), JSON))
                .build();

        log.debug("POST {} model='{}' Headers set: Authorization(Bearer ****), HTTP-Referer={}, X-Title={}",
                url, model, referer, title);
        try (Response resp = http.newCall(req).execute()) {
            String raw = resp.body() != null ? resp.body().string() : "";
            log.debug("Raw response for model {} (HTTP {}): {}", model, resp.code(), sanitize(raw));
            return new HttpOutcome(resp.code(), raw, resp.header("Retry-After"));
        }
    }

    private boolean isRateLimited(HttpOutcome r) {
        if (r.code() == 429) return true;
        JsonNode err = readTreeOrNull(r.body());
        if (err == null) return false;
        err = err.path("error");
        if (!err.isObject()) return false;
        String msg = err.path("message").asText("").toLowerCase(Locale.ROOT);
        JsonNode code = err.path("code");
        return msg.contains("rate limit") || (code.isNumber() && code.asInt() == 429) || "429".equals(code.asText());
    }

    private ProviderException toProviderException(HttpOutcome r) {
        String message = null;
        JsonNode root = readTreeOrNull(r.body());
        if (root != null) {
            String m = root.path("error").path("message").asText("");
            if (!m.isBlank()) message = m;
        }
        if (message == null) {
            message = r.code() == 500 && r.body().isBlank() ? "500 Internal Server Error" : "HTTP " + r.code();
        }

        ProviderErrorCategory category = ProviderErrorCategory.classify(r.code(), message);
        Duration retryAfter = Duration.ZERO;
        if (category == ProviderErrorCategory.RATE_LIMIT && r.retryAfter() != null) {
            try {
                retryAfter = Duration.ofSeconds(Long.parseLong(r.retryAfter().trim()));
            } catch (NumberFormatException e) {
                log.warn("Failed to parse Retry-After header '{}'", r.retryAfter());
            }
        }
        log.error("LLM HTTP {} at {}: {} | body={}", r.code(), url, sanitize(message), sanitize(r.body()));
        return new ProviderException(category, r.code(), sanitize(message), retryAfter);
    }

    // ---- parsing ----

    ProviderJudgment parse(String rawBody) throws UnparseableResponseException {
        String sanitized = sanitize(rawBody);
        JsonNode root = readTreeOrNull(rawBody);
        if (root == null) throw new UnparseableResponseException("outer response is not JSON");
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new UnparseableResponseException("no choices in response");
        }

        String content = choices.get(0).path("message").path("content").asText("");
        Matcher fence = FENCE.matcher(content);
        if (fence.find()) content = fence.group(1).trim();

        JsonNode inner = readTreeOrNull(content);
        if (inner != null && inner.isObject() && numericOrAbsent(inner, "score") && numericOrAbsent(inner, "confidence")) {
            return new ProviderJudgment(
                    inner.path("score").asDouble(0.0),
                    inner.path("confidence").asDouble(0.0),
                    inner.path("explanation").asText(""),
                    sanitized);
        }

        Matcher s = SCORE_TEXT.matcher(content);
        if (!s.find()) throw new UnparseableResponseException("no score found in content");
        double score = Double.parseDouble(s.group(1));

        Matcher c = CONFIDENCE_TEXT.matcher(content);
        double confidence = c.find() ? Double.parseDouble(c.group(1)) : DEFAULT_TEXT_CONFIDENCE;

        Matcher r = REASONING_TEXT.matcher(content);
        String explanation = r.find() ? r.group(1).trim() : "Extracted from text response";
        return new ProviderJudgment(score, confidence, explanation, sanitized);
    }

    // ---- helpers ----

    /** Redacts anything that looks like an API key. */
    public static String sanitize(String s) {
        if (s == null) return "";
        return SECRET.matcher(s).replaceAll("[REDACTED]");
    }

    /** Environment value first, then the secrets file; "" when neither is set. */
    public static String resolveApiKey(String envKey, String filePath) {
        String key = envKey == null ? "" : envKey.trim();
        if (!key.isBlank()) return key;
        if (filePath == null || filePath.isBlank()) return "";
        Path path = Path.of(filePath);
        if (!Files.exists(path)) return "";
        try {
            return Files.readString(path, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read API key file " + filePath, e);
        }
    }

    static String completionsUrl(String baseUrl) {
        String b = baseUrl == null || baseUrl.isBlank() ? "https://openrouter.ai/api/v1" : baseUrl.trim();
        if (b.endsWith("/chat/completions")) return b;
        if (b.endsWith("/")) b = b.substring(0, b.length() - 1);
        return b + "/chat/completions";
    }

    private JsonNode readTreeOrNull(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return om.readTree(s);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static boolean numericOrAbsent(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v == null || v.isNull() || v.isNumber();
    }

    private void pause(Duration d) {
        if (d.isZero() || d.isNegative()) return;
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScoringException(ScoringErrorKind.CANCELLED, "interrupted during provider backoff", e);
        }
    }

    private record HttpOutcome(int code, String body, String retryAfter) { }

    static final class UnparseableResponseException extends Exception {
        UnparseableResponseException(String message) {
            super(message);
        }
    }
}
