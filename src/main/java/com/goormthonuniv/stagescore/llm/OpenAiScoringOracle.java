package com.goormthonuniv.stagescore.llm;

import com.goormthonuniv.stagescore.exception.OracleException;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenAI 호환 chat-completions 채점 오라클.
 * - API 키가 없으면 unavailable
 * - 429/5xx/네트워크/응답 파싱 오류는 재시도 대상, 그 외 4xx 는 즉시 실패
 */
public class OpenAiScoringOracle implements ScoringOracle {

    private static final Pattern SCORE = Pattern.compile("\\b(\\d{1,3})\\b");
    private static final int MAX_INPUT_CHARS = 6000;

    private static final String SYSTEM_PROMPT = """
            You are a theater critic review scorer. Read the review and rate how favorable it is \
            toward the production on a 0-100 scale: 85-100 rave, 70-84 positive, 50-69 mixed, \
            0-49 pan. Return ONLY the integer.""";

    private final String name;
    private final RestClient rest;
    private final String baseUrl;
    private final String apiKey;
    private final String model;

    public OpenAiScoringOracle(String name, RestClient rest, String baseUrl, String apiKey, String model) {
        this.name = name;
        this.rest = rest;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public OracleResult score(String reviewText) {
        if (!isAvailable()) return OracleResult.failure(name, "api key not configured", false);
        try {
            return OracleResult.ok(name, requestScore(reviewText));
        } catch (OracleException e) {
            return OracleResult.failure(name, e.getMessage(), e.isRetryable());
        }
    }

    @SuppressWarnings("unchecked")
    private int requestScore(String reviewText) {
        String text = reviewText.length() > MAX_INPUT_CHARS ? reviewText.substring(0, MAX_INPUT_CHARS) : reviewText;
        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", "REVIEW:\n" + text + "\n\nReturn ONLY the integer score.")
                ),
                "temperature", 0
        );

        Map<?, ?> res;
        try {
            res = rest.post()
                    .uri(baseUrl + "/chat/completions")
                    .header("Authorization", "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve().body(Map.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            boolean retryable = status == 429 || status >= 500;
            throw new OracleException(name + " http " + status, retryable, e);
        } catch (ResourceAccessException e) {
            throw new OracleException(name + " io error: " + e.getMessage(), true, e);
        }

        if (res == null) throw new OracleException(name + " empty response", true);
        var choices = (List<Map<String, Object>>) res.get("choices");
        if (choices == null || choices.isEmpty()) throw new OracleException(name + " no choices", true);
        Object message = choices.get(0).get("message");
        String content = message instanceof Map<?, ?> m ? String.valueOf(m.get("content")) : null;
        return parseScore(content);
    }

    /** 응답 문자열에서 첫 정수를 점수로 */
    int parseScore(String content) {
        if (content == null) throw new OracleException(name + " no content", true);
        Matcher m = SCORE.matcher(content);
        if (!m.find()) throw new OracleException(name + " unparseable response: " + abbreviate(content), true);
        int v = Integer.parseInt(m.group(1));
        if (v > 100) throw new OracleException(name + " score out of range: " + v, true);
        return v;
    }

    private static String abbreviate(String s) {
        return s.length() > 80 ? s.substring(0, 80) + "..." : s;
    }
}
