package com.chicu.signalbot.debrid;

import lombok.extern.slf4j.Slf4j;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * AllDebrid API v4: проверка авторизации ключа (GET /v4/user).
 */
@Slf4j
public class AllDebridClient {

    private final RestTemplate rest;
    private final String baseUrl;
    private final String apiKey;

    public AllDebridClient(RestTemplate rest, String baseUrl, String apiKey) {
        this.rest = rest;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public DebridAccountStatus status() {
        if (!isConfigured()) {
            return DebridAccountStatus.failure(DebridAccountStatus.Kind.NOT_CONFIGURED, 0,
                    "ALLDEBRID_API_KEY is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);

        try {
            ResponseEntity<String> resp = rest.exchange(
                    baseUrl + "/v4/user", HttpMethod.GET, new HttpEntity<>(headers), String.class);
            return parse(resp.getStatusCode().value(), resp.getBody());

        } catch (HttpStatusCodeException e) {
            int code = e.getStatusCode().value();
            log.warn("⚠ AllDebrid HTTP {}", code);
            if (code == 401) {
                return DebridAccountStatus.failure(DebridAccountStatus.Kind.UNAUTHORIZED, code, "Invalid API key");
            }
            if (code == 429) {
                return DebridAccountStatus.failure(DebridAccountStatus.Kind.RATE_LIMITED, code,
                        "Too many requests to AllDebrid API");
            }
            return DebridAccountStatus.failure(DebridAccountStatus.Kind.HTTP_ERROR, code, "Status code " + code);

        } catch (RestClientException e) {
            log.error("❌ AllDebrid connection error: {}", e.getMessage());
            return DebridAccountStatus.failure(DebridAccountStatus.Kind.CONNECTION_ERROR, 0,
                    e.getClass().getSimpleName() + " - " + e.getMessage());
        }
    }

    static DebridAccountStatus parse(int httpStatus, String body) {
        if (body == null || body.isBlank()) {
            return DebridAccountStatus.failure(DebridAccountStatus.Kind.API_ERROR, httpStatus, "Empty response");
        }
        try {
            JSONObject root = new JSONObject(body);
            if (!"success".equals(root.optString("status"))) {
                JSONObject err = root.optJSONObject("error");
                String msg = err != null ? err.optString("message", "Unknown error") : "Unknown error";
                return DebridAccountStatus.failure(DebridAccountStatus.Kind.API_ERROR, httpStatus, msg);
            }
            JSONObject data = root.optJSONObject("data");
            JSONObject user = data != null ? data.optJSONObject("user") : null;
            String username = user != null ? user.optString("username", "Unknown") : "Unknown";
            boolean premium = user != null && user.optBoolean("isPremium", false);
            return DebridAccountStatus.ok(username, premium);

        } catch (JSONException e) {
            return DebridAccountStatus.failure(DebridAccountStatus.Kind.API_ERROR, httpStatus,
                    "Malformed response: " + e.getMessage());
        }
    }
}
