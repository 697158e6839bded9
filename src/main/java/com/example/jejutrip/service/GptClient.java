package com.example.jejutrip.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/**
 * OpenAI chat completions 호출. JSON 본문만 돌려받는다.
 */
public class GptClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();

    private final String baseUrl;
    private final String apiKey;
    private final String model;

    public GptClient(OkHttpClient http, String baseUrl, String apiKey, String model) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.model = model;
    }

    public String completeJson(String prompt) throws IOException {
        ObjectNode body = om.createObjectNode()
                .put("model", model)
                .put("temperature", 0.2);
        body.set("response_format", om.createObjectNode().put("type", "json_object"));
        body.set("messages", om.createArrayNode()
                .add(om.createObjectNode()
                        .put("role", "user")
                        .put("content", prompt)));

        Request request = new Request.Builder()
                .url(baseUrl + "/chat/completions")
                .addHeader("Authorization", "Bearer " + apiKey)
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(body.toString(), JSON))
                .build();

        try (Response resp = http.newCall(request).execute()) {
            ResponseBody rb = resp.body();
            String text = (rb != null) ? rb.string() : "";
            if (!resp.isSuccessful()) {
                throw new IOException("OpenAI error " + resp.code() + ": " + text);
            }
            JsonNode content = om.readTree(text).path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.asText().isBlank()) {
                throw new IOException("OpenAI returned no content");
            }
            return content.asText();
        }
    }
}
