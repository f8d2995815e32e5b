package com.fisheye.vision.core.analysis;

import com.fisheye.vision.util.RetrySupport;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Base64;

/**
 * OpenAI 兼容的 chat-completions 视觉客户端
 * <p>
 * 请求体：一条 user 消息，包含文本提示词和 data:image/jpeg;base64 图像。
 * 网络错误、超时、429、5xx 按有界指数退避重试；认证与参数错误直接返回失败结果
 */
public class OpenAiVisionClient implements VisionAnalysisClient {
    private static final Logger logger = LoggerFactory.getLogger(OpenAiVisionClient.class);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY = 300;

    private final OkHttpClient httpClient;
    private final String endpoint;
    private final String apiKey;
    private final int maxAttempts;
    private final long backoffMillis;
    private final int maxTokens;
    private final Gson gson = new Gson();

    public OpenAiVisionClient(String baseUrl, String apiKey, Duration timeout,
                              int maxAttempts, long backoffMillis, int maxTokens) {
        this.endpoint = trimTrailingSlash(baseUrl) + "/chat/completions";
        this.apiKey = apiKey;
        this.maxAttempts = maxAttempts;
        this.backoffMillis = backoffMillis;
        this.maxTokens = maxTokens;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout.multipliedBy(2))
                .build();
    }

    @Override
    public AnalysisResult analyze(byte[] jpeg, String prompt, String model) {
        if (jpeg == null || jpeg.length == 0) {
            return AnalysisResult.failure("No image data to analyze");
        }
        if (VisionModel.findById(model) == null) {
            logger.warn("Model '{}' is not in the catalog, forwarding as-is", model);
        }
        String payload = buildPayload(jpeg, prompt, model);
        long start = System.currentTimeMillis();
        try {
            String content = RetrySupport.execute("Vision analysis with " + model, maxAttempts, backoffMillis,
                    OpenAiVisionClient::isRetryable, () -> send(payload));
            logger.info("Vision analysis with {} completed in {} ms", model, System.currentTimeMillis() - start);
            return AnalysisResponseParser.parse(content);
        } catch (VisionServiceException e) {
            logger.warn("Vision analysis with {} failed: {}", model, e.getMessage());
            return AnalysisResult.failure(e.getMessage());
        } catch (InterruptedIOException e) {
            logger.warn("Vision analysis with {} timed out or was cancelled: {}", model, e.getMessage());
            return AnalysisResult.failure("Vision service call timed out or was cancelled");
        } catch (Exception e) {
            logger.error("Vision analysis with {} failed after {} attempts", model, maxAttempts, e);
            return AnalysisResult.failure("Vision service call failed: " + e.getMessage());
        }
    }

    String buildPayload(byte[] jpeg, String prompt, String model) {
        JsonObject textPart = new JsonObject();
        textPart.addProperty("type", "text");
        textPart.addProperty("text", prompt);

        JsonObject imageUrl = new JsonObject();
        imageUrl.addProperty("url", "data:image/jpeg;base64," + Base64.getEncoder().encodeToString(jpeg));
        JsonObject imagePart = new JsonObject();
        imagePart.addProperty("type", "image_url");
        imagePart.add("image_url", imageUrl);

        JsonArray content = new JsonArray();
        content.add(textPart);
        content.add(imagePart);

        JsonObject message = new JsonObject();
        message.addProperty("role", "user");
        message.add("content", content);

        JsonArray messages = new JsonArray();
        messages.add(message);

        JsonObject body = new JsonObject();
        body.addProperty("model", model);
        body.add("messages", messages);
        body.addProperty("max_tokens", maxTokens);
        return gson.toJson(body);
    }

    private String send(String payload) throws IOException {
        Request.Builder builder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new VisionServiceException(response.code(),
                        "Vision service returned HTTP " + response.code() + ": " + abbreviate(text));
            }
            return extractContent(text);
        }
    }

    /**
     * 取 choices[0].message.content，兼容字符串和分段数组两种格式
     */
    static String extractContent(String responseBody) {
        try {
            JsonObject root = JsonParser.parseString(responseBody).getAsJsonObject();
            JsonArray choices = root.getAsJsonArray("choices");
            if (choices == null || choices.size() == 0) {
                throw new VisionServiceException("Vision service response has no choices");
            }
            JsonObject message = choices.get(0).getAsJsonObject().getAsJsonObject("message");
            JsonElement content = message == null ? null : message.get("content");
            if (content == null || content.isJsonNull()) {
                throw new VisionServiceException("Vision service response has no message content");
            }
            if (content.isJsonPrimitive()) {
                return content.getAsString();
            }
            StringBuilder sb = new StringBuilder();
            for (JsonElement part : content.getAsJsonArray()) {
                JsonObject obj = part.getAsJsonObject();
                if (obj.has("text")) {
                    sb.append(obj.get("text").getAsString());
                }
            }
            return sb.toString();
        } catch (IllegalStateException | ClassCastException | com.google.gson.JsonParseException e) {
            throw new VisionServiceException("Unparseable vision service response: " + abbreviate(responseBody));
        }
    }

    private static boolean isRetryable(Exception e) {
        if (e instanceof VisionServiceException) {
            return ((VisionServiceException) e).isRetryable();
        }
        return e instanceof IOException;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_ERROR_BODY ? text : text.substring(0, MAX_ERROR_BODY) + "...";
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
