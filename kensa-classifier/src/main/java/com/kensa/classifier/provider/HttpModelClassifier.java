package com.kensa.classifier.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kensa.common.exception.ClassifierException;
import com.kensa.image.model.ClassifierInput;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.util.Base64;

/**
 * 通过 HTTP 调用模型推理服务。
 * <p>
 * 请求体：{"model": 名称, "width": 宽, "height": 高, "image": PNG 的 Base64}
 * 响应体：{"probability": 0.87}
 */
@Slf4j
public class HttpModelClassifier implements SurfaceClassifier {

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String name;
    private final String url;

    public HttpModelClassifier(OkHttpClient httpClient, ObjectMapper objectMapper, String name, String url) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.name = name;
        this.url = url;
    }

    @Override
    public double probability(ClassifierInput input) {
        try {
            Request request = new Request.Builder()
                    .url(url)
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(buildRequestBody(input), JSON_MEDIA))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                String body = response.body() != null ? response.body().string() : "";

                if (!response.isSuccessful()) {
                    log.error("模型 {} 调用失败: {} - {}", name, response.code(), body);
                    throw new ClassifierException("模型 " + name + " 返回错误: " + response.code());
                }

                double probability = parseProbability(body);
                log.info("模型 {} 输出概率: {}", name, String.format("%.4f", probability));
                return probability;
            }

        } catch (ClassifierException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new ClassifierException("模型 " + name + " 响应不是合法 JSON", e);
        } catch (IOException e) {
            throw new ClassifierException("调用模型 " + name + " 时发生网络错误", e);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    private String buildRequestBody(ClassifierInput input) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", name);
        root.put("width", input.getWidth());
        root.put("height", input.getHeight());
        root.put("image", Base64.getEncoder().encodeToString(input.getPng()));
        return objectMapper.writeValueAsString(root);
    }

    private double parseProbability(String body) throws IOException {
        JsonNode json = objectMapper.readTree(body);
        JsonNode node = json == null ? null : json.get("probability");
        if (node == null || !node.isNumber()) {
            throw new ClassifierException("模型 " + name + " 响应缺少 probability 字段");
        }
        double probability = node.asDouble();
        if (!Double.isFinite(probability) || probability < 0.0 || probability > 1.0) {
            throw new ClassifierException("模型 " + name + " 返回的概率越界: " + probability);
        }
        return probability;
    }
}
