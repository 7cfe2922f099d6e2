package com.kensa.classifier.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kensa.common.exception.ClassifierException;
import com.kensa.image.model.ClassifierInput;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class HttpModelClassifierTest {

    private MockWebServer server;
    private HttpModelClassifier classifier;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ClassifierInput input = new ClassifierInput(2, 1, new float[6], new byte[]{1, 2, 3});

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        classifier = new HttpModelClassifier(new OkHttpClient(), objectMapper,
                "metal-surface-validator", server.url("/v1/predict").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void readsProbabilityAndSendsImage() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"probability\": 0.8731}"));

        double p = classifier.probability(input);

        assertEquals(0.8731, p, 1e-9);
        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("metal-surface-validator", body.get("model").asText());
        assertEquals(2, body.get("width").asInt());
        assertArrayEquals(new byte[]{1, 2, 3}, Base64.getDecoder().decode(body.get("image").asText()));
    }

    @Test
    void serverErrorIsPropagated() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("model warming up"));

        ClassifierException e = assertThrows(ClassifierException.class, () -> classifier.probability(input));
        assertTrue(e.getMessage().contains("503"));
    }

    @Test
    void missingProbabilityIsRejected() {
        server.enqueue(new MockResponse().setBody("{\"score\": 0.3}"));

        assertThrows(ClassifierException.class, () -> classifier.probability(input));
    }

    @Test
    void outOfRangeProbabilityIsRejected() {
        server.enqueue(new MockResponse().setBody("{\"probability\": 1.2}"));

        assertThrows(ClassifierException.class, () -> classifier.probability(input));
    }

    @Test
    void unreachableServerIsClassifierError() throws IOException {
        String url = server.url("/v1/predict").toString();
        server.shutdown();
        HttpModelClassifier offline = new HttpModelClassifier(new OkHttpClient(), objectMapper, "defect", url);

        ClassifierException e = assertThrows(ClassifierException.class, () -> offline.probability(input));
        assertNotNull(e.getCause());
    }
}
