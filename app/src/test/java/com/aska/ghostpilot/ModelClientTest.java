package com.aska.ghostpilot;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelClientTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

    private MockWebServer server;
    private ModelClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = new ModelClient(server.url("/v4/").toString(), "test-key", "autoglm-phone");
    }

    @AfterEach
    void tearDown() throws Exception {
        client.release();
        server.shutdown();
    }

    static String completion(String content) {
        return new JSONObject()
            .put("choices", new JSONArray()
                .put(new JSONObject()
                    .put("message", new JSONObject()
                        .put("role", "assistant")
                        .put("content", content))))
            .toString();
    }

    @Test
    void sendsScreenshotAndParsesReply() throws Exception {
        server.enqueue(new MockResponse().setBody(
            completion("<think>open the app</think><answer>do(action=\"Launch\", app=\"微信\")</answer>")));

        ModelResponse response = client.sendStep("给张三发消息", PNG, 2,
            Arrays.asList("a1", "a2", "a3", "a4", "a5", "a6"));

        assertTrue(response.success);
        assertEquals("open the app", response.thinking);
        assertEquals("do(action=\"Launch\", app=\"微信\")", response.action);

        RecordedRequest request = server.takeRequest(2, TimeUnit.SECONDS);
        assertEquals("/v4/chat/completions", request.getPath());
        assertEquals("Bearer test-key", request.getHeader("Authorization"));

        JSONObject body = new JSONObject(request.getBody().readUtf8());
        assertEquals("autoglm-phone", body.getString("model"));
        assertEquals(Config.MODEL_MAX_TOKENS, body.getInt("max_tokens"));
        JSONArray messages = body.getJSONArray("messages");
        assertEquals("system", messages.getJSONObject(0).getString("role"));

        JSONArray content = messages.getJSONObject(1).getJSONArray("content");
        String prompt = content.getJSONObject(0).getString("text");
        assertTrue(prompt.contains("给张三发消息"));
        assertTrue(prompt.contains("a2, a3, a4, a5, a6"));
        assertFalse(prompt.contains("a1"));
        assertEquals("data:image/png;base64,iVBORw==",
            content.getJSONObject(1).getJSONObject("image_url").getString("url"));
    }

    @Test
    void httpErrorIsReported() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("unauthorized"));
        ModelResponse response = client.sendStep("task", PNG, 1, Collections.emptyList());
        assertFalse(response.success);
        assertEquals("API request failed: 401 - unauthorized", response.error);
    }

    @Test
    void missingApiKeyFailsWithoutRequest() {
        ModelClient noKey = new ModelClient(server.url("/").toString(), "  ", null);
        try {
            ModelResponse response = noKey.sendStep("task", PNG, 1, Collections.emptyList());
            assertFalse(response.success);
            assertEquals("No API key configured", response.error);
            assertEquals(0, server.getRequestCount());
            assertEquals(Config.DEFAULT_MODEL_NAME, noKey.getModel());
        } finally {
            noKey.release();
        }
    }

    @Test
    void malformedBodies() {
        assertFalse(ModelClient.parseResponse("not json").success);
        assertFalse(ModelClient.parseResponse("{\"choices\":[]}").success);
        assertFalse(ModelClient.parseResponse("").success);
        assertTrue(ModelClient.parseResponse(completion("finish(\"ok\")")).success);
    }
}
