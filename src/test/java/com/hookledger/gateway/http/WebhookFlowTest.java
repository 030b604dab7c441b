package com.hookledger.gateway.http;

import com.hookledger.ingest.IngestionPipeline;
import com.hookledger.ingest.PayloadValidator;
import com.hookledger.ingest.WebhookResult;
import com.hookledger.observability.MetricsRegistry;
import com.hookledger.observability.ReadinessProbe;
import com.hookledger.security.SignatureVerifier;
import com.hookledger.shared.config.DatabaseConfig;
import com.hookledger.shared.config.HookLedgerConfig;
import com.hookledger.shared.config.IngestConfig;
import com.hookledger.store.JdbcMessageStore;
import com.hookledger.store.MessageStore;
import com.hookledger.store.StorageUnavailableException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class WebhookFlowTest {

    private static final String SECRET = "testsecret";
    private static final String M1 =
        "{\"message_id\":\"m1\",\"from\":\"+919876543210\",\"to\":\"+14155550100\",\"ts\":\"2025-01-15T10:00:00Z\",\"text\":\"Hello\"}";

    private final SignatureVerifier verifier = new SignatureVerifier();
    private MetricsRegistry metrics;
    private JdbcMessageStore store;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        var ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        store = new JdbcMessageStore(ds, Clock.systemUTC(), 5);
        store.initSchema();
        metrics = new MetricsRegistry(IngestConfig.defaults().latencyBucketsMs());
        mvc = build(store, config(SECRET));
    }

    @Test
    void deliveryScenario() throws Exception {
        var badPhone = M1.replace("\"+919876543210\"", "\"invalid-phone\"");
        var badTs = M1.replace("2025-01-15T10:00:00Z", "2025-01-15 10:00:00");

        deliver(M1, sign(M1))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(header().exists("X-Request-ID"));
        deliver(M1, sign(M1))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
        deliver(M1, "invalid-signature-xyz")
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.detail").value("invalid signature"));
        deliver(badPhone, sign(badPhone))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.detail[0].field").value("from"));
        deliver(badTs, sign(badTs))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.detail[0].field").value("ts"));

        mvc.perform(get("/messages"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(1))
            .andExpect(jsonPath("$.limit").value(50))
            .andExpect(jsonPath("$.offset").value(0))
            .andExpect(jsonPath("$.data.length()").value(1))
            .andExpect(jsonPath("$.data[0].message_id").value("m1"))
            .andExpect(jsonPath("$.data[0].from").value("+919876543210"))
            .andExpect(jsonPath("$.data[0].ts").value("2025-01-15T10:00:00Z"))
            .andExpect(jsonPath("$.data[0].text").value("Hello"));

        assertEquals(1.0, metrics.webhookResultCount(WebhookResult.CREATED));
        assertEquals(1.0, metrics.webhookResultCount(WebhookResult.DUPLICATE));
        assertEquals(1.0, metrics.webhookResultCount(WebhookResult.INVALID_SIGNATURE));
        assertEquals(2.0, metrics.webhookResultCount(WebhookResult.VALIDATION_ERROR));
        assertEquals(2.0, metrics.requestCount("/webhook", 200));
        assertEquals(1.0, metrics.requestCount("/webhook", 401));
        assertEquals(2.0, metrics.requestCount("/webhook", 422));
        assertEquals(5, metrics.latencyCount("/webhook"));
    }

    @Test
    void unstorableValuesAreClientErrorsNotOutages() throws Exception {
        var farFuture = M1.replace("2025-01-15T10:00:00Z", "+999999999-12-31T23:59:59Z");
        var nul = M1.replace("Hello", "Hel\\u0000lo");

        deliver(farFuture, sign(farFuture))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.detail[0].field").value("ts"))
            .andExpect(header().doesNotExist("Retry-After"));
        deliver(nul, sign(nul))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.detail[0].field").value("text"));

        assertEquals(2.0, metrics.webhookResultCount(WebhookResult.VALIDATION_ERROR));
        assertEquals(0.0, metrics.webhookResultCount(WebhookResult.STORAGE_UNAVAILABLE));
        mvc.perform(get("/messages")).andExpect(jsonPath("$.total").value(0));
    }

    @Test
    void missingSignatureHeaderIsUnauthorized() throws Exception {
        mvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(M1))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void listFiltersAndPaging() throws Exception {
        var m2 = M1.replace("\"m1\"", "\"m2\"").replace("Hello", "bye").replace("10:00:00Z", "11:00:00Z");
        var m3 = M1.replace("\"m1\"", "\"m3\"").replace("+919876543210", "+14155550199");
        deliver(M1, sign(M1)).andExpect(status().isOk());
        deliver(m2, sign(m2)).andExpect(status().isOk());
        deliver(m3, sign(m3)).andExpect(status().isOk());

        mvc.perform(get("/messages").param("from", "+919876543210").param("limit", "1").param("offset", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(2))
            .andExpect(jsonPath("$.data[0].message_id").value("m2"));

        // an unencoded '+' arrives as a space
        mvc.perform(get("/messages").param("from", " 919876543210"))
            .andExpect(jsonPath("$.total").value(2));

        mvc.perform(get("/messages").param("since", "2025-01-15T10:30:00Z"))
            .andExpect(jsonPath("$.total").value(1))
            .andExpect(jsonPath("$.data[0].message_id").value("m2"));

        // unencoded '+' of the offset arrives as a space
        mvc.perform(get("/messages").param("since", "2025-01-15T16:00:00 05:30"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(1))
            .andExpect(jsonPath("$.data[0].message_id").value("m2"));

        mvc.perform(get("/messages").param("q", "HELLO"))
            .andExpect(jsonPath("$.total").value(2));
    }

    @Test
    void rejectsBadListParameters() throws Exception {
        mvc.perform(get("/messages").param("limit", "0")).andExpect(status().isUnprocessableEntity());
        mvc.perform(get("/messages").param("limit", "101")).andExpect(status().isUnprocessableEntity());
        mvc.perform(get("/messages").param("offset", "-1")).andExpect(status().isUnprocessableEntity());
        mvc.perform(get("/messages").param("limit", "ten"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.detail").value("limit has an invalid value"));
        mvc.perform(get("/messages").param("since", "yesterday"))
            .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void statsReflectStoredMessages() throws Exception {
        mvc.perform(get("/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_messages").value(0))
            .andExpect(jsonPath("$.first_message_ts").value(nullValue()));

        var m2 = M1.replace("\"m1\"", "\"m2\"").replace("10:00:00Z", "12:00:00Z");
        deliver(M1, sign(M1));
        deliver(m2, sign(m2));

        mvc.perform(get("/stats"))
            .andExpect(jsonPath("$.total_messages").value(2))
            .andExpect(jsonPath("$.senders_count").value(1))
            .andExpect(jsonPath("$.messages_per_sender[0].from").value("+919876543210"))
            .andExpect(jsonPath("$.messages_per_sender[0].count").value(2))
            .andExpect(jsonPath("$.first_message_ts").value("2025-01-15T10:00:00Z"))
            .andExpect(jsonPath("$.last_message_ts").value("2025-01-15T12:00:00Z"));
    }

    @Test
    void metricsEndpointExportsText() throws Exception {
        deliver(M1, sign(M1));
        mvc.perform(get("/metrics"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
            .andExpect(content().string(containsString("webhook_requests_total{result=\"created\"} 1.0")))
            .andExpect(content().string(containsString("http_requests_total{path=\"/webhook\",status=\"200\"}")))
            .andExpect(content().string(containsString("request_latency_seconds_bucket{endpoint=\"/webhook\"")));
    }

    @Test
    void healthEndpoints() throws Exception {
        mvc.perform(get("/health/live"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("alive"));
        mvc.perform(get("/health/ready"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ready"));

        var unconfigured = build(store, config(null));
        unconfigured.perform(get("/health/ready"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.reason").value("WEBHOOK_SECRET environment variable is not set"));
    }

    @Test
    void storageOutageAnswersRetryableError() throws Exception {
        var down = mock(MessageStore.class);
        var cause = new SQLException("Connection refused", "08001");
        when(down.insert(any())).thenThrow(new StorageUnavailableException("insert failed", cause));
        when(down.list(any(), anyInt(), anyInt()))
            .thenThrow(new StorageUnavailableException("list failed", cause));
        when(down.ping()).thenReturn(false);
        var outage = build(down, config(SECRET));

        outage.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON)
                .header("X-Signature", sign(M1)).content(M1))
            .andExpect(status().isServiceUnavailable())
            .andExpect(header().string("Retry-After", "1"))
            .andExpect(jsonPath("$.detail").value("storage unavailable"));
        outage.perform(get("/messages")).andExpect(status().isServiceUnavailable());
        outage.perform(get("/health/ready"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.reason").value("database not ready"));

        assertEquals(1.0, metrics.webhookResultCount(WebhookResult.STORAGE_UNAVAILABLE));
        assertEquals(1.0, metrics.requestCount("/webhook", 503));
    }

    @Test
    void requestIdIsEchoed() throws Exception {
        mvc.perform(get("/health/live").header("X-Request-ID", "abc-123"))
            .andExpect(header().string("X-Request-ID", "abc-123"));
    }

    private MockMvc build(MessageStore messageStore, HookLedgerConfig config) {
        var pipeline = new IngestionPipeline(verifier, new PayloadValidator(config.ingest().maxTextLength()),
            messageStore, metrics, config.secretBytes());
        return MockMvcBuilders.standaloneSetup(
                new WebhookController(pipeline, config),
                new MessageController(messageStore),
                new MetricsController(metrics),
                new HealthController(new ReadinessProbe(config, messageStore)))
            .setControllerAdvice(new ApiExceptionHandler())
            .addInterceptors(new RequestMetricsInterceptor(metrics))
            .build();
    }

    private ResultActions deliver(String body, String signature) throws Exception {
        return mvc.perform(post("/webhook")
            .contentType(MediaType.APPLICATION_JSON)
            .header("X-Signature", signature)
            .content(body));
    }

    private String sign(String body) {
        return verifier.sign(body.getBytes(StandardCharsets.UTF_8), SECRET.getBytes(StandardCharsets.UTF_8));
    }

    private static HookLedgerConfig config(String secret) {
        return new HookLedgerConfig(8000, secret, "INFO", DatabaseConfig.defaults(), IngestConfig.defaults());
    }
}
