package com.budgetbridge.ynab.client;

import com.budgetbridge.ynab.config.YnabProperties;
import com.budgetbridge.ynab.error.YnabApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises RestYnabClient against an embedded HttpServer standing in for the YNAB API.
 */
class RestYnabClientTest {

    static HttpServer server;
    static int port;
    static final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    static final AtomicReference<String> lastMethod = new AtomicReference<>();
    static final AtomicReference<String> lastQuery = new AtomicReference<>();
    static final AtomicReference<String> lastBody = new AtomicReference<>();

    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeAll
    static void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        port = server.getAddress().getPort();
        server.createContext("/v1/budgets", exchange -> {
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            lastMethod.set(exchange.getRequestMethod());
            lastQuery.set(exchange.getRequestURI().getRawQuery());
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String path = exchange.getRequestURI().getPath();
            switch (path) {
                case "/v1/budgets/b1/accounts" -> respond(exchange, 200,
                        "{\"data\":{\"accounts\":[{\"id\":\"a1\",\"name\":\"Checking\",\"balance\":1000}],\"server_knowledge\":7}}");
                case "/v1/budgets/b1/transactions" -> {
                    if ("POST".equals(exchange.getRequestMethod())) {
                        respond(exchange, 201, "{\"data\":{\"transaction_ids\":[\"new\"],\"transaction\":{\"id\":\"new\",\"amount\":-19990}}}");
                    } else {
                        respond(exchange, 200,
                                "{\"data\":{\"transactions\":[{\"id\":\"t1\",\"amount\":-5000},{\"id\":\"t2\",\"amount\":2500}]}}");
                    }
                }
                case "/v1/budgets/b1/months/2024-01-01/categories/c1" -> respond(exchange, 200,
                        "{\"data\":{\"category\":{\"id\":\"c1\",\"budgeted\":250000}}}");
                case "/v1/budgets/b1/transactions/gone" -> respond(exchange, 404,
                        "{\"error\":{\"id\":\"404.2\",\"name\":\"resource_not_found\",\"detail\":\"Resource not found\"}}");
                case "/v1/budgets/b1/payees" -> respond(exchange, 429,
                        "{\"error\":{\"id\":\"429\",\"name\":\"too_many_requests\",\"detail\":\"Too many requests\"}}");
                default -> respond(exchange, 200, "{\"unexpected\":true}");
            }
        });
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.start();
    }

    @AfterAll
    static void stop() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private RestYnabClient newClient(String key) {
        return new RestYnabClient(new YnabProperties(
                new YnabProperties.Api("http://localhost:" + port + "/v1", key, 2_000, 5_000),
                new YnabProperties.Output("/tmp/ynab-mcp", null)
        ));
    }

    @Test
    void listAccountsUnwrapsDataEnvelopeWithBearerToken() {
        List<ObjectNode> accounts = newClient("secret-token").listAccounts("b1");

        assertEquals(1, accounts.size());
        assertEquals("Checking", accounts.get(0).get("name").asText());
        assertEquals("Bearer secret-token", lastAuthorization.get());
    }

    @Test
    void sinceDateIsSentAsQueryParameter() {
        List<ObjectNode> transactions = newClient("secret-token").listTransactions("b1", "2024-01-01");

        assertEquals(2, transactions.size());
        assertEquals("since_date=2024-01-01", lastQuery.get());
    }

    @Test
    void sinceDateIsOmittedWhenAbsent() {
        newClient("secret-token").listTransactions("b1", null);

        assertNull(lastQuery.get());
    }

    @Test
    void monthCategoryUpdateUsesPatchWithBudgetedBody() throws Exception {
        ObjectNode category = newClient("secret-token").updateMonthCategory("b1", "2024-01-01", "c1", 250_000L);

        assertEquals("PATCH", lastMethod.get());
        JsonNode body = mapper.readTree(lastBody.get());
        assertEquals(250_000L, body.get("category").get("budgeted").asLong());
        assertEquals(250_000L, category.get("budgeted").asLong());
    }

    @Test
    void createTransactionOmitsNullFields() throws Exception {
        NewTransaction transaction = new NewTransaction("a1", "2024-01-15", -19_990L, null, "Cafe", null, null, "uncleared", true);

        ObjectNode created = newClient("secret-token").createTransaction("b1", transaction);

        assertEquals("new", created.get("id").asText());
        assertEquals("POST", lastMethod.get());
        JsonNode body = mapper.readTree(lastBody.get()).get("transaction");
        assertEquals(-19_990L, body.get("amount").asLong());
        assertFalse(body.has("payee_id"));
        assertFalse(body.has("memo"));
    }

    @Test
    void notFoundBecomesYnabApiException() {
        YnabApiException ex = assertThrows(YnabApiException.class,
                () -> newClient("secret-token").getTransaction("b1", "gone"));

        assertEquals(404, ex.status());
        assertNotNull(ex.reason());
    }

    @Test
    void rateLimitKeepsStatus() {
        YnabApiException ex = assertThrows(YnabApiException.class, () -> newClient("secret-token").listPayees("b1"));

        assertEquals(429, ex.status());
    }

    @Test
    void missingKeyFailsBeforeAnyRequest() {
        lastMethod.set(null);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> newClient(" ").listAccounts("b1"));

        assertEquals("YNAB_API_KEY environment variable is required", ex.getMessage());
        assertNull(lastMethod.get());
    }
}
