package com.budgetbridge.ynab.client;

import com.budgetbridge.ynab.config.YnabProperties;
import com.budgetbridge.ynab.error.YnabApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

/**
 * Blocking YNAB API client over Spring {@link RestClient}. Every response is unwrapped from the
 * {@code data} envelope YNAB puts around its payloads.
 */
@Component
public class RestYnabClient implements YnabClient {

    private static final Logger log = LoggerFactory.getLogger(RestYnabClient.class);

    private final YnabProperties properties;
    private final RestClient restClient;

    public RestYnabClient(YnabProperties properties) {
        this.properties = properties;

        // JDK HttpClient rather than HttpURLConnection: the month category endpoint needs PATCH
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.api().connectTimeoutMs()))
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(properties.api().readTimeoutMs()));

        this.restClient = RestClient.builder()
                .baseUrl(properties.api().baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
        log.info("YNAB client configured: baseUrl={} credentialConfigured={}",
                properties.api().baseUrl(), properties.api().hasKey());
    }

    @Override
    public List<ObjectNode> listBudgets(boolean includeAccounts) {
        JsonNode data = get(uri -> uri.path("/budgets")
                .queryParam("include_accounts", includeAccounts)
                .build());
        return objects(data, "budgets");
    }

    @Override
    public ObjectNode getBudget(String budgetId) {
        return object(get(uri -> uri.path("/budgets/{budgetId}").build(budgetId)), "budget");
    }

    @Override
    public List<ObjectNode> listAccounts(String budgetId) {
        return objects(get(uri -> uri.path("/budgets/{budgetId}/accounts").build(budgetId)), "accounts");
    }

    @Override
    public ObjectNode getAccount(String budgetId, String accountId) {
        JsonNode data = get(uri -> uri.path("/budgets/{budgetId}/accounts/{accountId}").build(budgetId, accountId));
        return object(data, "account");
    }

    @Override
    public List<ObjectNode> listCategoryGroups(String budgetId) {
        return objects(get(uri -> uri.path("/budgets/{budgetId}/categories").build(budgetId)), "category_groups");
    }

    @Override
    public ObjectNode getCategory(String budgetId, String categoryId) {
        JsonNode data = get(uri -> uri.path("/budgets/{budgetId}/categories/{categoryId}").build(budgetId, categoryId));
        return object(data, "category");
    }

    @Override
    public ObjectNode updateMonthCategory(String budgetId, String month, String categoryId, long budgeted) {
        var body = Map.of("category", Map.of("budgeted", budgeted));
        JsonNode data = send(HttpMethod.PATCH,
                uri -> uri.path("/budgets/{budgetId}/months/{month}/categories/{categoryId}")
                        .build(budgetId, month, categoryId),
                body);
        return object(data, "category");
    }

    @Override
    public List<ObjectNode> listPayees(String budgetId) {
        return objects(get(uri -> uri.path("/budgets/{budgetId}/payees").build(budgetId)), "payees");
    }

    @Override
    public List<ObjectNode> listTransactions(String budgetId, String sinceDate) {
        JsonNode data = get(uri -> uri.path("/budgets/{budgetId}/transactions")
                .queryParamIfPresent("since_date", Optional.ofNullable(sinceDate))
                .build(budgetId));
        return objects(data, "transactions");
    }

    @Override
    public List<ObjectNode> listTransactionsByAccount(String budgetId, String accountId, String sinceDate) {
        JsonNode data = get(uri -> uri.path("/budgets/{budgetId}/accounts/{accountId}/transactions")
                .queryParamIfPresent("since_date", Optional.ofNullable(sinceDate))
                .build(budgetId, accountId));
        return objects(data, "transactions");
    }

    @Override
    public List<ObjectNode> listTransactionsByCategory(String budgetId, String categoryId, String sinceDate) {
        JsonNode data = get(uri -> uri.path("/budgets/{budgetId}/categories/{categoryId}/transactions")
                .queryParamIfPresent("since_date", Optional.ofNullable(sinceDate))
                .build(budgetId, categoryId));
        return objects(data, "transactions");
    }

    @Override
    public List<ObjectNode> listTransactionsByPayee(String budgetId, String payeeId, String sinceDate) {
        JsonNode data = get(uri -> uri.path("/budgets/{budgetId}/payees/{payeeId}/transactions")
                .queryParamIfPresent("since_date", Optional.ofNullable(sinceDate))
                .build(budgetId, payeeId));
        return objects(data, "transactions");
    }

    @Override
    public ObjectNode getTransaction(String budgetId, String transactionId) {
        JsonNode data = get(uri -> uri.path("/budgets/{budgetId}/transactions/{transactionId}")
                .build(budgetId, transactionId));
        return object(data, "transaction");
    }

    @Override
    public ObjectNode createTransaction(String budgetId, NewTransaction transaction) {
        JsonNode data = send(HttpMethod.POST,
                uri -> uri.path("/budgets/{budgetId}/transactions").build(budgetId),
                Map.of("transaction", transaction));
        return object(data, "transaction");
    }

    @Override
    public ObjectNode updateTransaction(String budgetId, String transactionId, TransactionPatch patch) {
        JsonNode data = send(HttpMethod.PUT,
                uri -> uri.path("/budgets/{budgetId}/transactions/{transactionId}").build(budgetId, transactionId),
                Map.of("transaction", patch));
        return object(data, "transaction");
    }

    @Override
    public ObjectNode getMonth(String budgetId, String month) {
        return object(get(uri -> uri.path("/budgets/{budgetId}/months/{month}").build(budgetId, month)), "month");
    }

    @Override
    public List<ObjectNode> listScheduledTransactions(String budgetId) {
        JsonNode data = get(uri -> uri.path("/budgets/{budgetId}/scheduled_transactions").build(budgetId));
        return objects(data, "scheduled_transactions");
    }

    @Override
    public ObjectNode createScheduledTransaction(String budgetId, NewScheduledTransaction transaction) {
        JsonNode data = send(HttpMethod.POST,
                uri -> uri.path("/budgets/{budgetId}/scheduled_transactions").build(budgetId),
                Map.of("scheduled_transaction", transaction));
        return object(data, "scheduled_transaction");
    }

    private JsonNode get(Function<UriBuilder, URI> uri) {
        String apiKey = requireApiKey();
        try {
            JsonNode response = restClient.get()
                    .uri(uri)
                    .headers(headers -> headers.setBearerAuth(apiKey))
                    .retrieve()
                    .body(JsonNode.class);
            return unwrap(response);
        } catch (RestClientResponseException ex) {
            throw translate(ex);
        }
    }

    private JsonNode send(HttpMethod method, Function<UriBuilder, URI> uri, Object body) {
        String apiKey = requireApiKey();
        try {
            JsonNode response = restClient.method(method)
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(apiKey))
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
            return unwrap(response);
        } catch (RestClientResponseException ex) {
            throw translate(ex);
        }
    }

    private String requireApiKey() {
        if (!properties.api().hasKey()) {
            throw new IllegalStateException("YNAB_API_KEY environment variable is required");
        }
        return properties.api().key();
    }

    private YnabApiException translate(RestClientResponseException ex) {
        int status = ex.getStatusCode().value();
        String reason = ex.getStatusText();
        if (reason == null || reason.isBlank()) {
            reason = errorDetail(ex).orElse("Unknown error");
        }
        log.warn("YNAB API call failed (status {}): {}", status, reason);
        return new YnabApiException(status, reason, ex);
    }

    private static Optional<String> errorDetail(RestClientResponseException ex) {
        try {
            JsonNode body = ex.getResponseBodyAs(JsonNode.class);
            return Optional.ofNullable(body)
                    .map(node -> node.path("error").path("detail").asText(null))
                    .filter(detail -> !detail.isBlank());
        } catch (RuntimeException parseFailure) {
            log.debug("YNAB error body was not JSON: {}", parseFailure.getMessage());
            return Optional.empty();
        }
    }

    private static JsonNode unwrap(JsonNode response) {
        if (response == null || !response.has("data")) {
            throw new IllegalStateException("YNAB response did not contain a data envelope");
        }
        return response.get("data");
    }

    private static ObjectNode object(JsonNode data, String field) {
        JsonNode node = data.get(field);
        if (!(node instanceof ObjectNode objectNode)) {
            throw new IllegalStateException("YNAB response is missing '" + field + "'");
        }
        return objectNode;
    }

    private static List<ObjectNode> objects(JsonNode data, String field) {
        JsonNode node = data.get(field);
        List<ObjectNode> items = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return items;
        }
        for (JsonNode item : node) {
            if (item instanceof ObjectNode objectNode) {
                items.add(objectNode);
            }
        }
        return items;
    }
}
