package com.budgetbridge.ynab.tools;

import com.budgetbridge.ynab.client.YnabClient;
import com.budgetbridge.ynab.money.EntityTransformer;
import com.budgetbridge.ynab.render.JsonDocumentWriter;
import com.budgetbridge.ynab.render.MarkdownRenderer;
import com.budgetbridge.ynab.render.ResponseFormat;
import com.budgetbridge.ynab.tools.dto.MonthBudgetRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class MonthToolsTest {

    @Mock
    YnabClient ynabClient;

    private final ObjectMapper mapper = new ObjectMapper();
    private MonthTools tools;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        tools = new MonthTools(ynabClient, new EntityTransformer(), new MarkdownRenderer(), new JsonDocumentWriter(mapper));
        ObjectNode month = (ObjectNode) mapper.readTree("""
                {"month":"2024-01-01","income":500000,"budgeted":400000,"activity":-350000,"to_be_budgeted":100000,
                 "age_of_money":12,
                 "categories":[
                   {"name":"Rent","hidden":false,"budgeted":150000,"activity":-150000,"balance":0},
                   {"name":"Old Hobby","hidden":true,"budgeted":0,"activity":0,"balance":5000}]}
                """);
        when(ynabClient.getMonth("b1", "2024-01-01")).thenReturn(month);
    }

    @Test
    void markdownHidesHiddenCategoriesByDefault() {
        String text = tools.getMonthBudget(new MonthBudgetRequest("b1", "2024-01-01", null, null));

        assertThat(text).contains("**Income**: $500.00").contains("**Age of Money**: 12 days");
        assertThat(text).contains("### Rent\n- Budgeted: $150.00\n- Activity: -$150.00\n- Balance: $0.00");
        assertThat(text).doesNotContain("Old Hobby");
    }

    @Test
    void jsonKeepsEverything() throws Exception {
        JsonNode json = mapper.readTree(tools.getMonthBudget(
                new MonthBudgetRequest("b1", "2024-01-01", false, ResponseFormat.JSON)));

        assertThat(json.get("categories")).hasSize(2);
        assertThat(json.get("categories").get(1).get("balance_milliunits").asLong()).isEqualTo(5_000L);
        assertThat(json.get("income_milliunits").asLong()).isEqualTo(500_000L);
    }
}
