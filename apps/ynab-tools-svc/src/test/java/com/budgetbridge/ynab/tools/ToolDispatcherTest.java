package com.budgetbridge.ynab.tools;

import com.budgetbridge.ynab.error.ErrorClassifier;
import com.budgetbridge.ynab.error.FailureKind;
import com.budgetbridge.ynab.error.ToolResult;
import com.budgetbridge.ynab.error.YnabApiException;
import com.budgetbridge.ynab.tools.dto.BudgetListRequest;
import com.budgetbridge.ynab.tools.dto.TransactionRequest;
import com.budgetbridge.ynab.tools.dto.UpdateTransactionRequest;
import com.budgetbridge.ynab.render.ResponseFormat;
import com.budgetbridge.ynab.validation.ToolParameterValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ToolDispatcherTest {

    @Mock BudgetTools budgetTools;
    @Mock AccountTools accountTools;
    @Mock CategoryTools categoryTools;
    @Mock PayeeTools payeeTools;
    @Mock TransactionTools transactionTools;
    @Mock MonthTools monthTools;
    @Mock ScheduledTransactionTools scheduledTools;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ErrorClassifier classifier = new ErrorClassifier();
    private ValidatorFactory validatorFactory;
    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        validatorFactory = Validation.buildDefaultValidatorFactory();
        ToolRegistry registry = new ToolRegistry(budgetTools, accountTools, categoryTools, payeeTools,
                transactionTools, monthTools, scheduledTools);
        dispatcher = new ToolDispatcher(registry, new ToolParameterValidator(validatorFactory.getValidator(), mapper), mapper);
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void registryExposesAllTools() {
        ToolRegistry registry = new ToolRegistry(budgetTools, accountTools, categoryTools, payeeTools,
                transactionTools, monthTools, scheduledTools);

        assertThat(registry.descriptors()).hasSize(16);
        assertThat(registry.find("ynab_update_transaction")).get()
                .extracting(tool -> tool.descriptor().readOnly())
                .isEqualTo(false);
    }

    @Test
    void unknownToolIsRejected() {
        assertThatThrownBy(() -> dispatcher.dispatch("ynab_delete_budget", mapper.createObjectNode()))
                .isInstanceOf(UnknownToolException.class)
                .hasMessage("Unknown tool: ynab_delete_budget");
    }

    @Test
    void stringParametersAreStrippedAndUnknownOnesIgnored() throws Exception {
        when(transactionTools.getTransaction(any())).thenReturn("{}");

        ToolResult result = dispatcher.dispatch("ynab_get_transaction",
                mapper.readTree("{\"budget_id\":\"  b1 \",\"transaction_id\":\"t1\",\"verbose\":true}"));

        assertThat(result.isSuccess()).isTrue();
        verify(transactionTools).getTransaction(new TransactionRequest("b1", "t1"));
    }

    @Test
    void missingRequiredParametersFailValidation() {
        ToolResult result = dispatcher.dispatch("ynab_get_transaction", null);

        assertThat(result.failure()).get().extracting(failure -> failure.kind()).isEqualTo(FailureKind.VALIDATION);
        assertThat(result.render(classifier)).isEqualTo(
                "Error: ValidationError: budget_id: must not be blank; transaction_id: must not be blank");
        verifyNoInteractions(transactionTools);
    }

    @Test
    void whitespaceOnlyIdIsBlank() throws Exception {
        ToolResult result = dispatcher.dispatch("ynab_get_payees", mapper.readTree("{\"budget_id\":\"   \"}"));

        assertThat(result.render(classifier)).isEqualTo("Error: ValidationError: budget_id: must not be blank");
    }

    @Test
    void unsupportedResponseFormatFailsBinding() throws Exception {
        ToolResult result = dispatcher.dispatch("ynab_get_accounts",
                mapper.readTree("{\"budget_id\":\"b1\",\"response_format\":\"xml\"}"));

        assertThat(result.render(classifier)).startsWith("Error: ValidationError: Invalid parameters:");
        verifyNoInteractions(accountTools);
    }

    @Test
    void responseFormatDefaultsAndIsCaseInsensitive() throws Exception {
        when(accountTools.getAccounts(any())).thenReturn("# Accounts");

        dispatcher.dispatch("ynab_get_accounts", mapper.readTree("{\"budget_id\":\"b1\",\"response_format\":\"JSON\"}"));

        verify(accountTools).getAccounts(new BudgetListRequest("b1", ResponseFormat.JSON));
    }

    @Test
    void upstreamFailureIsClassified() throws Exception {
        when(transactionTools.getTransaction(any())).thenThrow(new YnabApiException(404, "Not Found", null));

        ToolResult result = dispatcher.dispatch("ynab_get_transaction",
                mapper.readTree("{\"budget_id\":\"b1\",\"transaction_id\":\"missing\"}"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.render(classifier)).isEqualTo("Error: Resource not found. Check the ID is correct.");
    }

    @Test
    void nonObjectParametersAreRejected() throws Exception {
        ToolResult result = dispatcher.dispatch("ynab_get_budgets", mapper.readTree("[1,2]"));

        assertThat(result.render(classifier)).isEqualTo("Error: ValidationError: parameters must be a JSON object");
        verifyNoInteractions(budgetTools);
    }

    @Test
    void fractionalMilliunitsAreRejected() throws Exception {
        ToolResult result = dispatcher.dispatch("ynab_create_transaction", mapper.readTree(
                "{\"budget_id\":\"b1\",\"account_id\":\"a1\",\"date\":\"2024-01-15\",\"amount_milliunits\":1000.7}"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.render(classifier)).startsWith("Error: ValidationError: Invalid parameters:");
        verifyNoInteractions(transactionTools);
    }

    @Test
    void blankClearedOnUpdateLeavesStatusUnchanged() throws Exception {
        when(transactionTools.updateTransaction(any())).thenReturn("{}");

        ToolResult result = dispatcher.dispatch("ynab_update_transaction", mapper.readTree(
                "{\"budget_id\":\"b1\",\"transaction_id\":\"t1\",\"memo\":\"rent\",\"cleared\":\"\"}"));

        assertThat(result.isSuccess()).isTrue();
        ArgumentCaptor<UpdateTransactionRequest> captor = ArgumentCaptor.forClass(UpdateTransactionRequest.class);
        verify(transactionTools).updateTransaction(captor.capture());
        assertThat(captor.getValue().cleared()).isNull();
        assertThat(captor.getValue().memo()).isEqualTo("rent");
    }
}
