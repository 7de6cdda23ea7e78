package com.budgetbridge.ynab.web;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RequestContextHolderTest {

    @AfterEach
    void tearDown() {
        RequestContextHolder.clear();
    }

    @Test
    void toolNameIsAddedToTheCurrentTrace() {
        RequestContextHolder.begin("trace-1");
        RequestContextHolder.setToolName("ynab_get_budgets");

        assertThat(RequestContextHolder.get())
                .contains(new RequestContextHolder.RequestContext("trace-1", "ynab_get_budgets"));
    }

    @Test
    void toolNameOutsideARequestIsIgnored() {
        RequestContextHolder.setToolName("ynab_get_budgets");

        assertThat(RequestContextHolder.get()).isEmpty();
    }

    @Test
    void clearRemovesTheContext() {
        RequestContextHolder.begin("trace-2");
        RequestContextHolder.clear();

        assertThat(RequestContextHolder.get()).isEmpty();
    }
}
