package com.budgetbridge.ynab.controller;

import com.budgetbridge.ynab.controller.dto.ToolListResponseDto;
import com.budgetbridge.ynab.error.ErrorClassifier;
import com.budgetbridge.ynab.error.ToolResult;
import com.budgetbridge.ynab.tools.ToolDispatcher;
import com.budgetbridge.ynab.tools.ToolRegistry;
import com.budgetbridge.ynab.web.RequestContextHolder;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tool invocation surface. A tool call always answers 200 with the tool's text, including
 * classified "Error: ..." text for failed calls; only an unknown tool name is an HTTP error.
 */
@RestController
@RequestMapping("/tools")
public class ToolController {

    private final ToolRegistry registry;
    private final ToolDispatcher dispatcher;
    private final ErrorClassifier errorClassifier;

    public ToolController(ToolRegistry registry, ToolDispatcher dispatcher, ErrorClassifier errorClassifier) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.errorClassifier = errorClassifier;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ToolListResponseDto listTools() {
        return new ToolListResponseDto(registry.descriptors());
    }

    @PostMapping(path = "/{name}", produces = MediaType.TEXT_PLAIN_VALUE)
    public String callTool(@PathVariable("name") String name, @RequestBody(required = false) JsonNode params) {
        RequestContextHolder.setToolName(name);
        ToolResult result = dispatcher.dispatch(name, params);
        return result.render(errorClassifier);
    }
}
