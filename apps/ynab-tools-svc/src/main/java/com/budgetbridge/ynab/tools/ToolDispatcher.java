package com.budgetbridge.ynab.tools;

import com.budgetbridge.ynab.error.ToolFailure;
import com.budgetbridge.ynab.error.ToolResult;
import com.budgetbridge.ynab.error.ToolValidationException;
import com.budgetbridge.ynab.validation.ToolParameterValidator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StringDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Binds a tool's JSON parameters to its request record, validates them and runs the handler. Every
 * failure past tool lookup is captured in the returned {@link ToolResult}.
 */
@Component
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolRegistry registry;
    private final ToolParameterValidator parameterValidator;
    private final ObjectMapper parameterMapper;

    public ToolDispatcher(ToolRegistry registry, ToolParameterValidator parameterValidator, ObjectMapper objectMapper) {
        this.registry = registry;
        this.parameterValidator = parameterValidator;
        this.parameterMapper = objectMapper.copy()
                .registerModule(new SimpleModule("tool-parameter-strings").addDeserializer(String.class, new StrippingStringDeserializer()))
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
    }

    /**
     * @throws UnknownToolException when no tool is registered under {@code name}
     */
    public ToolResult dispatch(String name, JsonNode params) {
        ToolDefinition<?> tool = registry.find(name).orElseThrow(() -> new UnknownToolException(name));
        long started = System.nanoTime();
        try {
            String output = invoke(tool, params == null || params.isNull() ? parameterMapper.createObjectNode() : params);
            log.info("tool_call name={} outcome=success elapsedMs={}", name, elapsedMs(started));
            return ToolResult.success(output);
        } catch (ToolValidationException ex) {
            log.debug("tool_call name={} outcome=invalid reason={}", name, ex.getMessage());
            return ToolResult.failure(ToolFailure.from(ex));
        } catch (RuntimeException ex) {
            ToolFailure failure = ToolFailure.from(ex);
            log.warn("tool_call name={} outcome={} elapsedMs={} reason={}", name, failure.kind(), elapsedMs(started), ex.getMessage());
            return ToolResult.failure(failure);
        }
    }

    private <T> String invoke(ToolDefinition<T> tool, JsonNode params) {
        T request = parameterValidator.validate(bind(params, tool.requestType()));
        return tool.handler().apply(request);
    }

    private <T> T bind(JsonNode params, Class<T> requestType) {
        if (!params.isObject()) {
            throw new ToolValidationException("parameters must be a JSON object");
        }
        try {
            return parameterMapper.treeToValue(params, requestType);
        } catch (JsonProcessingException ex) {
            throw new ToolValidationException("Invalid parameters: " + ex.getOriginalMessage(), ex);
        }
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    /**
     * Strips surrounding whitespace from every string parameter.
     */
    static final class StrippingStringDeserializer extends StringDeserializer {

        @Override
        public String deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            String value = super.deserialize(parser, context);
            return value == null ? null : value.strip();
        }
    }
}
