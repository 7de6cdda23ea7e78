package com.budgetbridge.ynab.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Serializes structured tool output as two-space indented JSON with {@code "key": value} spacing.
 */
@Component
public class JsonDocumentWriter {

    private final ObjectWriter writer;

    public JsonDocumentWriter(ObjectMapper objectMapper) {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance().withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        this.writer = objectMapper.writer(printer);
    }

    /**
     * Acknowledgement of a write operation: {@code {"success": true, "<field>": entity}}.
     */
    public String success(String field, Object entity) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("success", true);
        document.put(field, entity);
        return write(document);
    }

    public String write(Object document) {
        try {
            return writer.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize response: " + ex.getOriginalMessage(), ex);
        }
    }
}
