package com.budgetbridge.ynab.health;

import com.budgetbridge.ynab.config.YnabProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight health endpoint. Reports whether an API credential is configured but never calls YNAB.
 */
@RestController
public class HealthzController {

    private final YnabProperties properties;

    public HealthzController(YnabProperties properties) {
        this.properties = properties;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("credentialConfigured", properties.api().hasKey());
        return body;
    }
}
