package com.budgetbridge.ynab.config;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "ynab")
public record YnabProperties(
        Api api,
        Output output
) {

    @ConstructorBinding
    public YnabProperties {
        if (api == null) {
            throw new IllegalArgumentException("api configuration must be provided");
        }
        if (output == null) {
            throw new IllegalArgumentException("output configuration must be provided");
        }
    }

    public record Api(String baseUrl, String key, Integer connectTimeoutMs, Integer readTimeoutMs) {
        public Api {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("baseUrl must be provided");
            }
            // key may be blank at startup; calls fail individually until YNAB_API_KEY is set
            if (connectTimeoutMs == null || connectTimeoutMs <= 0) {
                connectTimeoutMs = 10_000;
            }
            if (readTimeoutMs == null || readTimeoutMs <= 0) {
                readTimeoutMs = 30_000;
            }
        }

        public boolean hasKey() {
            return key != null && !key.isBlank();
        }
    }

    public record Output(String directory, Integer characterLimit) {
        public Output {
            if (directory == null || directory.isBlank()) {
                throw new IllegalArgumentException("directory must be provided");
            }
            if (characterLimit == null) {
                characterLimit = 25_000;
            }
            if (characterLimit <= 0) {
                throw new IllegalArgumentException("characterLimit must be positive");
            }
        }

        public Path directoryPath() {
            return Path.of(directory);
        }
    }
}
