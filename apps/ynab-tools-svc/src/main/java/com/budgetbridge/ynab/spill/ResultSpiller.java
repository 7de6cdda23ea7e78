package com.budgetbridge.ynab.spill;

import com.budgetbridge.ynab.config.YnabProperties;
import com.budgetbridge.ynab.error.SpillWriteException;
import com.budgetbridge.ynab.render.JsonDocumentWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Returns a transaction report inline or writes it to a file and returns a short receipt instead.
 *
 * <p>Files are never read back or deleted here. Two generated names within the same second collide and
 * the later write wins.
 */
@Component
public class ResultSpiller {

    private static final Logger log = LoggerFactory.getLogger(ResultSpiller.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path outputDirectory;
    private final int characterLimit;
    private final JsonDocumentWriter jsonWriter;
    private final Clock clock;

    @Autowired
    public ResultSpiller(YnabProperties properties, JsonDocumentWriter jsonWriter) {
        this(properties, jsonWriter, Clock.systemDefaultZone());
    }

    ResultSpiller(YnabProperties properties, JsonDocumentWriter jsonWriter, Clock clock) {
        this.outputDirectory = properties.output().directoryPath();
        this.characterLimit = properties.output().characterLimit();
        this.jsonWriter = jsonWriter;
        this.clock = clock;
    }

    /**
     * @param report       full report including its transactions
     * @param kind         collection kind, used for the file prefix and message
     * @param outputToFile always write to a file when {@code true}
     * @param outputPath   explicit target file; {@code null} for a generated name under the output directory
     * @return receipt JSON when a file was written, otherwise the inline report JSON
     * @throws SpillWriteException when the file cannot be written
     */
    public String maybeSpill(TransactionReport report, SpillKind kind, boolean outputToFile, String outputPath) {
        if (outputToFile) {
            Path written = write(report, kind, outputPath);
            return receipt(report, written, kind.writtenMessage(report, written.toString()));
        }
        String inline = jsonWriter.write(report);
        if (inline.length() <= characterLimit) {
            return inline;
        }
        Path written = write(report, kind, outputPath);
        log.info("spill_oversized kind={} chars={} limit={} path={}", kind, inline.length(), characterLimit, written);
        return receipt(report, written, kind.tooLargeMessage(inline.length(), written.toString()));
    }

    Path resolveTarget(SpillKind kind, String outputPath) {
        if (outputPath != null && !outputPath.isBlank()) {
            return Path.of(outputPath);
        }
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        return outputDirectory.resolve(kind.filePrefix() + "_" + timestamp + ".json");
    }

    private Path write(TransactionReport report, SpillKind kind, String outputPath) {
        Path target = resolveTarget(kind, outputPath);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, jsonWriter.write(report), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new SpillWriteException(target, ex);
        }
        log.info("spill_written kind={} count={} path={}", kind, report.count(), target);
        return target;
    }

    private String receipt(TransactionReport report, Path written, String message) {
        return jsonWriter.write(new SpillReceipt(
                report.query(),
                report.count(),
                report.totalMilliunits(),
                report.total(),
                written.toString(),
                message
        ));
    }
}
