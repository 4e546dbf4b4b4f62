package com.koni.climate.application.collector;

import com.koni.climate.application.command.IngestionResult;
import com.koni.climate.application.command.RecordReadingCommand;
import com.koni.climate.application.command.RecordReadingCommandHandler;
import com.koni.climate.infrastructure.resilience.ErrorClassifier;
import com.koni.climate.infrastructure.resilience.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * One poll of one source followed by sequential ingestion of every reading.
 *
 * A failing device never aborts the cycle. An interrupt is honoured between
 * readings only, so no reading is left half persisted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CollectionCycle {

    private final RecordReadingCommandHandler commandHandler;
    private final RetryPolicy retryPolicy;

    public CycleSummary run(DeviceSource source) {
        List<RecordReadingCommand> commands;
        try {
            commands = retryPolicy.execute("poll " + source.kind().getTag(), () -> poll(source),
                    ErrorClassifier.network());
        } catch (RuntimeException e) {
            log.error("Polling {} failed, skipping this cycle: {}", source.kind().getTag(), e.getMessage(), e);
            return new CycleSummary(source.kind(), 0, 0, 0, 0, 0, true, false);
        }

        int inserted = 0;
        int duplicates = 0;
        int rejected = 0;
        int failed = 0;
        boolean interrupted = false;
        for (RecordReadingCommand command : commands) {
            if (Thread.currentThread().isInterrupted()) {
                interrupted = true;
                log.info("Collection of {} interrupted after {} of {} readings",
                        source.kind().getTag(), inserted + duplicates + rejected + failed, commands.size());
                break;
            }
            IngestionResult result;
            try {
                result = commandHandler.handle(command);
            } catch (RuntimeException e) {
                log.error("Unexpected failure ingesting a {} reading", source.kind().getTag(), e);
                failed++;
                continue;
            }
            switch (result.getStatus()) {
                case INSERTED:
                    inserted++;
                    break;
                case DUPLICATE:
                    duplicates++;
                    break;
                case REJECTED:
                    rejected++;
                    break;
                default:
                    failed++;
                    break;
            }
        }

        CycleSummary summary = new CycleSummary(source.kind(), commands.size(), inserted, duplicates, rejected,
                failed, false, interrupted);
        log.info("Collection cycle finished: {}", summary);
        return summary;
    }

    private static List<RecordReadingCommand> poll(DeviceSource source) {
        try {
            List<RecordReadingCommand> commands = source.poll();
            return commands == null ? List.of() : commands;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
