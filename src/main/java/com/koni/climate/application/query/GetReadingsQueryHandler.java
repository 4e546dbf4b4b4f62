package com.koni.climate.application.query;

import com.koni.climate.domain.exception.ValidationException;
import com.koni.climate.domain.model.ReadingQuery;
import com.koni.climate.domain.repository.ReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for reading back stored readings, ordered by timestamp.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetReadingsQueryHandler {

    static final int DEFAULT_LIMIT = 1000;
    static final int MAX_LIMIT = 10_000;

    private final ReadingRepository readingRepository;

    /**
     * Handles the GetReadingsQuery.
     *
     * @param query the filters
     * @return at most {@code limit} readings (default 1000, capped at 10000)
     * @throws ValidationException if the limit is not positive or the time window is empty
     */
    public List<ReadingResponse> handle(GetReadingsQuery query) {
        int limit = query.getLimit() == null ? DEFAULT_LIMIT : query.getLimit();
        if (limit < 1) {
            throw new ValidationException("limit must be positive, was " + limit);
        }
        if (query.getFrom() != null && query.getTo() != null && !query.getFrom().isBefore(query.getTo())) {
            throw new ValidationException("from must be before to");
        }
        limit = Math.min(limit, MAX_LIMIT);

        log.debug("Handling GetReadingsQuery: deviceId={}, sourceKind={}, from={}, to={}, anomalousOnly={}, limit={}",
                query.getDeviceId(), query.getSourceKind(), query.getFrom(), query.getTo(),
                query.isAnomalousOnly(), limit);

        ReadingQuery readingQuery = ReadingQuery.builder()
                .deviceId(query.getDeviceId())
                .sourceKind(query.getSourceKind())
                .from(query.getFrom())
                .to(query.getTo())
                .anomalousOnly(query.isAnomalousOnly())
                .limit(limit)
                .build();

        List<ReadingResponse> readings = readingRepository.query(readingQuery).stream()
                .map(ReadingResponse::from)
                .collect(Collectors.toList());

        log.info("Retrieved {} readings", readings.size());
        return readings;
    }
}
