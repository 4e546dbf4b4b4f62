package com.koni.climate.infrastructure.web.controller;

import com.koni.climate.application.query.GetReadingsQuery;
import com.koni.climate.application.query.GetReadingsQueryHandler;
import com.koni.climate.application.query.ReadingResponse;
import com.koni.climate.domain.model.SourceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * REST controller for reading back stored readings.
 *
 * Endpoints:
 * - GET /api/v1/readings: readings ordered by timestamp, filtered by device, source kind,
 *   time window ({@code from} inclusive, {@code to} exclusive) and anomaly flag
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ReadingController {

    private final GetReadingsQueryHandler queryHandler;

    @GetMapping("/v1/readings")
    public ResponseEntity<List<ReadingResponse>> getReadings(
            @RequestParam(required = false) String deviceId,
            @RequestParam(required = false) String sourceKind,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(defaultValue = "false") boolean anomalousOnly,
            @RequestParam(required = false) Integer limit) {
        log.info("Received request for readings: deviceId={}, sourceKind={}, from={}, to={}",
                deviceId, sourceKind, from, to);

        GetReadingsQuery query = GetReadingsQuery.builder()
                .deviceId(deviceId)
                .sourceKind(sourceKind == null || sourceKind.isBlank() ? null : SourceKind.fromTag(sourceKind))
                .from(from)
                .to(to)
                .anomalousOnly(anomalousOnly)
                .limit(limit)
                .build();

        List<ReadingResponse> readings = queryHandler.handle(query);
        return ResponseEntity.ok(readings);
    }
}
