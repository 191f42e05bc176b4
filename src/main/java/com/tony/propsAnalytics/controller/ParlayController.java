package com.tony.propsAnalytics.controller;

import com.tony.propsAnalytics.exception.InvalidOddsException;
import com.tony.propsAnalytics.model.Leg;
import com.tony.propsAnalytics.model.dto.OddsConversion;
import com.tony.propsAnalytics.model.dto.ParlayAnalysisRequest;
import com.tony.propsAnalytics.model.dto.ParlayAnalysisResponse;
import com.tony.propsAnalytics.service.ParlayAnalysisService;
import com.tony.propsAnalytics.util.OddsMath;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.util.Precision;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/parlays")
@RequiredArgsConstructor
@Slf4j
public class ParlayController {
    private final ParlayAnalysisService parlayAnalysisService;

    @PostMapping
    public ResponseEntity<ParlayAnalysisResponse> generateParlays(@Valid @RequestBody ParlayAnalysisRequest request) {
        return ResponseEntity.ok(parlayAnalysisService.analyze(request));
    }

    // Tableau des props notées (sans parlay)
    @PostMapping("/legs")
    public ResponseEntity<List<Leg>> gradeLegs(@Valid @RequestBody ParlayAnalysisRequest request) {
        return ResponseEntity.ok(parlayAnalysisService.gradeLegs(request));
    }

    @GetMapping("/odds/convert")
    public ResponseEntity<OddsConversion> convertOdds(@RequestParam Integer american) {
        double decimal = OddsMath.americanToDecimal(american);
        return ResponseEntity.ok(new OddsConversion(
                american,
                Precision.round(decimal, 4),
                Precision.round(OddsMath.impliedProbability(american), 4)));
    }

    @ExceptionHandler(InvalidOddsException.class)
    public ResponseEntity<Map<String, String>> handleInvalidOdds(InvalidOddsException e) {
        log.warn("Requête rejetée : {}", e.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", e.getMessage()));
    }
}
