package com.stpa.coverage.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.stpa.coverage.model.CandidateCombination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Serializes a ranked candidate list for hand-off to reviewers.
 */
@Service
public class CombinationExportService {

    private static final Logger log = LoggerFactory.getLogger(CombinationExportService.class);

    static final String CSV_HEADER =
            "rank,signature,controllerIds,actionIds,abstraction,type,riskScore,riskBand,rationale";

    private final ObjectMapper objectMapper;

    public CombinationExportService() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public enum Format {
        JSON, CSV;

        public static Format parse(String value) {
            if (value == null || value.isBlank()) return JSON;
            try {
                return Format.valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unsupported export format: " + value + " (expected json or csv)");
            }
        }
    }

    public String export(List<CandidateCombination> ranked, Format format) {
        log.debug("Exporting {} candidate(s) as {}", ranked.size(), format);
        return format == Format.CSV ? toCsv(ranked) : toJson(ranked);
    }

    public String toJson(List<CandidateCombination> ranked) {
        try {
            return objectMapper.writeValueAsString(ranked);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ranked candidates", e);
        }
    }

    /** One header line plus one line per candidate, rank starting at 1. Lines end with {@code \n}. */
    public String toCsv(List<CandidateCombination> ranked) {
        StringBuilder sb = new StringBuilder(CSV_HEADER).append('\n');
        int rank = 1;
        for (CandidateCombination c : ranked) {
            sb.append(rank++).append(',')
                    .append(escape(c.getSignature())).append(',')
                    .append(escape(String.join(";", c.getControllerIds()))).append(',')
                    .append(escape(String.join(";", c.getActionIds()))).append(',')
                    .append(c.getAbstraction()).append(',')
                    .append(c.getType()).append(',')
                    .append(c.getRiskScore()).append(',')
                    .append(c.getRiskBand() == null ? "" : c.getRiskBand().name()).append(',')
                    .append(escape(c.getRationale()))
                    .append('\n');
        }
        return sb.toString();
    }

    // RFC 4180 quoting
    static String escape(String value) {
        if (value == null) return "";
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
