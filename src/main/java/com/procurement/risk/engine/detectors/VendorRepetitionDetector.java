package com.procurement.risk.engine.detectors;

import com.procurement.risk.config.RiskConfig;
import com.procurement.risk.engine.DetectionContext;
import com.procurement.risk.engine.PatternDetector;
import com.procurement.risk.model.AwardedContract;
import com.procurement.risk.model.PatternType;
import com.procurement.risk.model.ProcurementRecord;
import com.procurement.risk.model.RiskPattern;
import com.procurement.risk.report.GeneratedText;
import com.procurement.risk.report.NarrativeTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects a vendor winning repeatedly from the same department.
 *
 * Counts awards (including this one) from the vendor to the department in the
 * trailing window ending at this award date (365 days by default). A window of
 * N days covers the award date and the N - 1 days before it. Fires when the
 * count exceeds 3.
 *
 * Score = min(100, 40 + count*10 + totalCrores*5), floored at 70 when the
 * vendor's total from the department over the trailing 180 days exceeds 10,000,000.
 */
@Component
public class VendorRepetitionDetector implements PatternDetector {

    private static final double CRORE = 10_000_000.0;
    private static final double VALUE_FLOOR_SCORE = 70.0;

    private static final Comparator<AwardedContract> MOST_RECENT_FIRST =
            Comparator.comparing(AwardedContract::getAwardDate)
                    .thenComparing(AwardedContract::getTenderId)
                    .reversed();

    private final RiskConfig config;

    public VendorRepetitionDetector(RiskConfig config) {
        this.config = config;
    }

    @Override
    public PatternType getPatternType() {
        return PatternType.VENDOR_REPETITION;
    }

    @Override
    public boolean isApplicable(ProcurementRecord record) {
        return record.getAwardedVendorId() != null
                && record.getDepartmentId() != null
                && record.getAwardDate() != null;
    }

    @Override
    public Optional<RiskPattern> detect(ProcurementRecord record, DetectionContext context) {
        RiskConfig.Detection defaults = config.getDetection();
        LocalDate awardDate = record.getAwardDate();
        LocalDate windowStart = windowStart(awardDate, defaults.getVendorRepetitionWindowDays());

        List<AwardedContract> contracts = new ArrayList<>();
        for (AwardedContract award : context.getVendorAwards()) {
            if (record.getAwardedVendorId().equals(award.getVendorId())
                    && record.getDepartmentId().equals(award.getDepartmentId())
                    && !record.getTenderId().equals(award.getTenderId())
                    && !award.getAwardDate().isBefore(windowStart)
                    && !award.getAwardDate().isAfter(awardDate)) {
                contracts.add(award);
            }
        }
        contracts.add(AwardedContract.builder()
                .tenderId(record.getTenderId())
                .vendorId(record.getAwardedVendorId())
                .departmentId(record.getDepartmentId())
                .amount(record.getAwardedAmount() != null ? record.getAwardedAmount() : 0.0)
                .awardDate(awardDate)
                .build());

        int contractCount = contracts.size();
        if (contractCount < defaults.getVendorRepetitionMinContracts()) {
            return Optional.empty();
        }

        contracts.sort(MOST_RECENT_FIRST);

        double totalValue = contracts.stream().mapToDouble(AwardedContract::getAmount).sum();
        double totalCrores = totalValue / CRORE;
        LocalDate valueWindowStart = windowStart(awardDate, defaults.getVendorRepetitionValueWindowDays());
        double valueWindowTotal = contracts.stream()
                .filter(c -> !c.getAwardDate().isBefore(valueWindowStart))
                .mapToDouble(AwardedContract::getAmount)
                .sum();

        double score = Math.min(100.0, 40.0 + contractCount * 10.0 + totalCrores * 5.0);
        boolean floorApplied = valueWindowTotal > defaults.getVendorRepetitionValueFloorThreshold()
                && score < VALUE_FLOOR_SCORE;
        if (floorApplied) {
            score = VALUE_FLOOR_SCORE;
        }
        score = PatternDetector.clampScore(score);

        List<Map<String, Object>> contractEvidence = new ArrayList<>();
        for (AwardedContract c : contracts) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("tender_id", c.getTenderId());
            entry.put("award_date", c.getAwardDate().toString());
            entry.put("amount", c.getAmount());
            contractEvidence.add(Collections.unmodifiableMap(entry));
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("vendor_id", record.getAwardedVendorId());
        evidence.put("department_id", record.getDepartmentId());
        evidence.put("window_days", defaults.getVendorRepetitionWindowDays());
        evidence.put("contract_count", contractCount);
        evidence.put("total_value", totalValue);
        evidence.put("total_value_crores", totalCrores);
        evidence.put("value_window_days", defaults.getVendorRepetitionValueWindowDays());
        evidence.put("value_window_total", valueWindowTotal);
        evidence.put("value_floor_applied", floorApplied);
        evidence.put("contracts", Collections.unmodifiableList(contractEvidence));

        GeneratedText explanation = GeneratedText.of(NarrativeTemplate.VENDOR_REPETITION,
                record.getAwardedVendorId(), contractCount, record.getDepartmentId(),
                defaults.getVendorRepetitionWindowDays(), totalCrores);

        return Optional.of(RiskPattern.builder()
                .patternType(PatternType.VENDOR_REPETITION)
                .score(score)
                .evidence(Collections.unmodifiableMap(evidence))
                .explanation(explanation.getText())
                .templateId(explanation.getTemplateId())
                .build());
    }

    /**
     * First day of a trailing window of {@code days} days that ends on, and includes, {@code end}.
     */
    public static LocalDate windowStart(LocalDate end, int days) {
        return end.minusDays(days - 1L);
    }
}
