package com.procurement.risk.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.procurement.risk.exception.ConfigurationException;
import com.procurement.risk.model.AwardedContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class InMemoryAwardHistoryProvider implements AwardHistoryProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAwardHistoryProvider.class);

    private static final Comparator<AwardedContract> MOST_RECENT_FIRST =
            Comparator.comparing(AwardedContract::getAwardDate)
                    .thenComparing(AwardedContract::getTenderId)
                    .reversed();

    private final Map<String, List<AwardedContract>> awardsByVendorAndDepartment;

    public InMemoryAwardHistoryProvider(List<AwardedContract> awards) {
        Map<String, List<AwardedContract>> byKey = new HashMap<>();
        for (AwardedContract award : awards) {
            if (award.getVendorId() == null || award.getDepartmentId() == null || award.getAwardDate() == null) {
                throw new ConfigurationException("Award history entry missing vendor, department or date: " + award);
            }
            byKey.computeIfAbsent(key(award.getVendorId(), award.getDepartmentId()), k -> new ArrayList<>()).add(award);
        }
        byKey.values().forEach(list -> list.sort(MOST_RECENT_FIRST));
        byKey.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.awardsByVendorAndDepartment = Collections.unmodifiableMap(byKey);
    }

    public static InMemoryAwardHistoryProvider fromResource(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            log.warn("Award history resource {} not found; vendor repetition will only see the current award", resource);
            return new InMemoryAwardHistoryProvider(Collections.emptyList());
        }
        try (InputStream in = resource.getInputStream()) {
            List<AwardedContract> awards = objectMapper.readValue(in, new TypeReference<List<AwardedContract>>() {});
            log.info("Loaded {} past awards from {}", awards.size(), resource);
            return new InMemoryAwardHistoryProvider(awards);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read award history from " + resource, e);
        }
    }

    @Override
    public List<AwardedContract> findAwards(String vendorId, String departmentId, LocalDate from, LocalDate to) {
        return awardsByVendorAndDepartment.getOrDefault(key(vendorId, departmentId), Collections.emptyList())
                .stream()
                .filter(a -> !a.getAwardDate().isBefore(from) && !a.getAwardDate().isAfter(to))
                .toList();
    }

    private static String key(String vendorId, String departmentId) {
        return vendorId + "|" + departmentId;
    }
}
