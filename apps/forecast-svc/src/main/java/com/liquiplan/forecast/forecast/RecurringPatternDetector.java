package com.liquiplan.forecast.forecast;

import com.liquiplan.forecast.model.AccountCategory;
import com.liquiplan.forecast.model.Booking;
import com.liquiplan.forecast.model.RecurringPattern;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Clusters bookings by normalized text and counterparty and classifies each cluster's cadence from
 * how often it occurred in the trailing window. Clusters whose rate falls between bands are dropped.
 */
@Component
public class RecurringPatternDetector {

    private static final Logger log = LoggerFactory.getLogger(RecurringPatternDetector.class);
    private static final Pattern DIGIT_RUNS = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE_RUNS = Pattern.compile("\\s+");
    private static final String DIGIT_PLACEHOLDER = "#";
    private static final String UNKNOWN_COUNTERPARTY = "unknown";
    private static final int MIN_OCCURRENCES = 2;

    private final AccountCategorizer categorizer;
    private final ForecastSettings settings;

    public RecurringPatternDetector(AccountCategorizer categorizer, ForecastSettings settings) {
        this.categorizer = categorizer;
        this.settings = settings;
    }

    public List<RecurringPattern> detect(List<Booking> bookings, LocalDate now) {
        if (bookings == null || bookings.isEmpty()) {
            return List.of();
        }
        Map<ClusterKey, List<Booking>> clusters = new LinkedHashMap<>();
        for (Booking booking : bookings) {
            String counterparty = booking.hasCounterparty() ? booking.counterparty().trim() : UNKNOWN_COUNTERPARTY;
            ClusterKey key = new ClusterKey(normalizeDescription(booking.text()), counterparty);
            clusters.computeIfAbsent(key, ignored -> new ArrayList<>()).add(booking);
        }

        LocalDate windowStart = now.minusDays(settings.trailingWindowDays());
        List<RecurringPattern> patterns = new ArrayList<>();
        for (Map.Entry<ClusterKey, List<Booking>> cluster : clusters.entrySet()) {
            List<Booking> members = cluster.getValue();
            if (members.size() < MIN_OCCURRENCES) {
                continue;
            }
            long recent = members.stream()
                    .filter(booking -> !booking.postingDate().isBefore(windowStart))
                    .count();
            if (recent == 0) {
                continue;
            }
            double annualRate = recent * settings.annualizationFactor();
            Optional<FrequencyBand> band = settings.bandFor(annualRate);
            if (band.isEmpty()) {
                continue;
            }
            patterns.add(toPattern(cluster.getKey(), members, band.get(), annualRate));
        }
        patterns.sort(Comparator.comparingInt(RecurringPattern::occurrences).reversed());
        log.debug("Recurring patterns: {} clusters, {} patterns detected", clusters.size(), patterns.size());
        return List.copyOf(patterns);
    }

    static String normalizeDescription(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String withoutDigits = DIGIT_RUNS.matcher(lower).replaceAll(DIGIT_PLACEHOLDER);
        return WHITESPACE_RUNS.matcher(withoutDigits).replaceAll(" ").trim();
    }

    private RecurringPattern toPattern(ClusterKey key, List<Booking> members, FrequencyBand band, double annualRate) {
        BigDecimal total = members.stream()
                .map(booking -> booking.amount().abs())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal averageAmount = total.divide(BigDecimal.valueOf(members.size()), 2, RoundingMode.HALF_UP);
        BigDecimal confidence = BigDecimal.valueOf(Math.min(1d, annualRate / band.nominalPerYear()))
                .setScale(2, RoundingMode.HALF_UP);
        double meanDay = members.stream()
                .mapToInt(booking -> booking.postingDate().getDayOfMonth())
                .average()
                .orElse(1d);
        int typicalDay = Math.max(1, (int) Math.round(meanDay));

        int account = members.get(0).account();
        AccountCategory category = categorizer.categorize(account);
        long distinctCategories = members.stream()
                .map(booking -> categorizer.categorize(booking.account()).name())
                .distinct()
                .count();
        if (distinctCategories > 1) {
            log.debug("Cluster '{}' spans {} categories; attributing to '{}'", key.description(), distinctCategories, category.name());
        }
        int rangeStart = Math.floorDiv(account, 100) * 100;

        return new RecurringPattern(
                key.description(),
                UNKNOWN_COUNTERPARTY.equals(key.counterparty()) ? null : key.counterparty(),
                averageAmount,
                band.frequency(),
                typicalDay,
                confidence,
                members.size(),
                category.direction(),
                category.name(),
                rangeStart,
                rangeStart + 99
        );
    }

    private record ClusterKey(String description, String counterparty) {
    }
}
