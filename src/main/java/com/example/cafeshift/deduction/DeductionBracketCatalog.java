package com.example.cafeshift.deduction;

import com.example.cafeshift.config.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and replaces bracket tables. Loaded schedules are validated and cached per type until the
 * type's table is replaced.
 */
@Service
@Transactional
public class DeductionBracketCatalog {

    private static final Logger logger = LoggerFactory.getLogger(DeductionBracketCatalog.class);

    private final DeductionBracketRepository repository;

    public DeductionBracketCatalog(DeductionBracketRepository repository) {
        this.repository = repository;
    }

    @Cacheable(value = CacheConfig.DEDUCTION_BRACKETS, key = "#type")
    @Transactional(readOnly = true)
    public DeductionSchedule schedule(DeductionType type) {
        Map<LocalDate, List<DeductionBracketTable.Row>> rowsByVersion = new LinkedHashMap<>();
        for (DeductionBracket bracket : repository.findByTypeAndActiveTrueOrderByEffectiveFromAscMinSalaryAsc(type)) {
            rowsByVersion.computeIfAbsent(bracket.getEffectiveFrom(), d -> new ArrayList<>())
                    .add(new DeductionBracketTable.Row(bracket.getMinSalary(), bracket.getMaxSalary(),
                            bracket.getRate(), bracket.getFixedContribution(), bracket.getDescription()));
        }
        Map<LocalDate, DeductionBracketTable> versions = new LinkedHashMap<>();
        rowsByVersion.forEach((effectiveFrom, rows) ->
                versions.put(effectiveFrom, DeductionBracketTable.of(type, effectiveFrom, rows)));
        logger.debug("Loaded {} bracket table version(s) for {}", versions.size(), type);
        return new DeductionSchedule(type, versions);
    }

    /**
     * Validates {@code rows} and stores them as the {@code effectiveFrom} version of the type's
     * table, replacing any rows already stored for that version.
     */
    @CacheEvict(value = CacheConfig.DEDUCTION_BRACKETS, key = "#type")
    public DeductionBracketTable replaceTable(DeductionType type, LocalDate effectiveFrom, List<DeductionBracketTable.Row> rows) {
        DeductionBracketTable table = DeductionBracketTable.of(type, effectiveFrom, rows);
        int removed = repository.deleteVersion(type, effectiveFrom);
        for (DeductionBracketTable.Row row : table.getRows()) {
            repository.save(new DeductionBracket(type, effectiveFrom, row.minSalary(), row.maxSalary(),
                    row.rate(), row.fixedContribution(), row.description()));
        }
        logger.info("Replaced {} bracket table effective {}: {} row(s) removed, {} stored",
                type, effectiveFrom, removed, table.getRows().size());
        return table;
    }
}
