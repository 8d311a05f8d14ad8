package com.example.cafeshift.deduction;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Seeds the statutory bracket tables from {@code deduction-brackets.json} for every type that has
 * no rows yet.
 */
@Component
public class DeductionBracketDataInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(DeductionBracketDataInitializer.class);

    static final String SEED_RESOURCE = "deduction-brackets.json";

    private final DeductionBracketRepository repository;
    private final DeductionBracketCatalog catalog;
    private final ObjectMapper objectMapper;

    public DeductionBracketDataInitializer(DeductionBracketRepository repository,
                                           DeductionBracketCatalog catalog,
                                           ObjectMapper objectMapper) {
        this.repository = repository;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(String... args) throws Exception {
        List<SeedTable> tables;
        try (InputStream in = new ClassPathResource(SEED_RESOURCE).getInputStream()) {
            tables = objectMapper.readValue(in, new TypeReference<List<SeedTable>>() {});
        }
        for (SeedTable seed : tables) {
            if (repository.countByType(seed.type()) > 0) {
                logger.debug("{} brackets already present, skipping seed", seed.type());
                continue;
            }
            List<DeductionBracketTable.Row> rows = seed.brackets().stream()
                    .map(b -> new DeductionBracketTable.Row(b.minSalary(), b.maxSalary(), b.rate(),
                            b.fixedContribution(), b.description()))
                    .toList();
            catalog.replaceTable(seed.type(), seed.effectiveFrom(), rows);
        }
        logger.info("Deduction bracket seeding finished ({} table(s) in {})", tables.size(), SEED_RESOURCE);
    }

    record SeedTable(DeductionType type, LocalDate effectiveFrom, List<SeedBracket> brackets) {}

    record SeedBracket(BigDecimal minSalary, BigDecimal maxSalary, BigDecimal rate,
                       BigDecimal fixedContribution, String description) {}
}
