package com.motaz.fraudscan.seed;

import com.motaz.fraudscan.seed.service.ClaimDataPreparationService;
import com.motaz.fraudscan.seed.service.SeedSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@Slf4j
@SpringBootApplication
public class ClaimSeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClaimSeedApplication.class, args);
    }

    @Bean
    public CommandLineRunner seedClaims(ClaimDataPreparationService claimDataPreparationService) {
        return args -> {
            log.info("Preparing synthetic claims...");
            SeedSummary summary = claimDataPreparationService.prepareData();
            log.info("Preparing synthetic claims Completed... {}", summary);
        };
    }
}
