package com.motaz.fraudscan.config;

import com.motaz.fraudscan.services.AlertPreferenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fraud.preferences.cache-on-startup", havingValue = "true", matchIfMissing = true)
public class LoadAlertPreferenceConfig {

    private final AlertPreferenceService alertPreferenceService;

    @Bean
    ApplicationRunner initAlertPreferenceRunner() {
        return args -> alertPreferenceService.cacheAlertPreferences();
    }

}
