package com.propertyintel.leads.config;

import com.propertyintel.leads.service.ScoringWeights;
import com.propertyintel.leads.usage.LoggingUsageMeter;
import com.propertyintel.leads.usage.UsageMeter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class LeadRadarConfig {

    @Bean
    public RestTemplate realieRestTemplate(RestTemplateBuilder builder, LeadRadarProperties properties) {
        Duration timeout = Duration.ofMillis(properties.getRealie().getRequestTimeoutMs());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Bean
    public ScoringWeights scoringWeights(LeadRadarProperties properties) {
        LeadRadarProperties.Scoring scoring = properties.getScoring();
        ScoringWeights weights = ScoringWeights.normalise(
                scoring.getEquityWeight(), scoring.getValueGapWeight(), scoring.getRecencyWeight());
        log.info("Scoring weights normalised to equity={} value_gap={} recency={}",
                weights.equity(), weights.valueGap(), weights.recency());
        return weights;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(UsageMeter.class)
    public UsageMeter usageMeter() {
        return new LoggingUsageMeter();
    }
}
