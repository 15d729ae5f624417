package com.example.relayserver.config;

import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.strategy.CheckboxDetectionStrategy;
import com.example.relayserver.strategy.DetectionStrategyDispatcher;
import com.example.relayserver.strategy.KeyedSectionDetectionStrategy;
import com.example.relayserver.strategy.LabeledFieldDetectionStrategy;
import com.example.relayserver.strategy.ModelProfileResolver;
import com.example.relayserver.util.checkbox.ToleranceCalibrator;
import com.example.relayserver.util.identity.EquipmentTagResolver;
import com.example.relayserver.util.normalize.MultipartGrouper;
import com.example.relayserver.util.normalize.UnitValueNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * 提取流水线组件装配
 */
@Configuration
@EnableConfigurationProperties(ExtractorProperties.class)
public class ExtractorConfig {

    @Bean
    public UnitValueNormalizer unitValueNormalizer(ExtractorProperties properties) {
        List<String> units = properties.getUnits().isEmpty() ? UnitValueNormalizer.DEFAULT_UNITS : properties.getUnits();
        return new UnitValueNormalizer(units,
                properties.getUnitAliases().isEmpty() ? UnitValueNormalizer.DEFAULT_ALIASES : properties.getUnitAliases());
    }

    @Bean
    public MultipartGrouper multipartGrouper(UnitValueNormalizer normalizer) {
        return new MultipartGrouper(normalizer);
    }

    @Bean
    public ModelProfileResolver modelProfileResolver(ObjectMapper objectMapper, ExtractorProperties properties) {
        List<RelayModelProfile> profiles = new RelayProfileLoader(objectMapper).load(properties.getProfilesLocation());
        return new ModelProfileResolver(profiles);
    }

    @Bean
    public DetectionStrategyDispatcher detectionStrategyDispatcher(ExtractorProperties properties) {
        boolean includeAmbiguous = properties.getAmbiguousPolicy() == ExtractorProperties.AmbiguousPolicy.INCLUDE;
        return new DetectionStrategyDispatcher(List.of(
                new CheckboxDetectionStrategy(includeAmbiguous),
                new LabeledFieldDetectionStrategy(properties.getEncodings()),
                new KeyedSectionDetectionStrategy(properties.getEncodings())));
    }

    @Bean
    public EquipmentTagResolver equipmentTagResolver(ExtractorProperties properties) {
        return new EquipmentTagResolver(properties.getTagPatterns());
    }

    @Bean
    public ToleranceCalibrator toleranceCalibrator() {
        return new ToleranceCalibrator();
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
