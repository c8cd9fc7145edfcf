package com.example.codescan.config;

import com.example.codescan.geometry.RegionMapper;
import com.example.codescan.metrics.ScanSessionMetrics;
import com.example.codescan.session.DetectionSelector;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Code scan core wiring.
 *
 * <p>
 * Hosts supply the capture/display collaborators per session and obtain sessions from
 * {@link ScanSessionFactory}. Every bean backs off when the host defines its own.
 * </p>
 */
@AutoConfiguration
@EnableConfigurationProperties(CodeScanProperties.class)
@ConditionalOnProperty(name = "codescan.enabled", havingValue = "true", matchIfMissing = true)
public class CodeScanAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RegionMapper regionMapper(CodeScanProperties props) {
        return new RegionMapper(props.getOversizePolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public DetectionSelector detectionSelector(CodeScanProperties props) {
        return new DetectionSelector(props.getSymbologies());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScanSessionMetrics scanSessionMetrics(ObjectProvider<MeterRegistry> registryProvider,
                                                 CodeScanProperties props) {
        return new ScanSessionMetrics(registryProvider.getIfAvailable(), props.getMetrics().isEnabled(),
                props.getMetrics().getPrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScanSessionFactory scanSessionFactory(CodeScanProperties props,
                                                 RegionMapper regionMapper,
                                                 DetectionSelector detectionSelector,
                                                 ScanSessionMetrics scanSessionMetrics) {
        return new ScanSessionFactory(props, regionMapper, detectionSelector, scanSessionMetrics);
    }
}
