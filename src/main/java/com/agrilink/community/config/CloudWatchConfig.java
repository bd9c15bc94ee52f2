package com.agrilink.community.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.util.Map;

/**
 * Publishes the agrilink.* meters to CloudWatch.
 * Active only with cloud.aws.cloudwatch.enabled=true; otherwise the actuator's default registry is used.
 *
 * @author AgriLink Team
 */
@Configuration
@ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true")
public class CloudWatchConfig {

    @Bean
    public CloudWatchAsyncClient cloudWatchAsyncClient(@Value("${cloud.aws.region:us-east-1}") String region) {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * Registry fed from the cloud.aws.cloudwatch.* properties. Every meter is tagged with the
     * application name so several deployments can share a namespace.
     */
    @Bean
    public MeterRegistry meterRegistry(
            CloudWatchAsyncClient client,
            @Value("${cloud.aws.cloudwatch.namespace:AgriLink}") String namespace,
            @Value("${cloud.aws.cloudwatch.batch-size:20}") int batchSize,
            @Value("${cloud.aws.cloudwatch.step:PT1M}") String step,
            @Value("${spring.application.name:agrilink-community}") String application
    ) {
        Map<String, String> settings = Map.of(
                "cloudwatch.namespace", namespace,
                "cloudwatch.batchSize", String.valueOf(batchSize),
                "cloudwatch.step", step);
        io.micrometer.cloudwatch2.CloudWatchConfig config = settings::get;

        CloudWatchMeterRegistry registry = new CloudWatchMeterRegistry(config, Clock.SYSTEM, client);
        registry.config()
                .commonTags("application", application)
                .meterFilter(MeterFilter.acceptNameStartsWith("agrilink"))
                .meterFilter(MeterFilter.deny());
        return registry;
    }
}
