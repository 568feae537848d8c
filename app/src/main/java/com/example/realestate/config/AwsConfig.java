package com.example.realestate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

@Configuration
public class AwsConfig {

    private static final Logger log = LoggerFactory.getLogger(AwsConfig.class);

    @Value("${app.aws.region:ap-northeast-1}")
    private String region;

    @Value("${app.aws.localstack.enabled:false}")
    private boolean localstackEnabled;

    @Value("${app.aws.localstack.endpoint:http://localhost:4566}")
    private String localstackEndpoint;

    @Bean
    public S3Client s3Client() {
        S3ClientBuilder builder = S3Client.builder().region(Region.of(region));
        if (localstackEnabled) {
            log.info("Configurando cliente S3 para LocalStack em: {}", localstackEndpoint);
            // LocalStack não resolve buckets como subdomínio
            return builder.endpointOverride(URI.create(localstackEndpoint))
                    .forcePathStyle(true)
                    .build();
        }
        log.info("Configurando cliente S3 para AWS Cloud na região: {}", region);
        return builder.build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.LOWER_CAMEL_CASE);
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
