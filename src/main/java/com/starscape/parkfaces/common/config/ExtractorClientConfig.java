package com.starscape.parkfaces.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client used to reach the face embedding service.
 * Timeouts here bound every extraction call, including the ones made at identify time.
 */
@Configuration
public class ExtractorClientConfig {

    @Bean
    public RestTemplate extractorRestTemplate(FaceProperties faceProperties) {
        FaceProperties.Extractor extractor = faceProperties.getExtractor();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) extractor.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) extractor.getReadTimeout().toMillis());
        return new RestTemplate(factory);
    }
}
