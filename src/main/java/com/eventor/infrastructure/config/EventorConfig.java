package com.eventor.infrastructure.config;

import com.eventor.domain.ports.CourseDistanceGateway;
import com.eventor.domain.ports.EventorGateway;
import com.eventor.infrastructure.eventor.EventorApiClient;
import com.eventor.infrastructure.http.HttpClientTransport;
import com.eventor.infrastructure.http.HttpTransport;
import com.eventor.infrastructure.scraper.CourseDistanceScraper;
import com.eventor.infrastructure.xml.XmlDecoder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Eventor client configuration.
 */
@Configuration
public class EventorConfig {

    @Value("${eventor.api.base-url:https://eventor.orientering.se/api}")
    private String baseUrl;

    @Value("${eventor.api.token:${EVENTOR_API_TOKEN:}}")
    private String apiToken;

    @Value("${eventor.web.result-list-url:https://eventor.orientering.se/Events/ResultList}")
    private String resultListUrl;

    @Bean
    public HttpClientTransport httpTransport() {
        return new HttpClientTransport(HttpClients.createDefault());
    }

    @Bean
    public XmlDecoder xmlDecoder() {
        return new XmlDecoder();
    }

    @Bean
    public EventorGateway eventorGateway(HttpTransport httpTransport, XmlDecoder xmlDecoder) {
        return new EventorApiClient(httpTransport, xmlDecoder, baseUrl, apiToken);
    }

    @Bean
    public CourseDistanceGateway courseDistanceGateway(HttpTransport httpTransport) {
        return new CourseDistanceScraper(httpTransport, resultListUrl);
    }
}
