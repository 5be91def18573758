package com.eventor;

import com.eventor.application.usecase.CollectCourseDistancesUseCase;
import com.eventor.domain.ports.CourseDistanceGateway;
import com.eventor.domain.ports.EventorGateway;
import com.eventor.infrastructure.eventor.EventorApiClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "eventor.api.token=test-token")
class EventorClientApplicationTests {

    @Autowired
    private EventorGateway eventorGateway;

    @Autowired
    private CourseDistanceGateway courseDistanceGateway;

    @Autowired
    private CollectCourseDistancesUseCase collectCourseDistancesUseCase;

    @Test
    void contextLoads() {
        assertInstanceOf(EventorApiClient.class, eventorGateway);
        assertNotNull(courseDistanceGateway);
        assertNotNull(collectCourseDistancesUseCase);
    }
}
