package me.golemcore.gateway;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class GatewayApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(GatewayApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(GatewayApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
        assertNotNull(GatewayApplication.class.getAnnotation(EnableAsync.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(GatewayApplication.class.getMethod("main", String[].class));
    }
}
