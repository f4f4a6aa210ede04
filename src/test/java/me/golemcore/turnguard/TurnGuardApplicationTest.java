package me.golemcore.turnguard;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class TurnGuardApplicationTest {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(TurnGuardApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(TurnGuardApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(TurnGuardApplication.class.getMethod("main", String[].class));
    }
}
