package ai.chess.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.chess.game.PieceColor;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

/**
 * Binding of {@code chess.*} properties.
 */
class GamePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfiguration.class);

    @Test
    void defaultsMatchDocumentedValues() {
        runner.run(context -> {
            GameProperties properties = context.getBean(GameProperties.class);
            assertEquals(PieceColor.BLACK, properties.getAiColor());
            assertFalse(properties.isSelfPlay());
            assertEquals(500, properties.getMaxPlies());
            assertNull(properties.getAi().getSeed());
        });
    }

    @Test
    void bindsOverrides() {
        runner.withPropertyValues("chess.ai-color=white", "chess.self-play=true",
                        "chess.max-plies=40", "chess.ai.seed=42")
                .run(context -> {
                    GameProperties properties = context.getBean(GameProperties.class);
                    assertEquals(PieceColor.WHITE, properties.getAiColor());
                    assertTrue(properties.isSelfPlay());
                    assertEquals(40, properties.getMaxPlies());
                    assertEquals(42L, properties.getAi().getSeed());
                    assertEquals(new Random(42L).nextInt(1000),
                            properties.getAi().createRandom().nextInt(1000));
                });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(GameProperties.class)
    static class PropertiesConfiguration {
    }
}
