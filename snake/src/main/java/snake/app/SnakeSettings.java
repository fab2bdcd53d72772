package snake.app;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import snake.core.GameConfig;

import java.time.Duration;

/**
 * Start-up settings read from the {@code snake} block of the HOCON configuration.
 * {@link ConfigFactory#load()} layers system properties over {@code application.conf}
 * over the {@code reference.conf} shipped in the jar.
 */
public record SnakeSettings(int width, int height, Duration frameDelay, boolean debugOutline) {
    public SnakeSettings {
        if (frameDelay.isNegative()) throw new IllegalArgumentException("snake.frame-delay must not be negative: " + frameDelay);
    }

    public static SnakeSettings load() { return from(ConfigFactory.load()); }

    public static SnakeSettings from(Config root) {
        Config c = root.getConfig("snake");
        return new SnakeSettings(
                c.getInt("grid.width"),
                c.getInt("grid.height"),
                c.getDuration("frame-delay"),
                c.getBoolean("debug-outline"));
    }

    public GameConfig gameConfig() { return new GameConfig(width, height); }
}
