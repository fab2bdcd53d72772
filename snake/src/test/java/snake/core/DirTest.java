package snake.core;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DirTest {

    @Test
    void reverseNegatesBothComponents() {
        for (Dir d : Dir.values()) {
            assertThat(d.reverse().dx).isEqualTo(-d.dx);
            assertThat(d.reverse().dy).isEqualTo(-d.dy);
            assertThat(d.opposite(d.reverse())).isTrue();
            assertThat(d.opposite(d)).isFalse();
        }
    }

    @Test
    void perpendicularCrossesTheAxis() {
        assertThat(Dir.UP.perpendicular()).containsExactly(Dir.LEFT, Dir.RIGHT);
        assertThat(Dir.DOWN.perpendicular()).containsExactly(Dir.LEFT, Dir.RIGHT);
        assertThat(Dir.LEFT.perpendicular()).containsExactly(Dir.UP, Dir.DOWN);
        assertThat(Dir.RIGHT.perpendicular()).containsExactly(Dir.UP, Dir.DOWN);
    }

    @Test
    void ofFindsUnitSteps() {
        assertThat(Dir.of(0, -1)).isEqualTo(Dir.UP);
        assertThat(Dir.of(1, 0)).isEqualTo(Dir.RIGHT);
        assertThatThrownBy(() -> Dir.of(1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Dir.of(0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
