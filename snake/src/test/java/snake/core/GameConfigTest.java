package snake.core;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GameConfigTest {

    @Test
    void capacityIsTheCellCount() {
        assertThat(new GameConfig(40, 30).capacity()).isEqualTo(1200);
        assertThat(new GameConfig(1, 2).capacity()).isEqualTo(2);
    }

    @Test
    void rejectsGridsWithoutRoomForFood() {
        assertThatThrownBy(() -> new GameConfig(0, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GameConfig(5, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GameConfig(1, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsGridsWhoseCellCountOverflows() {
        assertThatThrownBy(() -> new GameConfig(65536, 65536)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GameConfig(Integer.MAX_VALUE, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new GameConfig(Integer.MAX_VALUE, 1).capacity()).isEqualTo(Integer.MAX_VALUE);
        assertThat(new GameConfig(46340, 46340).capacity()).isEqualTo(46340 * 46340);
    }
}
