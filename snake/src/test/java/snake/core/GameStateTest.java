package snake.core;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GameStateTest {

    private final GameState st = new GameState(10, 7);

    @Test
    void stepWrapsAroundEveryEdge() {
        assertThat(st.step(new Pos(0, 3), Dir.LEFT)).isEqualTo(new Pos(9, 3));
        assertThat(st.step(new Pos(9, 3), Dir.RIGHT)).isEqualTo(new Pos(0, 3));
        assertThat(st.step(new Pos(4, 0), Dir.UP)).isEqualTo(new Pos(4, 6));
        assertThat(st.step(new Pos(4, 6), Dir.DOWN)).isEqualTo(new Pos(4, 0));
        assertThat(st.step(new Pos(4, 3), Dir.DOWN)).isEqualTo(new Pos(4, 4));
    }

    @Test
    void wrapKeepsEveryCellOnTheGrid() {
        for (int x = -25; x <= 25; x++) {
            for (int y = -25; y <= 25; y++) {
                Pos p = st.wrap(new Pos(x, y));
                assertThat(p.x()).isBetween(0, 9);
                assertThat(p.y()).isBetween(0, 6);
            }
        }
    }

    @Test
    void travelReadsTheSeamAsOneStep() {
        assertThat(st.travel(new Pos(9, 2), new Pos(0, 2))).isEqualTo(Dir.RIGHT);
        assertThat(st.travel(new Pos(0, 2), new Pos(9, 2))).isEqualTo(Dir.LEFT);
        assertThat(st.travel(new Pos(3, 0), new Pos(3, 6))).isEqualTo(Dir.UP);
        assertThat(st.travel(new Pos(3, 6), new Pos(3, 0))).isEqualTo(Dir.DOWN);
        assertThat(st.travel(new Pos(3, 3), new Pos(3, 4))).isEqualTo(Dir.DOWN);
    }

    @Test
    void travelRejectsCellsThatAreNotNeighbours() {
        assertThatThrownBy(() -> st.travel(new Pos(1, 1), new Pos(2, 2))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> st.travel(new Pos(1, 1), new Pos(4, 1))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> st.travel(new Pos(1, 1), new Pos(1, 1))).isInstanceOf(IllegalStateException.class);
    }
}
