package snake.core;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Everything a single game owns. Only {@link GameEngine} mutates it; the body is kept
 * tail first, head last.
 */
public final class GameState {
    public final int w, h;
    final Deque<Pos> snake = new ArrayDeque<>();
    final Deque<Dir> pending = new ArrayDeque<>();

    Pos food; // null while absent
    Dir dir = Dir.RIGHT;
    int speed; // tiles per second
    long lastMoveMs;
    Phase phase = Phase.START;

    public GameState(int w, int h) { this.w = w; this.h = h; }

    public Pos wrap(Pos p) {
        int x = p.x() % w; if (x < 0) x += w;
        int y = p.y() % h; if (y < 0) y += h;
        return new Pos(x, y);
    }

    public Pos step(Pos from, Dir d) { return wrap(new Pos(from.x() + d.dx, from.y() + d.dy)); }

    /**
     * Direction of travel from {@code from} into the adjacent cell {@code to}, reading a
     * difference of {@code dimension - 1} across the seam as a single step back.
     */
    public Dir travel(Pos from, Pos to) {
        if (from.x() != to.x() && from.y() != to.y())
            throw new IllegalStateException("cells are not on one line: " + from + ", " + to);
        int dx = unit(to.x() - from.x(), w);
        int dy = unit(to.y() - from.y(), h);
        if (dx == 0 && dy == 0) throw new IllegalStateException("cells coincide: " + from);
        return Dir.of(dx, dy);
    }

    private static int unit(int ds, int max) {
        if (max > 1) {
            if (ds == max - 1) ds = -1;
            else if (ds == -(max - 1)) ds = 1;
        }
        if (ds < -1 || ds > 1) throw new IllegalStateException("cells are not adjacent, delta " + ds);
        return ds;
    }
}
