package snake.core;

import java.util.List;

public enum Dir {
    UP(0, -1), DOWN(0, 1), LEFT(-1, 0), RIGHT(1, 0);

    public final int dx, dy;
    Dir(int dx, int dy) { this.dx = dx; this.dy = dy; }

    public boolean opposite(Dir o) { return dx + o.dx == 0 && dy + o.dy == 0; }

    public Dir reverse() {
        return switch (this) {
            case UP -> DOWN;
            case DOWN -> UP;
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
        };
    }

    /** Both directions across this one's axis, in the order growth placement tries them. */
    public List<Dir> perpendicular() {
        return dy != 0 ? List.of(LEFT, RIGHT) : List.of(UP, DOWN);
    }

    public static Dir of(int dx, int dy) {
        for (Dir d : values()) {
            if (d.dx == dx && d.dy == dy) return d;
        }
        throw new IllegalArgumentException("not a unit step: (" + dx + ", " + dy + ")");
    }
}
