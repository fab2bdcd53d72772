package snake.core;

public record GameConfig(int w, int h) {
    public GameConfig {
        if (w < 1 || h < 1) throw new IllegalArgumentException("grid must be positive: " + w + "x" + h);
        if ((long) w * h < 2) throw new IllegalArgumentException("grid must hold at least two cells: " + w + "x" + h);
        if ((long) w * h > Integer.MAX_VALUE) throw new IllegalArgumentException("grid has too many cells: " + w + "x" + h);
    }

    public int capacity() { return w * h; }
}
