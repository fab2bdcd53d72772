package snake.core;

public record Pos(int x, int y) {}
