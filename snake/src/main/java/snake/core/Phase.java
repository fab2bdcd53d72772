package snake.core;

public enum Phase { START, RUNNING, PAUSED, LOSS, WIN, QUIT }
