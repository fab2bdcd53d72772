package snake.core;

enum HitTarget { NONE, SNAKE, FOOD }
