package snake.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Single-player simulation on a toroidal grid. The presentation layer feeds it input and
 * the current time once per frame and reads the accessors to draw; the engine moves a whole
 * number of tiles per call, measured from the last committed move.
 */
public final class GameEngine {
    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    public static final int INITIAL_SPEED = 5;
    public static final int MAX_SPEED = 30;
    public static final int MAX_PENDING = 3;

    public final GameConfig cfg;
    private final Random rnd;
    private final GameState state;

    public GameEngine(GameConfig cfg) { this(cfg, new Random()); }

    public GameEngine(GameConfig cfg, Random rnd) {
        this(cfg, rnd, new GameState(cfg.w(), cfg.h()));
        onReset();
    }

    GameEngine(GameConfig cfg, Random rnd, GameState state) {
        if (state.w != cfg.w() || state.h != cfg.h())
            throw new IllegalArgumentException("state is " + state.w + "x" + state.h + ", config " + cfg.w() + "x" + cfg.h());
        this.cfg = cfg;
        this.rnd = Objects.requireNonNull(rnd, "rnd");
        this.state = state;
    }

    public Pos head() {
        requireBody();
        return state.snake.peekLast();
    }

    public List<Pos> body() { return List.copyOf(state.snake); }

    public Optional<Pos> food() { return Optional.ofNullable(state.food); }

    public Phase phase() { return state.phase; }

    public int speed() { return state.speed; }

    public Dir direction() { return state.dir; }

    public List<Dir> pendingDirections() { return List.copyOf(state.pending); }

    public void onUpdate(long nowMs) {
        switch (state.phase) {
            case RUNNING -> {
                HitTarget hit = move(nowMs);
                switch (hit) {
                    case NONE -> { }
                    case SNAKE -> enter(Phase.LOSS);
                    case FOOD -> {
                        Phase next = consumeFood();
                        if (next == Phase.RUNNING) changeSpeed();
                        enter(next);
                    }
                }
            }
            case START, PAUSED, LOSS, WIN, QUIT -> { }
        }
    }

    public void tryChangeDirection(Dir d) {
        Objects.requireNonNull(d, "direction");
        switch (state.phase) {
            case RUNNING -> {
                if (d == nextDirection()) return;
                if (state.pending.size() >= MAX_PENDING) return;
                state.pending.addLast(d);
            }
            case START, PAUSED, LOSS, WIN, QUIT -> { }
        }
    }

    public void onTogglePause(long nowMs) {
        switch (state.phase) {
            case START -> {
                requireNotBefore(nowMs);
                reinit();
                state.food = placeFood();
                state.lastMoveMs = nowMs;
                enter(Phase.RUNNING);
            }
            case PAUSED -> {
                requireNotBefore(nowMs);
                state.lastMoveMs = nowMs;
                enter(Phase.RUNNING);
            }
            case RUNNING -> enter(Phase.PAUSED);
            case LOSS, WIN, QUIT -> { }
        }
    }

    public void onReset() {
        reinit();
        enter(Phase.START);
    }

    public void onQuit() {
        reinit();
        enter(Phase.QUIT);
    }

    private void reinit() {
        state.lastMoveMs = 0;
        state.speed = INITIAL_SPEED;
        state.dir = Dir.RIGHT;
        state.pending.clear();
        state.snake.clear();
        state.snake.addLast(new Pos(cfg.w() / 2, cfg.h() / 2));
        state.food = null;
    }

    private void enter(Phase next) {
        Phase prev = state.phase;
        state.phase = next;
        if (prev == next) return;
        switch (next) {
            case LOSS -> log.info("lost on {}x{} grid: length={}, speed={}", cfg.w(), cfg.h(), state.snake.size(), state.speed);
            case WIN -> log.info("won on {}x{} grid: speed={}", cfg.w(), cfg.h(), state.speed);
            case START, RUNNING, PAUSED, QUIT -> log.debug("phase {} -> {}", prev, next);
        }
    }

    HitTarget move(long nowMs) {
        requireBody();
        int tiles = tilesToMove(nowMs);
        if (tiles == 0) return HitTarget.NONE;

        state.dir = popDirection();
        state.lastMoveMs = nowMs;

        HitTarget hit = HitTarget.NONE;
        for (int i = 0; i < tiles; i++) {
            Pos next = state.step(head(), state.dir);
            state.snake.addLast(next);
            if (hit == HitTarget.SNAKE) continue;
            // tail cells this move has already left behind are not obstacles
            if (isInsideSnake(next, 1, i + 1)) hit = HitTarget.SNAKE;
            else if (next.equals(state.food)) hit = HitTarget.FOOD;
        }
        for (int i = 0; i < tiles; i++) state.snake.removeFirst();
        return hit;
    }

    int tilesToMove(long nowMs) {
        requireNotBefore(nowMs);
        long dt = nowMs - state.lastMoveMs;
        return (int) Math.round(state.speed * dt / 1000.0);
    }

    private Dir nextDirection() {
        Dir d = state.pending.peekFirst();
        return d == null ? state.dir : d;
    }

    private Dir popDirection() {
        Dir d = state.pending.pollFirst();
        if (d == null || d.opposite(state.dir)) return state.dir; // never reverse in place
        return d;
    }

    Phase consumeFood() {
        Pos tail = growthTail();
        state.snake.addFirst(tail);
        if (isInsideSnake(tail, 0, 1)) return Phase.LOSS;
        if (state.snake.size() == cfg.capacity()) {
            state.food = null;
            return Phase.WIN;
        }
        state.food = placeFood();
        return Phase.RUNNING;
    }

    Pos growthTail() {
        requireBody();
        Iterator<Pos> it = state.snake.iterator();
        Pos tail = it.next();
        Dir tailDir = it.hasNext() ? state.travel(tail, it.next()) : state.dir;

        Pos behind = state.step(tail, tailDir.reverse());
        if (!isInsideSnake(behind)) return behind;

        // near the seam "behind" can wrap onto the body, try sideways instead
        for (Dir side : tailDir.perpendicular()) {
            Pos p = state.step(tail, side);
            if (!isInsideSnake(p)) return p;
        }
        return behind;
    }

    boolean isInsideSnake(Pos p) { return isInsideSnake(p, 0, 0); }

    boolean isInsideSnake(Pos p, int skipHead, int skipTail) {
        int n = state.snake.size();
        if (skipHead < 0 || skipTail < 0 || skipHead + skipTail > n)
            throw new IllegalStateException("cannot skip " + skipTail + "+" + skipHead + " of " + n + " cells");
        // walk back from the head so a long move never rescans the tail it has left
        Iterator<Pos> it = state.snake.descendingIterator();
        for (int i = 0; i < skipHead; i++) it.next();
        for (int left = n - skipHead - skipTail; left > 0; left--) {
            if (it.next().equals(p)) return true;
        }
        return false;
    }

    Pos placeFood() {
        if (state.snake.size() >= cfg.capacity())
            throw new IllegalStateException("no free cell for food on a full " + cfg.w() + "x" + cfg.h() + " grid");
        Pos p;
        do {
            p = new Pos(rnd.nextInt(cfg.w()), rnd.nextInt(cfg.h()));
        } while (isInsideSnake(p));
        return p;
    }

    private void changeSpeed() {
        if (state.speed < MAX_SPEED) state.speed++;
    }

    private void requireBody() {
        if (state.snake.isEmpty()) throw new IllegalStateException("snake has no body");
    }

    private void requireNotBefore(long nowMs) {
        if (nowMs < state.lastMoveMs)
            throw new IllegalArgumentException("time went backwards: " + nowMs + " < " + state.lastMoveMs);
    }
}
