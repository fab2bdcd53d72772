package snake.ui;

import com.googlecode.lanterna.input.KeyStroke;
import com.googlecode.lanterna.input.KeyType;
import snake.core.Dir;

/** Turns raw key strokes into the four directions plus pause, reset and quit. */
public final class LanternaInput {
    public enum Action { NONE, QUIT, RESET, PAUSE_TOGGLE }

    public record Input(Action action, Dir dir) {}

    public Input map(KeyStroke k) {
        if (k == null) return new Input(Action.NONE, null);

        if (k.getKeyType() == KeyType.EOF) return new Input(Action.QUIT, null);
        if (k.getKeyType() == KeyType.Escape) return new Input(Action.RESET, null);

        if (k.getKeyType() == KeyType.Character) {
            char c = Character.toLowerCase(k.getCharacter());
            if (c == 'q') return new Input(Action.QUIT, null);
            if (c == ' ') return new Input(Action.PAUSE_TOGGLE, null);

            Dir d = switch (c) {
                case 'w' -> Dir.UP;
                case 's' -> Dir.DOWN;
                case 'a' -> Dir.LEFT;
                case 'd' -> Dir.RIGHT;
                default -> null;
            };
            return new Input(Action.NONE, d);
        }

        Dir d = switch (k.getKeyType()) {
            case ArrowUp -> Dir.UP;
            case ArrowDown -> Dir.DOWN;
            case ArrowLeft -> Dir.LEFT;
            case ArrowRight -> Dir.RIGHT;
            default -> null;
        };
        return new Input(Action.NONE, d);
    }
}
